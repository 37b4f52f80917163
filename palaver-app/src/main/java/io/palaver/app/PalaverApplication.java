package io.palaver.app;

import io.palaver.cli.CliContext;
import io.palaver.cli.PalaverCli;
import io.palaver.core.api.ConversationGateway;
import io.palaver.core.config.ConfigPaths;
import io.palaver.core.config.ConfigService;
import io.palaver.core.config.model.PalaverConfig;
import io.palaver.core.engine.ConversationEngine;
import io.palaver.core.flow.FlowRegistry;
import io.palaver.core.flow.FlowRoute;
import io.palaver.core.session.DocumentSessionStore;
import io.palaver.core.session.SessionBackend;
import io.palaver.core.session.SessionBackends;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class PalaverApplication {
    private static final Logger LOG = LoggerFactory.getLogger(PalaverApplication.class);

    private PalaverApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();
        FlowRegistry flows = defaultFlows();

        CliContext context = new CliContext(
            configService,
            configPath,
            flows,
            (host, port) -> runGateway(configService, configPath, flows, host, port)
        );
        int exitCode = PalaverCli.commandLine(context).execute(args);
        System.exit(exitCode);
    }

    static FlowRegistry defaultFlows() {
        return new FlowRegistry()
            .register(FlowRoute.of("restaurant", DemoRestaurantFlow::new, DemoRestaurantFlow::main));
    }

    static ConversationEngine buildEngine(PalaverConfig config, FlowRegistry flows) throws Exception {
        SessionBackend backend = SessionBackends.fromConfig(config.session());
        Duration ttl = config.session().ttlSeconds() > 0 ? Duration.ofSeconds(config.session().ttlSeconds()) : null;
        return new ConversationEngine(config, flows, DocumentSessionStore.factory(backend, ttl));
    }

    private static int runGateway(
        ConfigService configService,
        Path configPath,
        FlowRegistry flows,
        String hostOverride,
        Integer portOverride
    ) throws Exception {
        PalaverConfig config = configService.load(configPath);
        String host = hostOverride != null ? hostOverride : config.gateway().host();
        int port = portOverride != null ? portOverride : config.gateway().port();
        ConversationEngine engine = buildEngine(config, flows);

        CountDownLatch shutdown = new CountDownLatch(1);
        try (ConversationGateway gateway = new ConversationGateway(engine, host, port, config.prompts())) {
            Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown));
            gateway.start();
            LOG.info("Session backend {} with {} boundary", config.session().backend(), config.session().boundary());
            System.out.println("Gateway started on http://127.0.0.1:" + gateway.port());
            System.out.println("Endpoints: POST /turns, GET /healthz");
            shutdown.await();
        }
        return 0;
    }
}
