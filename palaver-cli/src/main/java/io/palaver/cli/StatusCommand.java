package io.palaver.cli;

import io.palaver.core.config.model.PalaverConfig;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show the effective configuration and registered flows")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            PalaverConfig config = context.configService().load(context.configPath());
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Session backend: " + config.session().backend());
            System.out.println("Session boundary: " + config.session().boundary());
            System.out.println("Session TTL seconds: " + config.session().ttlSeconds());
            System.out.println("Max page size: " + config.pagination().maxPageSize());
            System.out.println("Gateway: " + config.gateway().host() + ":" + config.gateway().port());
            System.out.println("Flows: " + String.join(", ", context.flows().names()));
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
