package io.palaver.cli;

import io.palaver.core.config.ConfigService;
import io.palaver.core.flow.FlowRegistry;
import java.nio.file.Path;

public record CliContext(
    ConfigService configService,
    Path configPath,
    FlowRegistry flows,
    GatewayRunner gatewayRunner
) {
    public CliContext(ConfigService configService, Path configPath, FlowRegistry flows) {
        this(configService, configPath, flows, (host, port) -> {
            throw new UnsupportedOperationException("gateway runner is not configured");
        });
    }
}
