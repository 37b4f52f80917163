package io.palaver.cli;

import io.palaver.core.config.InitResult;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "init", description = "Write the configuration file, filling in missing defaults")
public final class InitCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--overwrite", description = "Replace the existing config with defaults")
    boolean overwrite;

    public InitCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            InitResult result = context.configService().init(context.configPath(), overwrite);
            if (result.createdConfig()) {
                System.out.println("Created config: " + result.configPath());
            } else if (result.overwrittenConfig()) {
                System.out.println("Overwrote config with defaults: " + result.configPath());
            } else {
                System.out.println("Refreshed config with new defaults: " + result.configPath());
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Init failed: " + e.getMessage());
            return 1;
        }
    }
}
