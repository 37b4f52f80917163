package io.palaver.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "serve", description = "Start the HTTP conversation gateway")
public final class ServeCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--host"}, description = "Host override")
    String host;

    @Option(names = {"--port"}, description = "Port override")
    Integer port;

    public ServeCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            return context.gatewayRunner().run(host, port);
        } catch (Exception e) {
            System.err.println("Serve command failed: " + e.getMessage());
            return 1;
        }
    }
}
