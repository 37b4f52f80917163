package io.palaver.cli;

import picocli.CommandLine;

public final class PalaverCli {

    private PalaverCli() {
    }

    public static CommandLine commandLine(CliContext context) {
        return new CommandLine(new PalaverCliCommand())
            .addSubcommand("init", new InitCommand(context))
            .addSubcommand("status", new StatusCommand(context))
            .addSubcommand("serve", new ServeCommand(context));
    }
}
