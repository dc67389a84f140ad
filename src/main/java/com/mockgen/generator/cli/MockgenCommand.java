package com.mockgen.generator.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level command; dispatches to generate, watch and remove.
 */
@Command(
        name = "mockgen",
        mixinStandardHelpOptions = true,
        version = "mockgen 1.0.0",
        description = "Generates mocks for Java interfaces.",
        subcommands = {
                GenerateCommand.class,
                WatchCommand.class,
                RemoveCommand.class,
                CommandLine.HelpCommand.class
        }
)
public class MockgenCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }
}
