package com.lodestar.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Lodestar.
 * Routes to subcommands: select, score, inspect.
 */
@Command(
        name = "lodestar",
        mixinStandardHelpOptions = true,
        version = "Lodestar 0.1.0",
        description = "Selects the most relevant project files for a coding task within a token budget",
        subcommands = {
                SelectCommand.class,
                ScoreCommand.class,
                InspectCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class LodestarCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
