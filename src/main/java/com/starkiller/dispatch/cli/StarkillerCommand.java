package com.starkiller.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Starkiller Base Command.
 * Routes to subcommands: simulate, catalog, report.
 */
@Command(
        name = "starkiller",
        mixinStandardHelpOptions = true,
        version = "Starkiller Base Command 0.1.0",
        description = "Checkpoint encounter simulator with branching narrative",
        subcommands = {
                SimulateCommand.class,
                CatalogCommand.class,
                ReportCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class StarkillerCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
