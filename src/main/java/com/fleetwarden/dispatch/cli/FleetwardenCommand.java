package com.fleetwarden.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command.
 */
@Command(
        name = "fleetwarden",
        mixinStandardHelpOptions = true,
        version = "Fleetwarden 0.1.0",
        description = "Supervises a fleet of coding agents and keeps tasks in sync with the board",
        subcommands = {
                ClassifyCommand.class,
                AnalyzeLogsCommand.class,
                ReconcileCommand.class,
                BackoffCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class FleetwardenCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
