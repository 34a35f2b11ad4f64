package com.fleetwarden.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Hands the command line to picocli once the Spring context is up.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final FleetwardenCommand fleetwardenCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(FleetwardenCommand fleetwardenCommand, IFactory factory) {
        this.fleetwardenCommand = fleetwardenCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) throws Exception {
        // Serve mode is owned by the embedded web server; picocli would return at once
        for (String arg : args) {
            if ("serve".equals(arg)) {
                return;
            }
        }
        exitCode = new CommandLine(fleetwardenCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
