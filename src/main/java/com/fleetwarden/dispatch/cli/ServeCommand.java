package com.fleetwarden.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: fleetwarden serve
 * <p>
 * Runs Fleetwarden as a long-lived supervisor with the REST API and SSE stream. The web server
 * is enabled by {@link com.fleetwarden.FleetwardenApplication#main} when "serve" is present, and
 * {@link CliRunner} then leaves picocli out. The banner is printed once the server is listening.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the supervisor with its HTTP API")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached through --help style invocations; serve mode skips picocli
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Fleetwarden supervisor running on port " + port);
        System.out.println();
        System.out.println("  API:     http://localhost:" + port + "/api/v1/fleet");
        System.out.println("  Stream:  http://localhost:" + port + "/api/v1/fleet/stream");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
