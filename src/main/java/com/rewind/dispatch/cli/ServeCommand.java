package com.rewind.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: rewind serve
 * <p>
 * Starts Rewind as a long-running HTTP server exposing the REST API. The web server is enabled
 * by {@link com.rewind.RewindApplication#main} detecting "serve" in args, and {@link CliRunner}
 * skips picocli in that mode. The banner is printed once the server is ready.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Rewind HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Not called in serve mode; registered for --help.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Rewind server running on port " + port);
        System.out.println();
        System.out.println("  API:  http://localhost:" + port + "/api/v1");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
