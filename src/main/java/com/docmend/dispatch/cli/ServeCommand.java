package com.docmend.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: docmend serve
 * <p>
 * Starts Docmend as a long-running HTTP server exposing the REST API. The web
 * server is enabled by {@link com.docmend.DocmendApplication#main} detecting a
 * leading "serve" argument, and {@link CliRunner} skips picocli in that mode.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 docmend serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Docmend HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached via --help style invocations; serve mode bypasses picocli.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Docmend server running on port " + port);
        System.out.println();
        System.out.println("  API:        http://localhost:" + port + "/api/v1");
        System.out.println("  Health:     http://localhost:" + port + "/api/v1/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
