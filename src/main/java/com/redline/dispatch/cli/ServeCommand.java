package com.redline.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: redline serve
 * <p>
 * Starts the REST API and SSE streaming. The web server itself is enabled by
 * {@link com.redline.RedlineApplication#main} seeing "serve" in the arguments, and
 * {@link CliRunner} skips picocli in that mode; this class prints the banner once the
 * server is up.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Redline HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Redline server running on port " + port);
        System.out.println("  API:    http://localhost:" + port + "/api/v1");
        System.out.println("  Health: http://localhost:" + port + "/api/v1/health");
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
