package com.newsflow.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: newsflow serve
 * <p>
 * Starts Newsflow as a long-running HTTP server exposing the run API. The web
 * server is enabled by {@link com.newsflow.NewsflowApplication#main} detecting
 * "serve" in args, and {@link CliRunner} skips picocli in that mode. The banner is
 * printed once the embedded server reports its port.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Newsflow HTTP server")
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
        ConsoleOutput.info("Newsflow server running on port " + port);
        System.out.println();
        System.out.println("  API:  http://localhost:" + port + "/api/v1/runs");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
