package com.repolens.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: repolens serve
 * <p>
 * Starts RepoLens as an HTTP server exposing the REST API. The web server is
 * enabled by {@link com.repolens.RepoLensApplication#main} detecting "serve" in
 * the arguments; {@link CliRunner} then skips picocli and this bean prints the
 * banner once the server is listening.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the RepoLens HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // only reached through --help style invocations; serve mode bypasses picocli
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("RepoLens server running on port " + port);
        System.out.println();
        System.out.println("  Context:  POST http://localhost:" + port + "/api/v1/context");
        System.out.println("  Health:   GET  http://localhost:" + port + "/api/v1/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
