package com.auraide.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: aura serve
 * <p>
 * Runs the REST API and the file-change stream. The web server is enabled by
 * {@link com.auraide.AuraIdeApplication#main} detecting "serve" in args, and
 * {@link CliRunner} skips picocli so Tomcat keeps the JVM alive.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 aura serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the sandbox HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached through --help style invocations; serve mode bypasses picocli.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Sandbox server running on port " + port);
        System.out.println();
        System.out.println("  API:          http://localhost:" + port + "/api/v1");
        System.out.println("  File events:  http://localhost:" + port + "/api/v1/files/events");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    public int getPort() {
        return port;
    }
}
