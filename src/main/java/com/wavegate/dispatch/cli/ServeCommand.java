package com.wavegate.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: wavegate serve
 * <p>
 * Starts Wavegate as a long-running HTTP server exposing the session REST API, SSE and
 * WebSocket observers. The web server is enabled by
 * {@link com.wavegate.WavegateApplication#isServeMode} when "serve" is the first argument, and
 * {@link CliRunner} skips picocli in that case. The banner is printed once the server is up.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 wavegate serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Wavegate HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached through picocli (e.g. "help serve"); serve mode bypasses picocli.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Wavegate server running on port " + port);
        System.out.println();
        System.out.println("  API:        http://localhost:" + port + "/api/v1/sessions");
        System.out.println("  Events:     http://localhost:" + port + "/api/v1/sessions/{id}/events");
        System.out.println("  WebSocket:  ws://localhost:" + port + "/ws/sessions/{id}");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    public int getPort() {
        return port;
    }
}
