package com.wavegate.dispatch.cli;

import com.wavegate.core.engine.SessionService;
import com.wavegate.core.model.Session;
import com.wavegate.core.persistence.SessionNotFoundException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.stream.Stream;

/**
 * CLI command: wavegate status &lt;session-id&gt;
 * <p>
 * Reads the session from the configured store and prints its position and progress.
 * With {@code --watch} it follows the running server's SSE stream instead.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Check session status")
@Component
public class StatusCommand implements Runnable {

    @Parameters(index = "0", description = "Session ID")
    private String sessionId;

    @Option(names = {"--watch", "-w"}, description = "Watch for live updates via SSE")
    private boolean watch;

    @Option(names = {"--port"}, description = "Server port for watch mode (default: ${DEFAULT-VALUE})",
            defaultValue = "8080")
    private int port;

    private final SessionService sessionService;

    public StatusCommand(SessionService sessionService) {
        this.sessionService = sessionService;
    }

    @Override
    public void run() {
        if (watch) {
            runWatchMode();
            return;
        }

        ConsoleOutput.printBanner();

        Session session;
        try {
            session = sessionService.status(sessionId);
        } catch (SessionNotFoundException e) {
            ConsoleOutput.error("Session not found: " + sessionId);
            return;
        }

        System.out.println();
        System.out.println("SESSION " + session.id());
        System.out.println("Plan: " + session.plan());
        System.out.println("Mode: " + session.mode().wireName());
        ConsoleOutput.status(session.status());
        System.out.println("  Wave:               " + session.currentWave());
        System.out.println("  Current checkpoint: " + session.currentCheckpoint());
        System.out.println("  Regenerations:      " + session.regenerations());
        ConsoleOutput.progress(session.approvedThrough(), session.totalCheckpoints());

        if (session.error() != null) {
            System.out.println();
            ConsoleOutput.error("Error" + (session.failedTask() != null ? " in " + session.failedTask() : "")
                    + ": " + session.error());
        }
    }

    private void runWatchMode() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Watching session " + sessionId + " (connecting to localhost:" + port + ")...");
        System.out.println();

        URI uri = URI.create("http://localhost:" + port + "/api/v1/sessions/" + sessionId + "/events");

        try {
            HttpClient client = HttpClient.newBuilder()
                    .connectTimeout(Duration.ofSeconds(5))
                    .build();

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(uri)
                    .header("Accept", "text/event-stream")
                    .GET()
                    .build();

            HttpResponse<Stream<String>> response = client.send(request, HttpResponse.BodyHandlers.ofLines());

            if (response.statusCode() == 404) {
                ConsoleOutput.error("Session not found: " + sessionId);
                return;
            }
            if (response.statusCode() != 200) {
                ConsoleOutput.error("Server returned HTTP " + response.statusCode());
                return;
            }

            final String[] currentEventType = {""};
            response.body().forEach(line -> {
                if (line.startsWith("event:")) {
                    currentEventType[0] = line.substring(6).trim();
                } else if (line.startsWith("data:")) {
                    String data = line.substring(5).trim();
                    String eventType = currentEventType[0].isEmpty() ? "message" : currentEventType[0];
                    ConsoleOutput.watchEvent(eventType, data);
                    currentEventType[0] = "";
                }
            });

            System.out.println();
            ConsoleOutput.info("Stream ended.");

        } catch (ConnectException e) {
            ConsoleOutput.error("Cannot connect to Wavegate server at localhost:" + port);
            ConsoleOutput.info("Start the server first: wavegate serve");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.info("Watch interrupted.");
        } catch (Exception e) {
            ConsoleOutput.error("Watch failed: " + e.getMessage());
        }
    }
}
