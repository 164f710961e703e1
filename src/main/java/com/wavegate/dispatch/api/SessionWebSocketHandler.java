package com.wavegate.dispatch.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wavegate.core.config.WavegateProperties;
import com.wavegate.core.engine.SessionService;
import com.wavegate.core.events.EventBus;
import com.wavegate.core.events.WavegateEvent;
import com.wavegate.core.persistence.SessionNotFoundException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * WebSocket observer endpoint at {@code /ws/sessions/{sessionId}}.
 * <p>
 * Forwards the session's events as JSON text frames. Liveness uses plain text frames: a client
 * {@code ping} is answered with {@code pong}, and the server sends {@code ping} every ping
 * interval. Any inbound text counts as a sign of life; a connection that stays silent for
 * {@code max-missed-pings} intervals is closed.
 */
@Component
@ConditionalOnWebApplication
public class SessionWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(SessionWebSocketHandler.class);

    static final String PING = "ping";
    static final String PONG = "pong";

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final EventBus eventBus;
    private final SessionService sessionService;
    private final ObjectMapper objectMapper;
    private final long pingIntervalMs;
    private final int maxMissedPings;

    /** Open connections keyed by WebSocket session id. */
    private final Map<String, Connection> connections = new ConcurrentHashMap<>();

    private final ScheduledExecutorService pingScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "ws-ping");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SessionWebSocketHandler(EventBus eventBus, SessionService sessionService, ObjectMapper objectMapper,
                                   WavegateProperties properties) {
        this(eventBus, sessionService, objectMapper,
                properties.getStream().getPingInterval().toMillis(),
                properties.getStream().getMaxMissedPings());
    }

    SessionWebSocketHandler(EventBus eventBus, SessionService sessionService, ObjectMapper objectMapper,
                            long pingIntervalMs, int maxMissedPings) {
        this.eventBus = eventBus;
        this.sessionService = sessionService;
        this.objectMapper = objectMapper;
        this.pingIntervalMs = pingIntervalMs;
        this.maxMissedPings = Math.max(1, maxMissedPings);
    }

    @PostConstruct
    void startPings() {
        pingScheduler.scheduleAtFixedRate(this::sweep, pingIntervalMs, pingIntervalMs, TimeUnit.MILLISECONDS);
        log.info("WebSocket ping scheduler started (interval={}ms, maxMissed={})", pingIntervalMs, maxMissedPings);
    }

    @PreDestroy
    void stopPings() {
        pingScheduler.shutdownNow();
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession socket) throws IOException {
        String sessionId = extractSessionId(socket.getUri());
        if (sessionId == null) {
            socket.close(CloseStatus.BAD_DATA);
            return;
        }
        try {
            sessionService.status(sessionId);
        } catch (SessionNotFoundException e) {
            log.debug("Rejecting WebSocket for unknown session {}", sessionId);
            socket.close(CloseStatus.POLICY_VIOLATION.withReason("Unknown session"));
            return;
        }

        var safeSocket = new ConcurrentWebSocketSessionDecorator(socket, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
        var holder = new Connection[1];
        EventBus.Subscription subscription = eventBus.subscribe(sessionId, event -> {
            if (holder[0] != null) {
                send(holder[0], toJson(event));
            }
        });
        var connection = new Connection(sessionId, safeSocket, subscription, new AtomicInteger());
        holder[0] = connection;
        connections.put(socket.getId(), connection);
        log.info("WebSocket connected for session {} ({})", sessionId, socket.getId());
    }

    @Override
    protected void handleTextMessage(WebSocketSession socket, TextMessage message) {
        Connection connection = connections.get(socket.getId());
        if (connection == null) {
            return;
        }
        connection.missed.set(0);
        if (PING.equalsIgnoreCase(message.getPayload().trim())) {
            send(connection, PONG);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession socket, CloseStatus status) {
        Connection connection = connections.remove(socket.getId());
        if (connection != null) {
            connection.subscription.unsubscribe();
            log.info("WebSocket disconnected for session {} ({}): {}", connection.sessionId, socket.getId(), status);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession socket, Throwable exception) {
        log.debug("WebSocket transport error on {}: {}", socket.getId(), exception.getMessage());
    }

    /**
     * Sends a ping to every connection, closing those that missed too many.
     */
    void sweep() {
        for (var entry : connections.entrySet()) {
            Connection connection = entry.getValue();
            if (connection.missed.get() >= maxMissedPings) {
                log.info("Closing silent WebSocket for session {} after {} missed pings",
                        connection.sessionId, connection.missed.get());
                connections.remove(entry.getKey());
                connection.subscription.unsubscribe();
                try {
                    connection.socket.close(CloseStatus.SESSION_NOT_RELIABLE);
                } catch (IOException e) {
                    log.debug("Close failed for session {}: {}", connection.sessionId, e.getMessage());
                }
                continue;
            }
            connection.missed.incrementAndGet();
            send(connection, PING);
        }
    }

    int connectionCount() {
        return connections.size();
    }

    private void send(Connection connection, String text) {
        if (text == null || !connection.socket.isOpen()) {
            return;
        }
        try {
            connection.socket.sendMessage(new TextMessage(text));
        } catch (IOException | IllegalStateException e) {
            log.debug("Failed to send to WebSocket for session {}: {}", connection.sessionId, e.getMessage());
        }
    }

    private String toJson(WavegateEvent event) {
        try {
            return objectMapper.writeValueAsString(event.toWire());
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize event {}: {}", event.type().wireName(), e.getMessage());
            return null;
        }
    }

    static String extractSessionId(URI uri) {
        if (uri == null) {
            return null;
        }
        // Path format: /ws/sessions/{sessionId}
        String[] parts = uri.getPath().split("/");
        if (parts.length >= 4 && "sessions".equals(parts[2]) && !parts[3].isBlank()) {
            return parts[3];
        }
        return null;
    }

    private record Connection(
            String sessionId,
            WebSocketSession socket,
            EventBus.Subscription subscription,
            AtomicInteger missed
    ) {}
}
