package com.wavegate.dispatch.api;

import com.wavegate.core.config.WavegateProperties;
import com.wavegate.core.events.EventBus;
import com.wavegate.core.events.WavegateEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Bridges {@link EventBus} subscriptions to {@link SseEmitter} instances for SSE streaming.
 * <p>
 * Each connected client gets an emitter subscribed to its session's events. Events are sent
 * as named SSE frames ({@code event: checkpoint_ready}). Comment heartbeats keep idle
 * connections open through proxies; a terminal event ({@code session_complete} or
 * {@code error}) completes the emitter.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    private final EventBus eventBus;
    private final long timeoutMs;
    private final long heartbeatMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus, WavegateProperties properties) {
        this(eventBus, properties.getStream().getSseTimeout().toMillis(),
                properties.getStream().getPingInterval().toMillis());
    }

    SseStreamingService(EventBus eventBus, long timeoutMs, long heartbeatMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
        this.heartbeatMs = heartbeatMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(this::sendHeartbeats, heartbeatMs, heartbeatMs, TimeUnit.MILLISECONDS);
        log.info("SSE heartbeat scheduler started (interval={}ms)", heartbeatMs);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("SSE heartbeat scheduler stopped");
    }

    void sendHeartbeats() {
        if (activeRegistrations.isEmpty()) {
            return;
        }
        log.debug("Sending heartbeat to {} active SSE emitters", activeRegistrations.size());
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter.send(SseEmitter.event().comment("ping"));
            } catch (IOException | IllegalStateException e) {
                // onError/onCompletion callbacks do the cleanup
                log.debug("Heartbeat failed for session {}: {}", registration.sessionId, e.getMessage());
            }
        }
    }

    /**
     * Creates an SSE emitter that streams events for the given session.
     */
    public SseEmitter createEmitter(String sessionId) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        var holder = new EmitterRegistration[1];

        EventBus.Subscription subscription = eventBus.subscribe(sessionId, event -> {
            sendEvent(emitter, event);
            if (event.type().isTerminal() && holder[0] != null) {
                cleanup(holder[0]);
                emitter.complete();
            }
        });

        var registration = new EmitterRegistration(sessionId, emitter, subscription);
        holder[0] = registration;
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> {
            log.debug("SSE emitter completed for session {}", sessionId);
            cleanup(registration);
        });
        emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out for session {}", sessionId);
            cleanup(registration);
        });
        emitter.onError(ex -> {
            log.debug("SSE emitter error for session {}: {}", sessionId, ex.getMessage());
            cleanup(registration);
        });

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to send initial heartbeat for session {}: {}", sessionId, e.getMessage());
        }

        log.info("SSE emitter created for session {} (timeout={}ms)", sessionId, timeoutMs);
        return emitter;
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    private void sendEvent(SseEmitter emitter, WavegateEvent event) {
        try {
            emitter.send(SseEmitter.event()
                    .name(event.type().wireName())
                    .data(event.toWire()));
        } catch (IOException | IllegalStateException e) {
            log.debug("Failed to send SSE event {} for session {}: {}",
                    event.type().wireName(), event.sessionId(), e.getMessage());
        }
    }

    private void cleanup(EmitterRegistration registration) {
        registration.subscription.unsubscribe();
        activeRegistrations.remove(registration);
        log.debug("Cleaned up SSE registration for session {}", registration.sessionId);
    }

    private record EmitterRegistration(
            String sessionId,
            SseEmitter emitter,
            EventBus.Subscription subscription
    ) {}
}
