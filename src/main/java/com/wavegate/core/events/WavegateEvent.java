package com.wavegate.core.events;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An event emitted during session execution, used for SSE, WebSocket and CLI watch mode.
 *
 * @param type      event type
 * @param sessionId the session this event belongs to
 * @param payload   type-specific data ({@code wave}, {@code task_name}, {@code checkpoint_number}, ...)
 * @param timestamp when the event occurred
 */
public record WavegateEvent(
    EventType type,
    @JsonProperty("session_id") String sessionId,
    Map<String, Object> payload,
    Instant timestamp
) {

    public WavegateEvent {
        payload = payload == null ? Map.of() : payload;
    }

    public static WavegateEvent of(EventType type, String sessionId, Map<String, Object> payload) {
        return new WavegateEvent(type, sessionId, payload, Instant.now());
    }

    /**
     * Flat wire form: {@code {"type": ..., "session_id": ..., "timestamp": ..., <payload>}}.
     */
    public Map<String, Object> toWire() {
        var wire = new LinkedHashMap<String, Object>();
        wire.put("type", type.wireName());
        wire.put("session_id", sessionId);
        wire.put("timestamp", timestamp.toString());
        wire.putAll(payload);
        return wire;
    }
}
