package com.wavegate.core.events;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Progress events emitted while a session runs.
 */
public enum EventType {
    WAVE_STARTED("wave_started"),
    AGENT_COMPLETED("agent_completed"),
    CHECKPOINT_READY("checkpoint_ready"),
    WAVE_COMPLETE("wave_complete"),
    SESSION_COMPLETE("session_complete"),
    ERROR("error");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == SESSION_COMPLETE || this == ERROR;
    }
}
