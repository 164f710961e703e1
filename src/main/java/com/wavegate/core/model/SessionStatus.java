package com.wavegate.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Lifecycle status of an orchestration session. {@code COMPLETED} and {@code FAILED} are terminal.
 */
public enum SessionStatus {
    @JsonProperty("in_progress") IN_PROGRESS,
    @JsonProperty("completed") COMPLETED,
    @JsonProperty("failed") FAILED;

    public boolean isTerminal() {
        return this != IN_PROGRESS;
    }

    public String wireName() {
        return name().toLowerCase();
    }
}
