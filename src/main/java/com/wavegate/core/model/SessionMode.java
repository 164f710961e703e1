package com.wavegate.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Depth/cost hint handed to every task executor. Opaque to the scheduler.
 */
public enum SessionMode {
    @JsonProperty("fast") FAST,
    @JsonProperty("balanced") BALANCED,
    @JsonProperty("deep") DEEP;

    /**
     * Parses a mode name case-insensitively; {@code null} or blank yields {@link #BALANCED}.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static SessionMode parse(String value) {
        if (value == null || value.isBlank()) {
            return BALANCED;
        }
        return valueOf(value.trim().toUpperCase());
    }

    public String wireName() {
        return name().toLowerCase();
    }
}
