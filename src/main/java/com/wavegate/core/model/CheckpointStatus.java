package com.wavegate.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Approval state of a single checkpoint.
 */
public enum CheckpointStatus {
    @JsonProperty("awaiting_approval") AWAITING_APPROVAL,
    @JsonProperty("approved") APPROVED,
    @JsonProperty("rejected") REJECTED;

    public String wireName() {
        return name().toLowerCase();
    }
}
