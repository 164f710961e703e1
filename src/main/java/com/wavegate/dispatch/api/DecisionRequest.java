package com.wavegate.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for the approve and reject endpoints.
 *
 * @param checkpointNumber checkpoint being decided
 * @param feedback         rejection feedback; ignored on approve
 */
public record DecisionRequest(
    @JsonProperty("checkpoint_number") Integer checkpointNumber,
    String feedback
) {}
