package com.wavegate.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Bookkeeping attached to a checkpoint.
 *
 * @param createdAt       when this revision of the checkpoint was written
 * @param costUnits       cost reported by the task (tokens, credits, ...)
 * @param durationSeconds wall-clock execution time of the task
 */
public record CheckpointMetadata(
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("cost_units") double costUnits,
    @JsonProperty("duration_seconds") double durationSeconds
) {}
