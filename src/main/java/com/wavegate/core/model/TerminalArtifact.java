package com.wavegate.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Final consolidated output of a completed session.
 */
public record TerminalArtifact(
    @JsonProperty("session_id") String sessionId,
    String narrative,
    Map<String, Object> content,
    @JsonProperty("completed_at") Instant completedAt
) {}
