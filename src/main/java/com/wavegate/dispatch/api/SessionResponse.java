package com.wavegate.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.wavegate.core.model.Session;

import java.time.Instant;

/**
 * JSON view of a session for the status and listing endpoints.
 */
public record SessionResponse(
    @JsonProperty("session_id") String sessionId,
    String plan,
    String status,
    String mode,
    @JsonProperty("current_wave") int currentWave,
    @JsonProperty("current_checkpoint") int currentCheckpoint,
    @JsonProperty("approved_through") int approvedThrough,
    @JsonProperty("total_checkpoints") int totalCheckpoints,
    int regenerations,
    Progress progress,
    String error,
    @JsonProperty("failed_task") String failedTask,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt,
    @JsonProperty("completed_at") Instant completedAt
) {

    public record Progress(int completed, int total) {}

    public static SessionResponse from(Session session) {
        return new SessionResponse(
                session.id(),
                session.plan(),
                session.status().wireName(),
                session.mode().wireName(),
                session.currentWave(),
                session.currentCheckpoint(),
                session.approvedThrough(),
                session.totalCheckpoints(),
                session.regenerations(),
                new Progress(session.approvedThrough(), session.totalCheckpoints()),
                session.error(),
                session.failedTask(),
                session.createdAt(),
                session.updatedAt(),
                session.completedAt());
    }
}
