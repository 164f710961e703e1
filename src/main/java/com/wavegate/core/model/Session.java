package com.wavegate.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Durable metadata of one orchestration run.
 * <p>
 * Position fields ({@code status}, {@code currentWave}, {@code currentCheckpoint}) are written
 * by the scheduler; {@code approvedThrough} and {@code regenerations} by the approval path.
 * Instances are immutable; the {@code with*} methods return updated copies.
 *
 * @param id                unique session id, assigned at creation
 * @param plan              name of the wave plan this session executes
 * @param status            lifecycle status
 * @param mode              depth hint passed to task executors
 * @param currentWave       wave the scheduler is in (1-based, 0 before the first wave,
 *                          {@code waves + 1} during final consolidation)
 * @param currentCheckpoint number of the most recently created checkpoint (0 if none)
 * @param approvedThrough   highest approved checkpoint number; never decreases
 * @param totalCheckpoints  checkpoints the plan will produce, including the final one
 * @param regenerations     number of rejections with feedback
 * @param input             free-form start input visible to every task
 * @param createdAt         creation time
 * @param updatedAt         time of the last metadata write
 * @param completedAt       time the session reached a terminal status (nullable)
 * @param error             failure message when {@code status == FAILED} (nullable)
 * @param failedTask        task that caused the failure (nullable)
 */
public record Session(
    String id,
    String plan,
    SessionStatus status,
    SessionMode mode,
    @JsonProperty("current_wave") int currentWave,
    @JsonProperty("current_checkpoint") int currentCheckpoint,
    @JsonProperty("approved_through") int approvedThrough,
    @JsonProperty("total_checkpoints") int totalCheckpoints,
    int regenerations,
    Map<String, Object> input,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt,
    @JsonProperty("completed_at") Instant completedAt,
    String error,
    @JsonProperty("failed_task") String failedTask
) {

    public Session {
        input = ReadOnly.map(input);
    }

    public static Session create(String id, String plan, SessionMode mode, int totalCheckpoints,
                                 Map<String, Object> input) {
        Instant now = Instant.now();
        return new Session(id, plan, SessionStatus.IN_PROGRESS, mode, 0, 0, 0,
                totalCheckpoints, 0, input, now, now, null, null, null);
    }

    public Session withCurrentWave(int wave) {
        return new Session(id, plan, status, mode, wave, currentCheckpoint, approvedThrough,
                totalCheckpoints, regenerations, input, createdAt, Instant.now(), completedAt, error, failedTask);
    }

    public Session withCurrentCheckpoint(int checkpoint) {
        return new Session(id, plan, status, mode, currentWave, checkpoint, approvedThrough,
                totalCheckpoints, regenerations, input, createdAt, Instant.now(), completedAt, error, failedTask);
    }

    public Session withApprovedThrough(int number) {
        return new Session(id, plan, status, mode, currentWave, currentCheckpoint,
                Math.max(approvedThrough, number), totalCheckpoints, regenerations, input,
                createdAt, Instant.now(), completedAt, error, failedTask);
    }

    public Session withRegeneration() {
        return new Session(id, plan, status, mode, currentWave, currentCheckpoint, approvedThrough,
                totalCheckpoints, regenerations + 1, input, createdAt, Instant.now(), completedAt, error, failedTask);
    }

    public Session completed() {
        Instant now = Instant.now();
        return new Session(id, plan, SessionStatus.COMPLETED, mode, currentWave, currentCheckpoint,
                approvedThrough, totalCheckpoints, regenerations, input, createdAt, now, now, null, null);
    }

    public Session failed(String message, String taskName) {
        Instant now = Instant.now();
        return new Session(id, plan, SessionStatus.FAILED, mode, currentWave, currentCheckpoint,
                approvedThrough, totalCheckpoints, regenerations, input, createdAt, now, now, message, taskName);
    }
}
