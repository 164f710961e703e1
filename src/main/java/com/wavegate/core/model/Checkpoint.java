package com.wavegate.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Durable, approval-gated record of one task's result.
 *
 * @param number   1-based sequence number, unique within the session
 * @param taskName task that produced the output
 * @param wave     wave index that produced it ({@code waves + 1} for final consolidation)
 * @param status   approval state
 * @param output   narrative plus structured result
 * @param metadata creation time, cost and duration
 * @param feedback rejection feedback received so far, oldest first
 * @param revision 0 for the first result, incremented on each regeneration
 */
public record Checkpoint(
    int number,
    @JsonProperty("task_name") String taskName,
    int wave,
    CheckpointStatus status,
    CheckpointOutput output,
    CheckpointMetadata metadata,
    List<String> feedback,
    int revision
) {

    public Checkpoint {
        feedback = feedback == null ? List.of() : List.copyOf(feedback);
    }

    public Checkpoint withStatus(CheckpointStatus newStatus) {
        return new Checkpoint(number, taskName, wave, newStatus, output, metadata, feedback, revision);
    }

    public Checkpoint withFeedback(String text, CheckpointStatus newStatus) {
        var all = new ArrayList<>(feedback);
        all.add(text);
        return new Checkpoint(number, taskName, wave, newStatus, output, metadata, all, revision);
    }

    /**
     * Replaces the output with a regenerated one and puts the checkpoint back up for approval.
     */
    public Checkpoint regenerated(CheckpointOutput newOutput, CheckpointMetadata newMetadata) {
        return new Checkpoint(number, taskName, wave, CheckpointStatus.AWAITING_APPROVAL,
                newOutput, newMetadata, feedback, revision + 1);
    }

    public String latestFeedback() {
        return feedback.isEmpty() ? null : feedback.get(feedback.size() - 1);
    }

    @JsonIgnore
    public boolean isApproved() {
        return status == CheckpointStatus.APPROVED;
    }
}
