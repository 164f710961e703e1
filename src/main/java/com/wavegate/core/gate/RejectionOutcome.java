package com.wavegate.core.gate;

import com.wavegate.core.model.Checkpoint;

/**
 * Result of a rejection with feedback.
 *
 * @param checkpoint    the checkpoint as stored after the rejection
 * @param regenerating  {@code true} if the task is being re-run, {@code false} if the session
 *                      advanced past the checkpoint
 * @param regenerations session-wide rejection counter after this call
 */
public record RejectionOutcome(Checkpoint checkpoint, boolean regenerating, int regenerations) {}
