package com.wavegate.core.gate;

import com.wavegate.core.model.Checkpoint;
import com.wavegate.core.model.CheckpointMetadata;
import com.wavegate.core.model.CheckpointOutput;

/**
 * Re-runs the task behind a rejected checkpoint with the rejection feedback.
 * <p>
 * Implementations merge the new structured output into the shared context and persist it
 * before returning, so the rewritten checkpoint never points ahead of the durable context.
 * Failures are reported as unchecked exceptions.
 */
@FunctionalInterface
public interface Regenerator {

    Result regenerate(Checkpoint rejected) throws InterruptedException;

    record Result(CheckpointOutput output, CheckpointMetadata metadata) {}
}
