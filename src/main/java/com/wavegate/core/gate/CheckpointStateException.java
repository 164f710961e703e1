package com.wavegate.core.gate;

import com.wavegate.core.model.CheckpointStatus;

/**
 * Thrown when a checkpoint cannot take a decision in its current state, e.g. while it is
 * being regenerated after a rejection.
 */
public class CheckpointStateException extends RuntimeException {

    public CheckpointStateException(String sessionId, int number, CheckpointStatus status) {
        super("Checkpoint " + number + " of session " + sessionId + " is " + status.wireName()
                + " and cannot be decided now");
    }
}
