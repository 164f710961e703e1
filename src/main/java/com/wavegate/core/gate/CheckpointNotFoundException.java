package com.wavegate.core.gate;

/**
 * Thrown when a checkpoint number has not been created (yet).
 */
public class CheckpointNotFoundException extends RuntimeException {

    public CheckpointNotFoundException(String sessionId, int number) {
        super("Checkpoint " + number + " of session " + sessionId + " not found");
    }
}
