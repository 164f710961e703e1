package com.wavegate.core.gate;

import java.time.Duration;

/**
 * Thrown by the gate when no decision arrived within {@code wavegate.gate.approval-timeout}.
 */
public class CheckpointTimeoutException extends RuntimeException {

    private final int checkpointNumber;

    public CheckpointTimeoutException(String sessionId, int checkpointNumber, Duration timeout) {
        super("Checkpoint " + checkpointNumber + " of session " + sessionId
                + " was not approved within " + timeout);
        this.checkpointNumber = checkpointNumber;
    }

    public int getCheckpointNumber() {
        return checkpointNumber;
    }
}
