package com.wavegate.core.gate;

/**
 * Thrown when an approval or rejection targets a checkpoint other than the next one in line.
 */
public class OutOfOrderApprovalException extends RuntimeException {

    private final int requested;
    private final int expected;

    public OutOfOrderApprovalException(String sessionId, int requested, int expected) {
        super("Checkpoint " + requested + " of session " + sessionId
                + " cannot be decided before checkpoint " + expected);
        this.requested = requested;
        this.expected = expected;
    }

    public int getRequested() {
        return requested;
    }

    public int getExpected() {
        return expected;
    }
}
