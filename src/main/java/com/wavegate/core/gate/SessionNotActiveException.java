package com.wavegate.core.gate;

import com.wavegate.core.model.SessionStatus;

/**
 * Thrown when a decision is submitted for a session that already completed or failed.
 */
public class SessionNotActiveException extends RuntimeException {

    private final SessionStatus status;

    public SessionNotActiveException(String sessionId, SessionStatus status, String error) {
        super("Session " + sessionId + " is " + status.wireName()
                + (error != null ? ": " + error : ""));
        this.status = status;
    }

    public SessionStatus getStatus() {
        return status;
    }
}
