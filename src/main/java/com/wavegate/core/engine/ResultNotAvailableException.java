package com.wavegate.core.engine;

import com.wavegate.core.model.SessionStatus;

/**
 * Thrown when the terminal artifact of a session that has not completed is requested.
 */
public class ResultNotAvailableException extends RuntimeException {

    public ResultNotAvailableException(String sessionId, SessionStatus status) {
        super("Session " + sessionId + " has no result yet (status " + status.wireName() + ")");
    }
}
