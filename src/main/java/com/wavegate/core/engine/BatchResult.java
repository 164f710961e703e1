package com.wavegate.core.engine;

import com.wavegate.core.model.Session;

import java.util.List;

/**
 * Outcome of a batch start.
 *
 * @param started   sessions that were created, highest priority first
 * @param submitted number of entries in the request
 */
public record BatchResult(List<Started> started, int submitted) {

    public BatchResult {
        started = List.copyOf(started);
    }

    public record Started(Session session, int priority) {}
}
