package com.wavegate.core.engine;

import com.wavegate.core.model.Checkpoint;
import com.wavegate.core.model.Session;

/**
 * Outcome of an approval or rejection, with the session as stored right after it.
 *
 * @param regenerating {@code true} when the checkpoint's task is being re-run
 */
public record Decision(Session session, Checkpoint checkpoint, boolean regenerating) {

    /**
     * Number of the checkpoint the approver should look at next, or {@code null} once every
     * checkpoint of the plan has been approved.
     */
    public Integer nextCheckpoint() {
        if (regenerating) {
            return checkpoint.number();
        }
        int next = session.approvedThrough() + 1;
        return next <= session.totalCheckpoints() ? next : null;
    }
}
