package com.wavegate.core.config;

/**
 * What a rejection with feedback does to the waiting gate.
 */
public enum RejectionPolicy {
    /** Re-run the originating task with the feedback and re-gate on the same checkpoint number. */
    REGENERATE,
    /** Record the feedback and advance as if the checkpoint had been approved. */
    PASS_THROUGH
}
