package com.wavegate.core.plan;

/**
 * Thrown when a session is started with a plan name nobody registered.
 */
public class UnknownPlanException extends RuntimeException {
    public UnknownPlanException(String planName) {
        super("Unknown wave plan: " + planName);
    }
}
