package com.wavegate.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Wavegate-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setSession(String sessionId) {
        MDC.put("sessionId", sessionId);
    }

    public static void setWave(String sessionId, int wave) {
        MDC.put("sessionId", sessionId);
        MDC.put("wave", String.valueOf(wave));
    }

    public static void setTask(String sessionId, int wave, String taskName) {
        MDC.put("sessionId", sessionId);
        MDC.put("wave", String.valueOf(wave));
        MDC.put("taskName", taskName);
    }

    public static void clear() {
        MDC.remove("sessionId");
        MDC.remove("wave");
        MDC.remove("taskName");
    }
}
