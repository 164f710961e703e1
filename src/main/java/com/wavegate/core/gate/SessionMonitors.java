package com.wavegate.core.gate;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of {@link SessionMonitor}s keyed by session id.
 */
@Component
public class SessionMonitors {

    private final ConcurrentHashMap<String, SessionMonitor> monitors = new ConcurrentHashMap<>();

    public SessionMonitor of(String sessionId) {
        return monitors.computeIfAbsent(sessionId, id -> new SessionMonitor());
    }

    /** Drops the monitor of a finished session. */
    public void release(String sessionId) {
        monitors.remove(sessionId);
    }

    int size() {
        return monitors.size();
    }
}
