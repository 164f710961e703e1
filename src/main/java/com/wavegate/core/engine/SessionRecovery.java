package com.wavegate.core.engine;

import com.wavegate.core.config.WavegateProperties;
import com.wavegate.core.logging.MdcContext;
import com.wavegate.core.metrics.WavegateMetrics;
import com.wavegate.core.model.Session;
import com.wavegate.core.model.SessionStatus;
import com.wavegate.core.persistence.SessionStore;
import com.wavegate.core.plan.WavePlan;
import com.wavegate.core.plan.WavePlanRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Resumes {@code in_progress} sessions after a restart.
 * <p>
 * Only active in server mode; CLI commands read the store without touching running sessions.
 * Each recovered session gets a fresh runner that re-enters {@link WaveScheduler#run} from its
 * durable state.
 */
@Component
@ConditionalOnWebApplication
public class SessionRecovery {

    private static final Logger log = LoggerFactory.getLogger(SessionRecovery.class);

    private final SessionStore store;
    private final SessionService sessions;
    private final WavePlanRegistry plans;
    private final WavegateMetrics metrics;
    private final boolean enabled;

    public SessionRecovery(SessionStore store, SessionService sessions, WavePlanRegistry plans,
                           WavegateMetrics metrics, WavegateProperties properties) {
        this.store = store;
        this.sessions = sessions;
        this.plans = plans;
        this.metrics = metrics;
        this.enabled = properties.getRecovery().isEnabled();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (!enabled) {
            log.info("Session recovery disabled");
            return;
        }
        int resumed = recover();
        if (resumed > 0) {
            log.info("Resumed {} in-progress session(s)", resumed);
        }
    }

    /**
     * Launches a runner for every stored {@code in_progress} session.
     *
     * @return number of sessions resumed
     */
    public int recover() {
        int resumed = 0;
        for (String sessionId : store.listSessionIds()) {
            Optional<Session> loaded = store.loadSession(sessionId);
            if (loaded.isEmpty() || loaded.get().status() != SessionStatus.IN_PROGRESS) {
                continue;
            }
            Session session = loaded.get();
            MdcContext.setSession(sessionId);
            try {
                Optional<WavePlan> plan = plans.find(session.plan());
                if (plan.isEmpty()) {
                    log.error("Cannot resume session {}: plan {} is not registered", sessionId, session.plan());
                    store.saveSession(session.failed("Unknown wave plan: " + session.plan(), null));
                    continue;
                }
                if (sessions.launch(sessionId, plan.get())) {
                    log.info("Resuming session {} at wave {} (approved through {})",
                            sessionId, session.currentWave(), session.approvedThrough());
                    metrics.recordRecoveredSession();
                    resumed++;
                }
            } finally {
                MdcContext.clear();
            }
        }
        return resumed;
    }
}
