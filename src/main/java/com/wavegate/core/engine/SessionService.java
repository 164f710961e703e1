package com.wavegate.core.engine;

import com.wavegate.core.gate.CheckpointGate;
import com.wavegate.core.gate.CheckpointNotFoundException;
import com.wavegate.core.gate.RejectionOutcome;
import com.wavegate.core.metrics.WavegateMetrics;
import com.wavegate.core.model.Checkpoint;
import com.wavegate.core.model.Session;
import com.wavegate.core.model.SessionMode;
import com.wavegate.core.model.SessionStatus;
import com.wavegate.core.model.SharedContext;
import com.wavegate.core.model.TerminalArtifact;
import com.wavegate.core.persistence.SessionStore;
import com.wavegate.core.plan.WavePlan;
import com.wavegate.core.plan.WavePlanRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Control surface for sessions: start, inspect, approve and reject.
 * <p>
 * Each started session gets one runner on the session runner pool that executes
 * {@link WaveScheduler#run}. All read operations go to the {@link SessionStore}, so repeated
 * calls without intervening decisions return identical snapshots.
 */
@Service
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    private final SessionStore store;
    private final WaveScheduler scheduler;
    private final CheckpointGate gate;
    private final WavePlanRegistry plans;
    private final WavegateMetrics metrics;
    private final ExecutorService sessionRunnerPool;
    private final ConcurrentHashMap<String, Future<?>> runners = new ConcurrentHashMap<>();

    public SessionService(SessionStore store, WaveScheduler scheduler, CheckpointGate gate,
                          WavePlanRegistry plans, WavegateMetrics metrics,
                          @Qualifier("sessionRunnerPool") ExecutorService sessionRunnerPool) {
        this.store = store;
        this.scheduler = scheduler;
        this.gate = gate;
        this.plans = plans;
        this.metrics = metrics;
        this.sessionRunnerPool = sessionRunnerPool;
    }

    /**
     * Creates a session and starts wave 1 in the background. Every call creates a new session.
     *
     * @param planName plan to execute; {@code null} selects the default plan
     * @param mode     {@code fast}, {@code balanced} or {@code deep}; {@code null} means balanced
     * @throws com.wavegate.core.plan.UnknownPlanException if the plan is not registered
     * @throws IllegalArgumentException                   if the mode is not recognised
     */
    public Session start(String planName, String mode, Map<String, Object> input) {
        WavePlan plan = plans.resolve(planName);
        SessionMode sessionMode = parseMode(mode);
        Session session = Session.create(UUID.randomUUID().toString(), plan.name(), sessionMode,
                plan.totalCheckpoints(), input);
        store.createSession(session);
        metrics.recordSessionResult("started");
        log.info("Session {} created with plan {} ({} checkpoints)", session.id(), plan.name(),
                plan.totalCheckpoints());
        launch(session.id(), plan);
        return session;
    }

    /**
     * Starts a runner for an existing {@code in_progress} session unless one is already active.
     *
     * @return {@code false} if a runner was already active
     */
    public boolean launch(String sessionId, WavePlan plan) {
        var started = new boolean[1];
        runners.computeIfAbsent(sessionId, id -> {
            started[0] = true;
            return sessionRunnerPool.submit(() -> runSession(id, plan));
        });
        return started[0];
    }

    public Session status(String sessionId) {
        return store.requireSession(sessionId);
    }

    public List<Session> listSessions() {
        return store.listSessionIds().stream()
                .map(store::loadSession)
                .flatMap(Optional::stream)
                .toList();
    }

    public Checkpoint getCheckpoint(String sessionId, int number) {
        store.requireSession(sessionId);
        return store.loadCheckpoint(sessionId, number)
                .orElseThrow(() -> new CheckpointNotFoundException(sessionId, number));
    }

    public List<Checkpoint> listCheckpoints(String sessionId) {
        store.requireSession(sessionId);
        return store.listCheckpoints(sessionId);
    }

    public SharedContext context(String sessionId) {
        store.requireSession(sessionId);
        return store.loadContext(sessionId);
    }

    public Decision approve(String sessionId, int number) {
        Checkpoint approved = gate.approve(sessionId, number);
        return new Decision(store.requireSession(sessionId), approved, false);
    }

    public Decision reject(String sessionId, int number, String feedback) {
        RejectionOutcome outcome = gate.reject(sessionId, number, feedback);
        return new Decision(store.requireSession(sessionId), outcome.checkpoint(), outcome.regenerating());
    }

    /**
     * @throws ResultNotAvailableException until the session has completed
     */
    public TerminalArtifact getTerminalArtifact(String sessionId) {
        Session session = store.requireSession(sessionId);
        if (session.status() != SessionStatus.COMPLETED) {
            throw new ResultNotAvailableException(sessionId, session.status());
        }
        return store.loadTerminalArtifact(sessionId)
                .orElseThrow(() -> new ResultNotAvailableException(sessionId, session.status()));
    }

    public boolean isRunning(String sessionId) {
        return runners.containsKey(sessionId);
    }

    private void runSession(String sessionId, WavePlan plan) {
        try {
            scheduler.run(sessionId, plan);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Runner of session {} interrupted; the session stays in progress", sessionId);
        } finally {
            runners.remove(sessionId);
        }
    }

    static SessionMode parseMode(String mode) {
        try {
            return SessionMode.parse(mode);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid mode '" + mode + "'; expected fast, balanced or deep");
        }
    }
}
