package com.wavegate.core.gate;

import com.wavegate.core.config.RejectionPolicy;
import com.wavegate.core.config.WavegateProperties;
import com.wavegate.core.events.EventBus;
import com.wavegate.core.events.EventType;
import com.wavegate.core.events.WavegateEvent;
import com.wavegate.core.metrics.WavegateMetrics;
import com.wavegate.core.model.Checkpoint;
import com.wavegate.core.model.CheckpointMetadata;
import com.wavegate.core.model.CheckpointOutput;
import com.wavegate.core.model.CheckpointStatus;
import com.wavegate.core.model.Session;
import com.wavegate.core.persistence.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;

/**
 * Creates approval-gated checkpoints and parks the calling session runner until they are
 * approved.
 * <p>
 * The wait is driven by durable state only: each pass re-reads the session and the checkpoint
 * from the {@link SessionStore}, and sleeps on the session's {@link SessionMonitor} for at most
 * the configured poll interval. In-process decisions wake the waiter immediately; decisions
 * written by another process are seen on the next poll. A restarted process resumes by calling
 * {@link #awaitApproval} again.
 */
@Service
public class CheckpointGate {

    private static final Logger log = LoggerFactory.getLogger(CheckpointGate.class);

    private final SessionStore store;
    private final EventBus eventBus;
    private final SessionMonitors monitors;
    private final WavegateMetrics metrics;
    private final WavegateProperties.Gate config;

    public CheckpointGate(SessionStore store, EventBus eventBus, SessionMonitors monitors,
                          WavegateMetrics metrics, WavegateProperties properties) {
        this.store = store;
        this.eventBus = eventBus;
        this.monitors = monitors;
        this.metrics = metrics;
        this.config = properties.getGate();
    }

    /**
     * Allocates the next checkpoint number, persists the checkpoint as awaiting approval,
     * announces it and blocks until it is approved.
     *
     * @param regenerator re-runs the task if the checkpoint gets rejected under
     *                    {@link RejectionPolicy#REGENERATE}
     * @return the approved checkpoint
     * @throws CheckpointTimeoutException if an approval timeout is configured and expires
     * @throws SessionNotActiveException  if the session left {@code in_progress} meanwhile
     */
    public Checkpoint createAndAwait(String sessionId, String taskName, int wave, CheckpointOutput output,
                                     CheckpointMetadata metadata, Regenerator regenerator)
            throws InterruptedException {
        Checkpoint created = create(sessionId, taskName, wave, output, metadata);
        return awaitApproval(sessionId, created.number(), regenerator);
    }

    /**
     * Persists checkpoint {@code approved_through + 1} as awaiting approval and emits
     * {@code checkpoint_ready}.
     */
    public Checkpoint create(String sessionId, String taskName, int wave, CheckpointOutput output,
                             CheckpointMetadata metadata) {
        SessionMonitor monitor = monitors.of(sessionId);
        Checkpoint checkpoint;
        monitor.lock();
        try {
            Session session = store.requireSession(sessionId);
            if (session.status().isTerminal()) {
                throw new SessionNotActiveException(sessionId, session.status(), session.error());
            }
            int number = session.approvedThrough() + 1;
            checkpoint = new Checkpoint(number, taskName, wave, CheckpointStatus.AWAITING_APPROVAL,
                    output, metadata, null, 0);
            store.saveCheckpoint(sessionId, checkpoint);
            store.saveSession(session.withCurrentCheckpoint(number));
        } finally {
            monitor.unlock();
        }
        log.info("Checkpoint {} ({}) awaiting approval", checkpoint.number(), taskName);
        publishReady(sessionId, checkpoint, false);
        return checkpoint;
    }

    /**
     * Blocks until {@code session.approved_through >= number}. Rejected checkpoints are
     * regenerated through {@code regenerator} and put back up for approval under the same number.
     */
    public Checkpoint awaitApproval(String sessionId, int number, Regenerator regenerator)
            throws InterruptedException {
        SessionMonitor monitor = monitors.of(sessionId);
        Duration poll = config.effectivePollInterval();
        Duration timeout = config.getApprovalTimeout();
        long started = System.nanoTime();
        long deadline = timeout == null ? 0 : started + timeout.toNanos();

        while (true) {
            Checkpoint rejected = null;
            monitor.lock();
            try {
                Session session = store.requireSession(sessionId);
                Checkpoint checkpoint = store.loadCheckpoint(sessionId, number)
                        .orElseThrow(() -> new CheckpointNotFoundException(sessionId, number));

                if (session.approvedThrough() >= number || checkpoint.isApproved()) {
                    if (session.approvedThrough() < number) {
                        // checkpoint write landed, session write did not
                        store.saveSession(session.withApprovedThrough(number));
                    }
                    metrics.recordApprovalWait((System.nanoTime() - started) / 1_000_000);
                    log.debug("Checkpoint {} approved", number);
                    return checkpoint.isApproved() ? checkpoint : checkpoint.withStatus(CheckpointStatus.APPROVED);
                }
                if (session.status().isTerminal()) {
                    throw new SessionNotActiveException(sessionId, session.status(), session.error());
                }
                if (checkpoint.status() == CheckpointStatus.REJECTED) {
                    rejected = checkpoint;
                } else {
                    long remaining = timeout == null ? poll.toNanos() : deadline - System.nanoTime();
                    if (remaining <= 0) {
                        throw new CheckpointTimeoutException(sessionId, number, timeout);
                    }
                    log.debug("Waiting for approval of checkpoint {}", number);
                    monitor.awaitChange(Duration.ofNanos(Math.min(poll.toNanos(), remaining)));
                }
            } finally {
                monitor.unlock();
            }

            if (rejected != null) {
                regenerate(sessionId, rejected, regenerator);
            }
        }
    }

    /**
     * Approves checkpoint {@code number}. While the session is running, approving a number at
     * or below {@code approved_through} is a no-op that returns the stored checkpoint; once it
     * has completed or failed every decision is refused.
     *
     * @throws SessionNotActiveException    if the session is completed or failed
     * @throws OutOfOrderApprovalException  if {@code number != approved_through + 1}
     * @throws CheckpointNotFoundException  if the next checkpoint has not been created yet
     * @throws CheckpointStateException     if the checkpoint is being regenerated
     */
    public Checkpoint approve(String sessionId, int number) {
        SessionMonitor monitor = monitors.of(sessionId);
        Checkpoint approved;
        monitor.lock();
        try {
            Session session = requireActive(sessionId);
            var already = alreadyDecided(sessionId, session, number);
            if (already != null) {
                return already;
            }
            Checkpoint checkpoint = nextUndecided(sessionId, session, number);
            approved = checkpoint.withStatus(CheckpointStatus.APPROVED);
            store.saveCheckpoint(sessionId, approved);
            store.saveSession(session.withApprovedThrough(number));
            monitor.signalAll();
        } finally {
            monitor.unlock();
        }
        metrics.recordCheckpointDecision("approved");
        log.info("Checkpoint {} of session {} approved", number, sessionId);
        return approved;
    }

    /**
     * Records rejection feedback on checkpoint {@code number} and applies the configured
     * {@link RejectionPolicy}.
     */
    public RejectionOutcome reject(String sessionId, int number, String feedback) {
        if (feedback == null || feedback.isBlank()) {
            throw new IllegalArgumentException("Rejection feedback must not be empty");
        }
        RejectionPolicy policy = config.getRejectionPolicy();
        SessionMonitor monitor = monitors.of(sessionId);
        RejectionOutcome outcome;
        monitor.lock();
        try {
            Session session = requireActive(sessionId);
            var already = alreadyDecided(sessionId, session, number);
            if (already != null) {
                return new RejectionOutcome(already, false, session.regenerations());
            }
            Checkpoint checkpoint = nextUndecided(sessionId, session, number);
            Session updated = session.withRegeneration();
            Checkpoint stored;
            if (policy == RejectionPolicy.PASS_THROUGH) {
                stored = checkpoint.withFeedback(feedback, CheckpointStatus.APPROVED);
                updated = updated.withApprovedThrough(number);
            } else {
                stored = checkpoint.withFeedback(feedback, CheckpointStatus.REJECTED);
            }
            store.saveCheckpoint(sessionId, stored);
            store.saveSession(updated);
            monitor.signalAll();
            outcome = new RejectionOutcome(stored, policy == RejectionPolicy.REGENERATE, updated.regenerations());
        } finally {
            monitor.unlock();
        }
        metrics.recordCheckpointDecision("rejected");
        log.info("Checkpoint {} of session {} rejected ({}): {}", number, sessionId, policy, feedback);
        return outcome;
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private Session requireActive(String sessionId) {
        Session session = store.requireSession(sessionId);
        if (session.status().isTerminal()) {
            throw new SessionNotActiveException(sessionId, session.status(), session.error());
        }
        return session;
    }

    private Checkpoint alreadyDecided(String sessionId, Session session, int number) {
        if (number < 1) {
            throw new CheckpointNotFoundException(sessionId, number);
        }
        if (number <= session.approvedThrough()) {
            return store.loadCheckpoint(sessionId, number)
                    .orElseThrow(() -> new CheckpointNotFoundException(sessionId, number));
        }
        return null;
    }

    private Checkpoint nextUndecided(String sessionId, Session session, int number) {
        int expected = session.approvedThrough() + 1;
        if (number != expected) {
            throw new OutOfOrderApprovalException(sessionId, number, expected);
        }
        Checkpoint checkpoint = store.loadCheckpoint(sessionId, number)
                .orElseThrow(() -> new CheckpointNotFoundException(sessionId, number));
        if (checkpoint.status() == CheckpointStatus.REJECTED) {
            throw new CheckpointStateException(sessionId, number, checkpoint.status());
        }
        return checkpoint;
    }

    private void regenerate(String sessionId, Checkpoint rejected, Regenerator regenerator)
            throws InterruptedException {
        log.info("Regenerating checkpoint {} ({}) with feedback", rejected.number(), rejected.taskName());
        Regenerator.Result result = regenerator.regenerate(rejected);

        SessionMonitor monitor = monitors.of(sessionId);
        Checkpoint rewritten;
        monitor.lock();
        try {
            Checkpoint current = store.loadCheckpoint(sessionId, rejected.number())
                    .orElseThrow(() -> new CheckpointNotFoundException(sessionId, rejected.number()));
            if (current.status() != CheckpointStatus.REJECTED || current.revision() != rejected.revision()) {
                return;
            }
            rewritten = current.regenerated(result.output(), result.metadata());
            store.saveCheckpoint(sessionId, rewritten);
            store.saveSession(store.requireSession(sessionId).withCurrentCheckpoint(rewritten.number()));
        } finally {
            monitor.unlock();
        }
        metrics.recordCheckpointDecision("regenerated");
        publishReady(sessionId, rewritten, true);
    }

    private void publishReady(String sessionId, Checkpoint checkpoint, boolean regenerated) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("checkpoint_number", checkpoint.number());
        payload.put("task_name", checkpoint.taskName());
        payload.put("wave", checkpoint.wave());
        payload.put("revision", checkpoint.revision());
        payload.put("regenerated", regenerated);
        eventBus.publish(WavegateEvent.of(EventType.CHECKPOINT_READY, sessionId, payload));
    }
}
