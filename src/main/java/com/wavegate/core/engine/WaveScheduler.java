package com.wavegate.core.engine;

import com.wavegate.core.events.EventBus;
import com.wavegate.core.events.EventType;
import com.wavegate.core.events.WavegateEvent;
import com.wavegate.core.gate.CheckpointGate;
import com.wavegate.core.gate.CheckpointTimeoutException;
import com.wavegate.core.gate.Regenerator;
import com.wavegate.core.gate.SessionMonitor;
import com.wavegate.core.gate.SessionMonitors;
import com.wavegate.core.gate.SessionNotActiveException;
import com.wavegate.core.logging.MdcContext;
import com.wavegate.core.metrics.WavegateMetrics;
import com.wavegate.core.model.Checkpoint;
import com.wavegate.core.model.CheckpointMetadata;
import com.wavegate.core.model.CheckpointOutput;
import com.wavegate.core.model.Session;
import com.wavegate.core.model.SharedContext;
import com.wavegate.core.model.TerminalArtifact;
import com.wavegate.core.persistence.SessionStore;
import com.wavegate.core.plan.TaskExecutor;
import com.wavegate.core.plan.TaskInput;
import com.wavegate.core.plan.TaskResult;
import com.wavegate.core.plan.Wave;
import com.wavegate.core.plan.WavePlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.function.UnaryOperator;

/**
 * Drives a session from its first wave to final consolidation.
 * <p>
 * Tasks of a wave run concurrently on the shared worker pool. Each result is merged into the
 * shared context as soon as its task finishes; once every task of the wave has finished, the
 * checkpoints are created and gated one by one in definition order. The next wave starts only
 * after the last checkpoint of the current one is approved.
 * <p>
 * {@link #run} always starts from durable state, so the same entry point serves fresh
 * sessions and sessions resumed after a restart: fully approved waves are skipped, existing
 * unapproved checkpoints are awaited again and tasks without a checkpoint are re-executed.
 */
@Service
public class WaveScheduler {

    private static final Logger log = LoggerFactory.getLogger(WaveScheduler.class);

    private final SessionStore store;
    private final CheckpointGate gate;
    private final EventBus eventBus;
    private final SessionMonitors monitors;
    private final WavegateMetrics metrics;
    private final ExecutorService taskWorkerPool;

    public WaveScheduler(SessionStore store, CheckpointGate gate, EventBus eventBus,
                         SessionMonitors monitors, WavegateMetrics metrics,
                         @Qualifier("taskWorkerPool") ExecutorService taskWorkerPool) {
        this.store = store;
        this.gate = gate;
        this.eventBus = eventBus;
        this.monitors = monitors;
        this.metrics = metrics;
        this.taskWorkerPool = taskWorkerPool;
    }

    /**
     * Runs the session to completion or failure. Task errors and approval timeouts fail the
     * session; an interrupt leaves it {@code in_progress} so it can be resumed later.
     */
    public void run(String sessionId, WavePlan plan) throws InterruptedException {
        MdcContext.setSession(sessionId);
        try {
            Session session = store.requireSession(sessionId);
            if (session.status().isTerminal()) {
                log.info("Session {} is already {}", sessionId, session.status().wireName());
                return;
            }
            log.info("Running session {} with plan {} ({} mode)", sessionId, plan.name(), session.mode().wireName());

            for (Wave wave : plan.waves()) {
                runWave(sessionId, plan, wave);
            }
            runConsolidation(sessionId, plan);
        } catch (TaskExecutionException e) {
            fail(sessionId, e.getMessage(), e.getTaskName());
        } catch (CheckpointTimeoutException e) {
            String taskName = store.loadCheckpoint(sessionId, e.getCheckpointNumber())
                    .map(Checkpoint::taskName).orElse(null);
            fail(sessionId, e.getMessage(), taskName);
        } catch (SessionNotActiveException e) {
            log.info("Stopping runner: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("Session {} aborted: {}", sessionId, e.getMessage(), e);
            fail(sessionId, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), null);
        } finally {
            MdcContext.clear();
        }
    }

    // ── Waves ─────────────────────────────────────────────────────────────

    private void runWave(String sessionId, WavePlan plan, Wave wave) throws InterruptedException {
        List<String> taskNames = wave.taskNames();
        int firstNumber = plan.checkpointNumberOf(taskNames.get(0));
        int lastNumber = firstNumber + taskNames.size() - 1;

        Session session = store.requireSession(sessionId);
        if (session.approvedThrough() >= lastNumber) {
            log.debug("Wave {} already approved, skipping", wave.number());
            return;
        }

        MdcContext.setWave(sessionId, wave.number());
        long waveStart = System.currentTimeMillis();
        session = updateSession(sessionId, s -> s.withCurrentWave(wave.number()));
        log.info("Starting wave {} with tasks {}", wave.number(), taskNames);
        var started = new LinkedHashMap<String, Object>();
        started.put("wave", wave.number());
        started.put("task_names", taskNames);
        eventBus.publish(WavegateEvent.of(EventType.WAVE_STARTED, sessionId, started));

        // checkpoints up to current_checkpoint already exist and are not re-executed
        int existing = session.currentCheckpoint();
        Map<String, Map<String, Object>> visible =
                store.loadContext(sessionId).snapshot(plan.tasksBefore(wave.number()));

        var futures = new LinkedHashMap<String, CompletableFuture<TaskOutcome>>();
        for (var task : wave.tasks()) {
            if (plan.checkpointNumberOf(task.name()) <= existing) {
                continue;
            }
            final Session current = session;
            futures.put(task.name(), CompletableFuture.supplyAsync(
                    () -> execute(current, task.name(), wave.number(), task.executor(), visible, null, true),
                    taskWorkerPool));
        }
        Map<String, TaskOutcome> outcomes = awaitAll(futures);

        // first failure in definition order aborts the wave
        for (var entry : outcomes.entrySet()) {
            if (entry.getValue().error() != null) {
                throw new TaskExecutionException(entry.getKey(), entry.getValue().error());
            }
        }

        for (String taskName : taskNames) {
            int number = plan.checkpointNumberOf(taskName);
            Regenerator regenerator = regenerator(sessionId, plan, taskName);
            if (number <= existing) {
                gate.awaitApproval(sessionId, number, regenerator);
                continue;
            }
            TaskOutcome outcome = outcomes.get(taskName);
            Checkpoint created = gate.create(sessionId, taskName, wave.number(),
                    outcome.output(), outcome.metadata());
            if (created.number() != number) {
                throw new IllegalStateException("Checkpoint for " + taskName + " got number "
                        + created.number() + ", expected " + number);
            }
            gate.awaitApproval(sessionId, number, regenerator);
        }

        metrics.recordWaveExecution(taskNames.size(), System.currentTimeMillis() - waveStart);
        log.info("Wave {} complete", wave.number());
        var complete = new LinkedHashMap<String, Object>();
        complete.put("wave", wave.number());
        complete.put("next_wave", wave.number() < plan.waves().size() ? wave.number() + 1 : null);
        eventBus.publish(WavegateEvent.of(EventType.WAVE_COMPLETE, sessionId, complete));
    }

    private void runConsolidation(String sessionId, WavePlan plan) throws InterruptedException {
        int number = plan.finalCheckpointNumber();
        int finalWave = plan.finalWave();
        MdcContext.setWave(sessionId, finalWave);
        Session session = updateSession(sessionId, s -> s.withCurrentWave(finalWave));
        Regenerator regenerator = regenerator(sessionId, plan, WavePlan.FINAL_TASK);

        Checkpoint approved;
        if (session.currentCheckpoint() >= number) {
            approved = gate.awaitApproval(sessionId, number, regenerator);
        } else {
            log.info("Running final consolidation");
            TaskOutcome outcome = executeOnPool(session, WavePlan.FINAL_TASK, finalWave,
                    plan.consolidation(), store.loadContext(sessionId).getEntries(), null, false);
            if (outcome.error() != null) {
                throw new TaskExecutionException(WavePlan.FINAL_TASK, outcome.error());
            }
            Checkpoint created = gate.create(sessionId, WavePlan.FINAL_TASK, finalWave,
                    outcome.output(), outcome.metadata());
            approved = gate.awaitApproval(sessionId, created.number(), regenerator);
        }
        complete(sessionId, approved);
    }

    private void complete(String sessionId, Checkpoint finalCheckpoint) {
        store.saveTerminalArtifact(new TerminalArtifact(sessionId, finalCheckpoint.output().narrative(),
                finalCheckpoint.output().structured(), Instant.now()));
        Session completed = updateSession(sessionId, Session::completed);
        log.info("Session {} completed after {} checkpoints and {} regenerations",
                sessionId, completed.approvedThrough(), completed.regenerations());
        metrics.recordSessionResult("completed");
        monitors.release(sessionId);
        eventBus.publish(WavegateEvent.of(EventType.SESSION_COMPLETE, sessionId, Map.of(
                "total_checkpoints", completed.totalCheckpoints(),
                "regenerations", completed.regenerations())));
    }

    private void fail(String sessionId, String message, String taskName) {
        log.error("Session {} failed{}: {}", sessionId, taskName != null ? " in task " + taskName : "", message);
        try {
            updateSession(sessionId, s -> s.status().isTerminal() ? s : s.failed(message, taskName));
        } catch (RuntimeException e) {
            log.error("Could not record failure of session {}", sessionId, e);
        }
        metrics.recordSessionResult("failed");
        monitors.release(sessionId);
        var payload = new LinkedHashMap<String, Object>();
        payload.put("message", message);
        payload.put("task_name", taskName);
        eventBus.publish(WavegateEvent.of(EventType.ERROR, sessionId, payload));
    }

    // ── Tasks ─────────────────────────────────────────────────────────────

    private Regenerator regenerator(String sessionId, WavePlan plan, String taskName) {
        return rejected -> {
            Session session = store.requireSession(sessionId);
            SharedContext context = store.loadContext(sessionId);
            boolean consolidation = WavePlan.FINAL_TASK.equals(taskName);
            int wave = plan.waveOf(taskName);
            Map<String, Map<String, Object>> visible = consolidation
                    ? context.getEntries()
                    : context.snapshot(plan.tasksBefore(wave));
            TaskOutcome outcome = executeOnPool(session, taskName, wave, plan.executorFor(taskName),
                    visible, rejected.latestFeedback(), !consolidation);
            if (outcome.error() != null) {
                throw new TaskExecutionException(taskName, outcome.error());
            }
            return new Regenerator.Result(outcome.output(), outcome.metadata());
        };
    }

    private TaskOutcome executeOnPool(Session session, String taskName, int wave, TaskExecutor executor,
                                      Map<String, Map<String, Object>> context, String feedback,
                                      boolean mergeIntoContext) throws InterruptedException {
        var future = CompletableFuture.supplyAsync(
                () -> execute(session, taskName, wave, executor, context, feedback, mergeIntoContext),
                taskWorkerPool);
        try {
            return future.get();
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Task " + taskName + " could not be executed", e.getCause());
        }
    }

    private Map<String, TaskOutcome> awaitAll(LinkedHashMap<String, CompletableFuture<TaskOutcome>> futures)
            throws InterruptedException {
        try {
            CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0])).get();
        } catch (InterruptedException e) {
            futures.values().forEach(f -> f.cancel(true));
            throw e;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Wave task could not be executed", e.getCause());
        }
        var outcomes = new LinkedHashMap<String, TaskOutcome>();
        futures.forEach((name, future) -> outcomes.put(name, future.join()));
        return outcomes;
    }

    /**
     * Runs one task executor on the calling worker thread. Never throws: failures are
     * returned in the outcome.
     */
    private TaskOutcome execute(Session session, String taskName, int wave, TaskExecutor executor,
                                Map<String, Map<String, Object>> context, String feedback,
                                boolean mergeIntoContext) {
        MdcContext.setTask(session.id(), wave, taskName);
        long startMs = System.currentTimeMillis();
        try {
            log.info("Executing task {}{}", taskName, feedback != null ? " with feedback" : "");
            TaskResult result = executor.execute(new TaskInput(session.id(), taskName, wave,
                    session.mode(), session.input(), context, feedback));
            if (result == null) {
                throw new IllegalStateException("Executor returned no result");
            }
            long elapsedMs = System.currentTimeMillis() - startMs;
            metrics.recordTaskExecution(taskName, true, elapsedMs);
            if (mergeIntoContext) {
                mergeIntoContext(session.id(), taskName, result.structured());
            }
            double seconds = elapsedMs / 1000.0;
            var payload = new LinkedHashMap<String, Object>();
            payload.put("wave", wave);
            payload.put("task_name", taskName);
            payload.put("duration_seconds", seconds);
            payload.put("regenerated", feedback != null);
            eventBus.publish(WavegateEvent.of(EventType.AGENT_COMPLETED, session.id(), payload));
            return new TaskOutcome(
                    new CheckpointOutput(result.narrative(), result.structured()),
                    new CheckpointMetadata(Instant.now(), result.costUnits(), seconds),
                    null);
        } catch (Exception e) {
            log.error("Task {} failed: {}", taskName, e.getMessage(), e);
            metrics.recordTaskExecution(taskName, false, System.currentTimeMillis() - startMs);
            return new TaskOutcome(null, null, e);
        } finally {
            MdcContext.clear();
        }
    }

    private void mergeIntoContext(String sessionId, String taskName, Map<String, Object> structured) {
        SessionMonitor monitor = monitors.of(sessionId);
        monitor.lock();
        try {
            SharedContext updated = store.loadContext(sessionId).with(taskName, structured);
            store.saveContext(sessionId, updated);
            log.debug("Merged {} into context version {}", taskName, updated.getVersion());
        } finally {
            monitor.unlock();
        }
    }

    private Session updateSession(String sessionId, UnaryOperator<Session> change) {
        SessionMonitor monitor = monitors.of(sessionId);
        monitor.lock();
        try {
            Session updated = change.apply(store.requireSession(sessionId));
            store.saveSession(updated);
            return updated;
        } finally {
            monitor.unlock();
        }
    }

    private record TaskOutcome(CheckpointOutput output, CheckpointMetadata metadata, Exception error) {}
}
