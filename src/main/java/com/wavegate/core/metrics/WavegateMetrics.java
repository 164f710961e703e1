package com.wavegate.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for session execution.
 */
@Service
public class WavegateMetrics {

    private final MeterRegistry registry;

    public WavegateMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTaskExecution(String taskName, boolean success, long ms) {
        Timer.builder("wavegate.task.duration")
                .tag("task", taskName)
                .tag("success", String.valueOf(success))
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordWaveExecution(int taskCount, long ms) {
        Timer.builder("wavegate.wave.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
        DistributionSummary.builder("wavegate.wave.task_count")
                .description("Number of tasks per wave")
                .register(registry)
                .record(taskCount);
    }

    /**
     * Time a checkpoint spent waiting for a human decision.
     */
    public void recordApprovalWait(long ms) {
        Timer.builder("wavegate.checkpoint.approval_wait")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * @param decision "approved", "rejected" or "regenerated"
     */
    public void recordCheckpointDecision(String decision) {
        Counter.builder("wavegate.checkpoint.decisions")
                .tag("decision", decision)
                .register(registry)
                .increment();
    }

    public void recordSessionResult(String status) {
        Counter.builder("wavegate.sessions.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordRecoveredSession() {
        Counter.builder("wavegate.sessions.recovered")
                .description("Sessions resumed after a restart")
                .register(registry)
                .increment();
    }
}
