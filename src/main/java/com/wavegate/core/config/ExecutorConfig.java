package com.wavegate.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools used by the scheduler.
 * <p>
 * {@code taskWorkerPool} is a bounded pool shared by every session and runs task executors.
 * {@code sessionRunnerPool} hosts one long-lived runner per active session; runners spend most
 * of their life parked at a checkpoint gate, so the pool is unbounded.
 */
@Configuration
public class ExecutorConfig {

    private static final Logger log = LoggerFactory.getLogger(ExecutorConfig.class);

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService taskWorkerPool(WavegateProperties properties) {
        int size = Math.max(1, properties.getScheduler().getMaxParallel());
        log.info("Task worker pool size {}", size);
        return Executors.newFixedThreadPool(size, namedThreads("wavegate-task-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService sessionRunnerPool() {
        return Executors.newCachedThreadPool(namedThreads("wavegate-session-"));
    }

    static ThreadFactory namedThreads(String prefix) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
