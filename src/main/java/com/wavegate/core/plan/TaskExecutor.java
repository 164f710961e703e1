package com.wavegate.core.plan;

/**
 * Opaque unit of work run by the scheduler. Implementations read the shared-context snapshot in
 * the {@link TaskInput} and return a structured result plus a narrative.
 * <p>
 * Executors of one wave run concurrently on the task worker pool and must not rely on each
 * other's output.
 */
@FunctionalInterface
public interface TaskExecutor {

    TaskResult execute(TaskInput input) throws Exception;
}
