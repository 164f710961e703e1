package com.wavegate.core.plan;

import java.util.Objects;

/**
 * A named task inside a wave.
 */
public record TaskSpec(String name, TaskExecutor executor) {

    public TaskSpec {
        Objects.requireNonNull(name, "Task name must not be null");
        Objects.requireNonNull(executor, "Task executor must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Task name must not be blank");
        }
    }
}
