package com.wavegate.core.plan;

import java.util.List;

/**
 * A set of tasks that run concurrently before a synchronization barrier.
 *
 * @param number 1-based position in the plan
 * @param tasks  tasks in definition order; checkpoints follow this order
 */
public record Wave(int number, List<TaskSpec> tasks) {

    public Wave {
        tasks = List.copyOf(tasks);
    }

    public List<String> taskNames() {
        return tasks.stream().map(TaskSpec::name).toList();
    }
}
