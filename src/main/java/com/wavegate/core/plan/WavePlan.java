package com.wavegate.core.plan;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Static description of a session: an ordered list of waves followed by a final consolidation
 * task. Immutable once built.
 * <p>
 * Checkpoint numbers are derived from the plan: tasks are numbered 1..N in wave order and
 * definition order within each wave, and the consolidation checkpoint is N + 1.
 */
public final class WavePlan {

    public static final String FINAL_TASK = "final_consolidation";

    private final String name;
    private final String description;
    private final List<Wave> waves;
    private final TaskExecutor consolidation;

    private WavePlan(String name, String description, List<Wave> waves, TaskExecutor consolidation) {
        this.name = name;
        this.description = description;
        this.waves = List.copyOf(waves);
        this.consolidation = consolidation;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public List<Wave> waves() {
        return waves;
    }

    public TaskExecutor consolidation() {
        return consolidation;
    }

    /** Wave number used for the final consolidation checkpoint. */
    public int finalWave() {
        return waves.size() + 1;
    }

    /** Number of task checkpoints plus the final one. */
    public int totalCheckpoints() {
        return taskNames().size() + 1;
    }

    public int finalCheckpointNumber() {
        return totalCheckpoints();
    }

    public List<String> taskNames() {
        return waves.stream().flatMap(w -> w.taskNames().stream()).toList();
    }

    /**
     * Task names belonging to waves strictly before {@code waveNumber}. This is exactly what a
     * task of that wave may read from the shared context.
     */
    public List<String> tasksBefore(int waveNumber) {
        return waves.stream()
                .filter(w -> w.number() < waveNumber)
                .flatMap(w -> w.taskNames().stream())
                .toList();
    }

    public int checkpointNumberOf(String taskName) {
        if (FINAL_TASK.equals(taskName)) {
            return finalCheckpointNumber();
        }
        int index = taskNames().indexOf(taskName);
        if (index < 0) {
            throw new IllegalArgumentException("Task " + taskName + " is not part of plan " + name);
        }
        return index + 1;
    }

    public Optional<TaskSpec> task(String taskName) {
        return waves.stream()
                .flatMap(w -> w.tasks().stream())
                .filter(t -> t.name().equals(taskName))
                .findFirst();
    }

    /** Executor for a task name, including {@link #FINAL_TASK}. */
    public TaskExecutor executorFor(String taskName) {
        if (FINAL_TASK.equals(taskName)) {
            return consolidation;
        }
        return task(taskName)
                .map(TaskSpec::executor)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Task " + taskName + " is not part of plan " + name));
    }

    /** Wave number of a task name, including {@link #FINAL_TASK}. */
    public int waveOf(String taskName) {
        if (FINAL_TASK.equals(taskName)) {
            return finalWave();
        }
        for (Wave wave : waves) {
            if (wave.taskNames().contains(taskName)) {
                return wave.number();
            }
        }
        throw new IllegalArgumentException("Task " + taskName + " is not part of plan " + name);
    }

    @Override
    public String toString() {
        return "WavePlan[" + name + ", waves=" + waves.size() + ", checkpoints=" + totalCheckpoints() + "]";
    }

    public static final class Builder {

        private final String name;
        private String description = "";
        private final List<List<TaskSpec>> waves = new ArrayList<>();
        private TaskExecutor consolidation;

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "Plan name must not be null");
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder wave(TaskSpec... tasks) {
            return wave(List.of(tasks));
        }

        public Builder wave(List<TaskSpec> tasks) {
            waves.add(List.copyOf(tasks));
            return this;
        }

        public Builder consolidation(TaskExecutor executor) {
            this.consolidation = executor;
            return this;
        }

        public WavePlan build() {
            if (waves.isEmpty()) {
                throw new IllegalStateException("Plan " + name + " has no waves");
            }
            if (consolidation == null) {
                throw new IllegalStateException("Plan " + name + " has no consolidation task");
            }
            var seen = new HashSet<String>();
            var built = new ArrayList<Wave>();
            for (int i = 0; i < waves.size(); i++) {
                List<TaskSpec> tasks = waves.get(i);
                if (tasks.isEmpty()) {
                    throw new IllegalStateException("Wave " + (i + 1) + " of plan " + name + " is empty");
                }
                for (TaskSpec task : tasks) {
                    if (FINAL_TASK.equals(task.name()) || !seen.add(task.name())) {
                        throw new IllegalStateException("Duplicate or reserved task name in plan "
                                + name + ": " + task.name());
                    }
                }
                built.add(new Wave(i + 1, tasks));
            }
            return new WavePlan(name, description, built, consolidation);
        }
    }
}
