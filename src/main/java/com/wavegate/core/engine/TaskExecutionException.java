package com.wavegate.core.engine;

/**
 * A task executor raised. Fatal to the session.
 */
public class TaskExecutionException extends RuntimeException {

    private final String taskName;

    public TaskExecutionException(String taskName, Throwable cause) {
        super("Task " + taskName + " failed: " + describe(cause), cause);
        this.taskName = taskName;
    }

    public String getTaskName() {
        return taskName;
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
