package io.taskrunr.task;

/**
 * Lifecycle status of a task in the registry.
 */
public enum TaskStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    public String value() {
        return name().toLowerCase();
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
