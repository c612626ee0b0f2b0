package io.taskrunr.task;

/**
 * Performs the actual work of a task. Treated by the scheduler as a black box.
 *
 * <p>Implementations report the outcome by updating the task's {@code status},
 * {@code result} and {@code error} in the {@link TaskRegistry}. Throwing means the
 * executor itself broke, which the scheduler records separately from a task that
 * merely finished with a failed status.</p>
 */
@FunctionalInterface
public interface ScheduledTaskExecutor {

    /**
     * Runs the task and blocks until it finishes.
     */
    void execute(String taskId) throws Exception;
}
