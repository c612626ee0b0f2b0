package io.taskrunr.task;

/**
 * Lookup of the tasks the scheduler may run. Owned by the host application.
 *
 * <p>When the owner deletes a task it is expected to cancel that task's schedule;
 * the scheduler does not watch the registry for removals.</p>
 */
public interface TaskRegistry {

    boolean exists(String taskId);

    /**
     * Returns the task record.
     *
     * @param taskId the task id
     * @return the record, or null if the task is unknown
     */
    TaskRecord get(String taskId);
}
