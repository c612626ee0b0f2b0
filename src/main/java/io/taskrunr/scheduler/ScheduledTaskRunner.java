package io.taskrunr.scheduler;

import io.taskrunr.persistence.PersistenceException;
import io.taskrunr.persistence.RunStatus;
import io.taskrunr.persistence.ScheduleStore;
import io.taskrunr.scheduler.SchedulerEvent.TaskErrored;
import io.taskrunr.scheduler.SchedulerEvent.TaskFinished;
import io.taskrunr.scheduler.SchedulerEvent.TaskStarted;
import io.taskrunr.task.ScheduledTaskExecutor;
import io.taskrunr.task.TaskRecord;
import io.taskrunr.task.TaskRegistry;
import io.taskrunr.task.TaskStatus;
import org.jobrunr.jobs.annotations.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs a task when its trigger fires.
 *
 * <p>At most one run per task is in flight: a fire that arrives while the task is still
 * running is skipped. Each run leaves two rows in the run history, a {@code running} row
 * at start and a terminal row at the end.</p>
 */
@Component
public class ScheduledTaskRunner {

    private static final Logger log = LoggerFactory.getLogger(ScheduledTaskRunner.class);

    private final TaskRegistry taskRegistry;
    private final ScheduledTaskExecutor executor;
    private final ScheduleStore store;
    private final SchedulerEvents events;
    private final Set<String> runningTasks = ConcurrentHashMap.newKeySet();

    public ScheduledTaskRunner(TaskRegistry taskRegistry, ScheduledTaskExecutor executor,
                               ScheduleStore store, SchedulerEvents events) {
        this.taskRegistry = taskRegistry;
        this.executor = executor;
        this.store = store;
        this.events = events;
    }

    /**
     * Executes one run of a task. Also used as the JobRunr job for "run now" requests.
     */
    @Job(name = "Run task %0", retries = 0)
    public void onFire(String taskId) {
        TaskRecord task = taskRegistry.get(taskId);
        if (task == null) {
            log.error("Cannot execute scheduled task {}: Task not found", taskId);
            return;
        }
        if (!runningTasks.add(taskId)) {
            log.warn("Task {} is already running, skipping this run", taskId);
            return;
        }

        Instant startTime = Instant.now();
        try {
            logRun(taskId, RunStatus.RUNNING, startTime, null, null);
            events.notifyListeners(new TaskStarted(taskId, startTime));
            task.resetForRun();
            log.info("Executing scheduled task {}", taskId);

            try {
                executor.execute(taskId);
            } catch (Exception e) {
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                Instant endTime = Instant.now();
                log.error("Error executing scheduled task {}", taskId, e);
                logRun(taskId, RunStatus.FAILED, startTime, endTime, error);
                events.notifyListeners(new TaskErrored(taskId, error, startTime, endTime));
                return;
            }

            Instant endTime = Instant.now();
            String error = task.getError();
            RunStatus status = finalStatus(task.getStatus(), error);
            logRun(taskId, status, startTime, endTime, error);
            events.notifyListeners(new TaskFinished(taskId, status.value(), startTime, endTime, error));
            log.info("Scheduled task {} finished with status {}", taskId, status.value());
        } finally {
            runningTasks.remove(taskId);
        }
    }

    public boolean isRunning(String taskId) {
        return runningTasks.contains(taskId);
    }

    /**
     * Maps the status the executor left on the task to a history status.
     * A task still reporting pending or running counts as completed unless it carries an error.
     */
    static RunStatus finalStatus(TaskStatus status, String error) {
        if (status != null && status.isTerminal()) {
            return status == TaskStatus.COMPLETED ? RunStatus.COMPLETED : RunStatus.FAILED;
        }
        return error == null ? RunStatus.COMPLETED : RunStatus.FAILED;
    }

    private void logRun(String taskId, RunStatus status, Instant startTime, Instant endTime, String error) {
        try {
            store.logTaskRun(taskId, status, startTime, endTime, error);
        } catch (PersistenceException e) {
            log.warn("Could not record {} run of task {}: {}", status.value(), taskId, e.getMessage());
        }
    }
}
