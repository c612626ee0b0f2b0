package io.taskrunr.task;

import java.time.Instant;

/**
 * A task known to the registry. The scheduler writes the schedule fields and resets the
 * execution fields before each run; the executor fills in the outcome.
 *
 * <p>Fields are volatile: they are written from scheduler worker threads and read from
 * request threads.</p>
 */
public class TaskRecord {

    private final String id;
    private final String name;
    private volatile TaskStatus status = TaskStatus.PENDING;
    private volatile int progress;
    private volatile String result;
    private volatile String error;
    private volatile String schedule;
    private volatile Instant nextRunTime;
    private volatile Instant updatedAt = Instant.now();

    public TaskRecord(String id, String name) {
        this.id = id;
        this.name = name;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public TaskStatus getStatus() {
        return status;
    }

    public void setStatus(TaskStatus status) {
        this.status = status;
        touch();
    }

    public int getProgress() {
        return progress;
    }

    public void setProgress(int progress) {
        this.progress = progress;
        touch();
    }

    public String getResult() {
        return result;
    }

    public void setResult(String result) {
        this.result = result;
        touch();
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
        touch();
    }

    /**
     * Human-readable schedule description, null when the task is not scheduled.
     */
    public String getSchedule() {
        return schedule;
    }

    public void setSchedule(String schedule) {
        this.schedule = schedule;
    }

    public Instant getNextRunTime() {
        return nextRunTime;
    }

    public void setNextRunTime(Instant nextRunTime) {
        this.nextRunTime = nextRunTime;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    /**
     * Puts the task back to pending with no outcome, ready for a new run.
     */
    public void resetForRun() {
        this.status = TaskStatus.PENDING;
        this.progress = 0;
        this.result = null;
        this.error = null;
        touch();
    }

    private void touch() {
        this.updatedAt = Instant.now();
    }
}
