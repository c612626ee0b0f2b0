package io.taskrunr.scheduler;

import org.jobrunr.jobs.annotations.Job;
import org.springframework.beans.factory.ObjectFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * JobRunr entry point for trigger fires. The scheduler is looked up lazily because it
 * also schedules this job.
 */
@Component
public class TriggerFireJob {

    private final ObjectFactory<TaskScheduler> scheduler;

    public TriggerFireJob(ObjectFactory<TaskScheduler> scheduler) {
        this.scheduler = scheduler;
    }

    @Job(name = "Scheduled task %0", retries = 0)
    public void fire(String taskId, String jobId, String scheduledAt) {
        scheduler.getObject().onTrigger(taskId, jobId, Instant.parse(scheduledAt));
    }
}
