package io.taskrunr.scheduler;

import io.taskrunr.config.SchedulerProperties;
import io.taskrunr.persistence.PersistenceException;
import io.taskrunr.persistence.ScheduleStore;
import org.jobrunr.jobs.annotations.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Daily job that drops task run history older than the retention window.
 */
@Component
public class RunHistoryCleanupJob {

    private static final Logger log = LoggerFactory.getLogger(RunHistoryCleanupJob.class);

    private final ScheduleStore store;
    private final int retentionDays;

    public RunHistoryCleanupJob(ScheduleStore store, SchedulerProperties properties) {
        this.store = store;
        this.retentionDays = properties.retentionDays();
    }

    @Job(name = "Clean up task run history", retries = 0)
    public void cleanup() {
        try {
            int deleted = store.cleanupOldRuns(retentionDays);
            log.info("Run history cleanup removed {} rows older than {} days", deleted, retentionDays);
        } catch (PersistenceException e) {
            log.error("Run history cleanup failed", e);
        }
    }
}
