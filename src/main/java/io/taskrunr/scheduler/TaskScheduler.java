package io.taskrunr.scheduler;

import io.taskrunr.config.SchedulerProperties;
import io.taskrunr.persistence.PersistenceException;
import io.taskrunr.persistence.Schedule;
import io.taskrunr.persistence.ScheduleStore;
import io.taskrunr.persistence.TaskRun;
import io.taskrunr.scheduler.SchedulerEvent.ScheduleRemoved;
import io.taskrunr.scheduler.SchedulerEvent.ScheduleUpdated;
import io.taskrunr.task.TaskRecord;
import io.taskrunr.task.TaskRegistry;
import io.taskrunr.trigger.DateTrigger;
import io.taskrunr.trigger.ScheduleParseException;
import io.taskrunr.trigger.ScheduleType;
import io.taskrunr.trigger.TriggerDescriptor;
import io.taskrunr.trigger.TriggerParser;
import jakarta.annotation.PreDestroy;
import org.jobrunr.jobs.Job;
import org.jobrunr.jobs.states.StateName;
import org.jobrunr.scheduling.JobScheduler;
import org.jobrunr.storage.JobNotFoundException;
import org.jobrunr.storage.StorageProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Schedules registered tasks on cron, interval and one-shot triggers.
 *
 * <p>Each active schedule owns exactly one pending JobRunr job, scheduled at the trigger's
 * next fire instant. When it fires the next job is scheduled before the task runs, so a
 * long run never delays the following fire (the overlap guard in
 * {@link ScheduledTaskRunner} skips it instead).</p>
 *
 * <p>Schedules are persisted in the {@link ScheduleStore} and re-registered on start. The
 * JobRunr job table itself is not durable.</p>
 */
@Service
public class TaskScheduler {

    private static final Logger log = LoggerFactory.getLogger(TaskScheduler.class);

    static final String CLEANUP_JOB_ID = "task-run-cleanup";
    static final int HISTORY_PER_TASK = 5;

    private final TriggerParser triggerParser;
    private final ScheduleStore store;
    private final TaskRegistry taskRegistry;
    private final ScheduledTaskRunner taskRunner;
    private final TriggerFireJob fireJob;
    private final RunHistoryCleanupJob cleanupJob;
    private final SchedulerEvents events;
    private final JobScheduler jobScheduler;
    private final StorageProvider storageProvider;
    private final SchedulerProperties properties;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Registration> scheduledTasks = new LinkedHashMap<>();
    private final AtomicBoolean started = new AtomicBoolean();

    public TaskScheduler(TriggerParser triggerParser, ScheduleStore store, TaskRegistry taskRegistry,
                         ScheduledTaskRunner taskRunner, TriggerFireJob fireJob,
                         RunHistoryCleanupJob cleanupJob, SchedulerEvents events,
                         JobScheduler jobScheduler, StorageProvider storageProvider,
                         SchedulerProperties properties) {
        this.triggerParser = triggerParser;
        this.store = store;
        this.taskRegistry = taskRegistry;
        this.taskRunner = taskRunner;
        this.fireJob = fireJob;
        this.cleanupJob = cleanupJob;
        this.events = events;
        this.jobScheduler = jobScheduler;
        this.storageProvider = storageProvider;
        this.properties = properties;
    }

    // --- Lifecycle ---

    /**
     * Re-registers persisted schedules and registers the daily run history cleanup.
     * Runs once; later calls are ignored.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        int loaded = loadSchedules();

        ZoneId zone = properties.zoneId();
        String cron = "0 %d * * *".formatted(properties.cleanupHour());
        jobScheduler.scheduleRecurrently(CLEANUP_JOB_ID, cron, zone, () -> cleanupJob.cleanup());

        log.info("Task scheduler started: {} schedules loaded, run history cleanup at '{}' ({})",
                loaded, cron, zone);
    }

    /**
     * Removes every JobRunr job this scheduler owns. Persisted schedules are kept and
     * in-flight runs finish on their own.
     */
    @PreDestroy
    public void shutdown() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        lock.lock();
        try {
            for (Registration registration : scheduledTasks.values()) {
                deletePendingJob(registration, false);
            }
            scheduledTasks.clear();
        } finally {
            lock.unlock();
        }
        storageProvider.deleteRecurringJob(CLEANUP_JOB_ID);
        log.info("Task scheduler stopped");
    }

    public boolean isStarted() {
        return started.get();
    }

    int loadSchedules() {
        List<Schedule> schedules;
        try {
            schedules = store.getAllSchedules();
        } catch (PersistenceException e) {
            log.error("Error loading schedules, starting without persisted schedules", e);
            return 0;
        }

        Instant now = Instant.now();
        int loaded = 0;
        for (Schedule schedule : schedules) {
            String taskId = schedule.taskId();
            if (!taskRegistry.exists(taskId)) {
                log.warn("Cannot load schedule for task {}: Task not found", taskId);
                continue;
            }

            String spec = schedule.scheduleValue();
            if (schedule.scheduleType() == ScheduleType.DATE) {
                Instant runAt = triggerParser.resolveOneShot(spec, schedule.createdAt());
                if (runAt != null && !runAt.isAfter(now)) {
                    log.warn("Skipping past date schedule for task {}: {}", taskId, spec);
                    continue;
                }
                if (runAt != null && spec.startsWith(TriggerParser.RELATIVE_PREFIX)) {
                    spec = TriggerParser.DATE_PREFIX + runAt;
                }
            }

            if (scheduleTask(taskId, spec)) {
                loaded++;
            } else {
                log.warn("Could not restore schedule '{}' for task {}", spec, taskId);
            }
        }
        return loaded;
    }

    // --- Scheduling ---

    public boolean scheduleTask(String taskId, String spec) {
        return scheduleTask(taskId, spec, null);
    }

    /**
     * Schedules a task, replacing any schedule it already has.
     *
     * @param taskId    a task known to the registry
     * @param spec      schedule spec, see {@link TriggerParser}
     * @param startTime optional anchor for interval schedules
     * @return false if the task is unknown, the spec is invalid or registration failed
     */
    public boolean scheduleTask(String taskId, String spec, Instant startTime) {
        TaskRecord task = taskRegistry.get(taskId);
        if (task == null) {
            log.error("Cannot schedule task {}: Task not found", taskId);
            return false;
        }

        TriggerDescriptor trigger;
        try {
            trigger = triggerParser.parse(spec, startTime);
        } catch (ScheduleParseException e) {
            log.error("Invalid schedule specification '{}' for task {}: {}", spec, taskId, e.getMessage());
            return false;
        }

        String humanReadable = triggerParser.getHumanReadable(spec);
        Registration registration = new Registration(newJobId(taskId), spec, trigger);
        ScheduleInfo info;

        lock.lock();
        try {
            try {
                arm(taskId, registration, Instant.now());
            } catch (RuntimeException e) {
                log.error("Error registering schedule '{}' for task {}", spec, taskId, e);
                return false;
            }

            Registration previous = scheduledTasks.put(taskId, registration);
            try {
                try {
                    store.saveSchedule(taskId, registration.jobId, trigger.type(), spec, registration.nextFireTime);
                } catch (PersistenceException e) {
                    log.warn("Schedule for task {} was not persisted and will not survive a restart: {}",
                            taskId, e.getMessage());
                }
                task.setSchedule(humanReadable);
                task.setNextRunTime(registration.nextFireTime);
                info = toInfo(taskId, registration, humanReadable);
            } catch (RuntimeException e) {
                log.error("Error scheduling task {}, rolling back", taskId, e);
                deletePendingJob(registration, false);
                if (previous != null) {
                    scheduledTasks.put(taskId, previous);
                } else {
                    scheduledTasks.remove(taskId);
                }
                return false;
            }

            if (previous != null) {
                deletePendingJob(previous, false);
            }
        } finally {
            lock.unlock();
        }

        log.info("Scheduled task {} with {} ({}), next run at {}",
                taskId, spec, registration.jobId, registration.nextFireTime);
        events.notifyListeners(new ScheduleUpdated(taskId, info));
        return true;
    }

    /**
     * Removes the schedule of a task.
     *
     * @return false if the task has no active schedule
     */
    public boolean cancelTask(String taskId) {
        lock.lock();
        try {
            Registration registration = scheduledTasks.remove(taskId);
            if (registration == null) {
                log.warn("Cannot cancel task {}: Not scheduled", taskId);
                return false;
            }
            deletePendingJob(registration, true);

            try {
                store.deleteSchedule(taskId);
            } catch (PersistenceException e) {
                log.warn("Persisted schedule of task {} could not be deleted: {}", taskId, e.getMessage());
            }

            TaskRecord task = taskRegistry.get(taskId);
            if (task != null) {
                task.setSchedule(null);
                task.setNextRunTime(null);
            }
        } finally {
            lock.unlock();
        }

        log.info("Cancelled schedule of task {}", taskId);
        events.notifyListeners(new ScheduleRemoved(taskId));
        return true;
    }

    /**
     * Enqueues an immediate run of a task next to its schedule.
     *
     * @return false if the task is unknown
     */
    public boolean runNow(String taskId) {
        if (!taskRegistry.exists(taskId)) {
            log.error("Cannot run task {}: Task not found", taskId);
            return false;
        }
        jobScheduler.enqueue(() -> taskRunner.onFire(taskId));
        log.info("Enqueued immediate run of task {}", taskId);
        return true;
    }

    /**
     * Called by {@link TriggerFireJob} when the pending job of a registration fires.
     * Schedules the next fire, then runs the task unless the fire is later than the
     * misfire grace period. Fires of replaced or cancelled registrations are ignored.
     */
    void onTrigger(String taskId, String jobId, Instant scheduledAt) {
        boolean run;
        lock.lock();
        try {
            Registration registration = scheduledTasks.get(taskId);
            if (registration == null || !registration.jobId.equals(jobId)) {
                log.debug("Ignoring fire of stale job {} for task {}", jobId, taskId);
                return;
            }

            Instant now = Instant.now();
            Duration lateness = Duration.between(scheduledAt, now);
            run = lateness.compareTo(properties.misfireGrace()) <= 0;
            if (!run) {
                log.warn("Run time of job {} for task {} was missed by {}", jobId, taskId, lateness);
            }

            registration.pendingJob = null;
            registration.nextFireTime = null;
            Instant base = now.isAfter(scheduledAt) ? now : scheduledAt;
            try {
                arm(taskId, registration, base);
            } catch (RuntimeException e) {
                log.error("Could not schedule next run of task {}", taskId, e);
            }
            refreshNextRunTime(taskId, registration.nextFireTime);
        } finally {
            lock.unlock();
        }

        if (run) {
            taskRunner.onFire(taskId);
        }
    }

    // --- Queries ---

    /**
     * Returns the live schedule of a task, or null if it has none or its trigger will
     * not fire again.
     */
    public ScheduleInfo getTaskSchedule(String taskId) {
        String jobId;
        UUID pendingJob;
        Instant nextFireTime;
        TriggerDescriptor trigger;
        lock.lock();
        try {
            Registration registration = scheduledTasks.get(taskId);
            if (registration == null) {
                return null;
            }
            jobId = registration.jobId;
            pendingJob = registration.pendingJob;
            nextFireTime = registration.nextFireTime;
            trigger = registration.trigger;
        } finally {
            lock.unlock();
        }
        if (!isPending(pendingJob)) {
            return null;
        }

        Schedule persisted;
        try {
            persisted = store.getSchedule(taskId).orElse(null);
        } catch (PersistenceException e) {
            log.error("Error reading schedule of task {}", taskId, e);
            return null;
        }
        if (persisted == null) {
            return null;
        }

        return new ScheduleInfo(taskId, jobId, persisted.scheduleType(), persisted.scheduleValue(),
                triggerParser.getHumanReadable(persisted.scheduleValue()), nextFireTime,
                triggerParser.getTriggerInfo(trigger));
    }

    /**
     * Returns the live schedule of every scheduled task, keyed by task id.
     */
    public Map<String, ScheduleInfo> getAllSchedules() {
        List<String> taskIds;
        lock.lock();
        try {
            taskIds = new ArrayList<>(scheduledTasks.keySet());
        } finally {
            lock.unlock();
        }

        Map<String, ScheduleInfo> result = new LinkedHashMap<>();
        for (String taskId : taskIds) {
            ScheduleInfo info = getTaskSchedule(taskId);
            if (info != null) {
                result.put(taskId, info);
            }
        }
        return result;
    }

    /**
     * Returns the schedules with a known next run, soonest first.
     */
    public List<ScheduleInfo> getUpcomingSchedules(int limit) {
        return getAllSchedules().values().stream()
                .filter(info -> info.nextRunTime() != null)
                .sorted(Comparator.comparing(ScheduleInfo::nextRunTime))
                .limit(limit)
                .toList();
    }

    public List<TaskRun> getTaskRuns(String taskId) {
        return getTaskRuns(taskId, properties.historyLimit());
    }

    /**
     * Returns the run history of a task, newest first. Empty if the store cannot be read.
     */
    public List<TaskRun> getTaskRuns(String taskId, int limit) {
        try {
            return store.getTaskRuns(taskId, limit);
        } catch (PersistenceException e) {
            log.error("Error reading run history of task {}", taskId, e);
            return List.of();
        }
    }

    /**
     * Merges the recent runs of all scheduled tasks, newest first.
     */
    public List<TaskRun> getExecutionHistory(int limit) {
        List<String> taskIds;
        lock.lock();
        try {
            taskIds = new ArrayList<>(scheduledTasks.keySet());
        } finally {
            lock.unlock();
        }

        List<TaskRun> runs = new ArrayList<>();
        for (String taskId : taskIds) {
            runs.addAll(getTaskRuns(taskId, HISTORY_PER_TASK));
        }
        return runs.stream()
                .sorted(Comparator.comparing(TaskRun::startTime).thenComparingLong(TaskRun::id).reversed())
                .limit(limit)
                .toList();
    }

    public void addListener(SchedulerListener listener) {
        events.addListener(listener);
    }

    public void removeListener(SchedulerListener listener) {
        events.removeListener(listener);
    }

    /**
     * Returns the JobRunr job currently pending for a task, null if there is none.
     */
    UUID pendingJob(String taskId) {
        lock.lock();
        try {
            Registration registration = scheduledTasks.get(taskId);
            return registration != null ? registration.pendingJob : null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the job id of the current registration of a task, null if not scheduled.
     */
    String jobId(String taskId) {
        lock.lock();
        try {
            Registration registration = scheduledTasks.get(taskId);
            return registration != null ? registration.jobId : null;
        } finally {
            lock.unlock();
        }
    }

    // --- Internals ---

    /**
     * Schedules the next JobRunr job of a registration after {@code after}. A one-shot
     * trigger that is already past is fired right away if it is within the misfire grace
     * period and dropped otherwise.
     */
    private void arm(String taskId, Registration registration, Instant after) {
        TriggerDescriptor trigger = registration.trigger;
        boolean spent = trigger instanceof DateTrigger && registration.fired;
        Instant next = spent ? null : trigger.nextFireTime(after);
        Instant scheduledAt = next;

        if (next == null && !spent && trigger instanceof DateTrigger date) {
            Duration late = Duration.between(date.runAt(), after);
            if (late.compareTo(properties.misfireGrace()) <= 0) {
                next = after;
                scheduledAt = after;
            } else {
                log.warn("Run time of job {} for task {} was missed by {}, it will not fire",
                        registration.jobId, taskId, late);
            }
        }

        if (next == null) {
            registration.nextFireTime = null;
            registration.pendingJob = null;
            if (!(trigger instanceof DateTrigger)) {
                log.warn("Schedule '{}' of task {} has no future fire time", registration.spec, taskId);
            }
            return;
        }

        UUID pendingJob = UUID.randomUUID();
        String jobId = registration.jobId;
        String fireAt = scheduledAt.toString();
        jobScheduler.schedule(pendingJob, next, () -> fireJob.fire(taskId, jobId, fireAt));

        registration.pendingJob = pendingJob;
        registration.nextFireTime = next;
        if (trigger instanceof DateTrigger) {
            registration.fired = true;
        }
        log.debug("Job {} of task {} will fire at {}", jobId, taskId, next);
    }

    private void deletePendingJob(Registration registration, boolean warnIfGone) {
        UUID pendingJob = registration.pendingJob;
        registration.pendingJob = null;
        if (pendingJob == null) {
            if (warnIfGone) {
                log.warn("Job {} not found in scheduler, it may have already fired", registration.jobId);
            }
            return;
        }
        try {
            jobScheduler.delete(pendingJob);
        } catch (JobNotFoundException e) {
            if (warnIfGone) {
                log.warn("Job {} not found in scheduler: {}", registration.jobId, e.getMessage());
            }
        } catch (RuntimeException e) {
            log.warn("Could not delete JobRunr job {} of {}: {}", pendingJob, registration.jobId, e.getMessage());
        }
    }

    private boolean isPending(UUID pendingJob) {
        if (pendingJob == null) {
            return false;
        }
        try {
            Job job = storageProvider.getJobById(pendingJob);
            StateName state = job.getState();
            return state == StateName.SCHEDULED || state == StateName.ENQUEUED || state == StateName.PROCESSING;
        } catch (JobNotFoundException e) {
            log.debug("JobRunr job {} no longer exists", pendingJob);
            return false;
        }
    }

    private void refreshNextRunTime(String taskId, Instant nextRunTime) {
        TaskRecord task = taskRegistry.get(taskId);
        if (task != null) {
            task.setNextRunTime(nextRunTime);
        }
        try {
            store.updateNextRunTime(taskId, nextRunTime);
        } catch (PersistenceException e) {
            log.warn("Could not persist next run time of task {}: {}", taskId, e.getMessage());
        }
    }

    private ScheduleInfo toInfo(String taskId, Registration registration, String humanReadable) {
        return new ScheduleInfo(taskId, registration.jobId, registration.trigger.type(), registration.spec,
                humanReadable, registration.nextFireTime, triggerParser.getTriggerInfo(registration.trigger));
    }

    private static String newJobId(String taskId) {
        return "task-%s-%s".formatted(taskId, UUID.randomUUID());
    }

    /**
     * One registration of a schedule. Mutable fields are guarded by the scheduler lock.
     */
    private static final class Registration {
        final String jobId;
        final String spec;
        final TriggerDescriptor trigger;
        UUID pendingJob;
        Instant nextFireTime;
        boolean fired;

        Registration(String jobId, String spec, TriggerDescriptor trigger) {
            this.jobId = jobId;
            this.spec = spec;
            this.trigger = trigger;
        }
    }
}
