package io.taskrunr.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Configuration properties for the task scheduler.
 *
 * <p>Binds to {@code scheduler} in application.yml:</p>
 * <pre>
 * scheduler:
 *   persistence-path: ${SCHEDULER_PERSISTENCE_PATH:./data/scheduler}
 *   timezone: ${SCHEDULER_TIMEZONE:UTC}
 *   retention-days: ${SCHEDULER_RETENTION_DAYS:30}
 *   cleanup-hour: 0
 *   misfire-grace-seconds: 60
 *   history-limit: 10
 * </pre>
 *
 * @param persistencePath     directory holding scheduler.db and the legacy scheduled_tasks.json
 * @param timezone            zone for cron fields, local timestamps and the cleanup hour
 * @param retentionDays       how long task run history is kept
 * @param cleanupHour         wall-clock hour of the daily retention cleanup
 * @param misfireGraceSeconds how late a one-shot trigger may still fire
 * @param historyLimit        default number of runs returned by history queries
 */
@ConfigurationProperties(prefix = "scheduler")
public record SchedulerProperties(
        String persistencePath,
        String timezone,
        Integer retentionDays,
        Integer cleanupHour,
        Integer misfireGraceSeconds,
        Integer historyLimit
) {

    public SchedulerProperties {
        if (persistencePath == null || persistencePath.isBlank()) {
            persistencePath = "./data/scheduler";
        }
        if (timezone == null || timezone.isBlank()) {
            timezone = "UTC";
        }
        if (retentionDays == null) {
            retentionDays = 30;
        }
        if (cleanupHour == null) {
            cleanupHour = 0;
        }
        if (cleanupHour < 0 || cleanupHour > 23) {
            throw new IllegalArgumentException("scheduler.cleanup-hour must be between 0 and 23: " + cleanupHour);
        }
        if (misfireGraceSeconds == null) {
            misfireGraceSeconds = 60;
        }
        if (historyLimit == null) {
            historyLimit = 10;
        }
    }

    /**
     * Returns properties with every default applied.
     */
    public static SchedulerProperties defaults() {
        return new SchedulerProperties(null, null, null, null, null, null);
    }

    public ZoneId zoneId() {
        return ZoneId.of(timezone);
    }

    public Path databaseFile() {
        return Path.of(persistencePath, "scheduler.db");
    }

    public Path legacyFile() {
        return Path.of(persistencePath, "scheduled_tasks.json");
    }

    public Duration misfireGrace() {
        return Duration.ofSeconds(misfireGraceSeconds);
    }
}
