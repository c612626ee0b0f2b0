package io.taskrunr.trigger;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of trigger behind a persisted schedule.
 *
 * <ul>
 *   <li>{@code CRON}: five-field crontab expression</li>
 *   <li>{@code INTERVAL}: fixed repeat period</li>
 *   <li>{@code DATE}: one-shot absolute or relative instant</li>
 *   <li>{@code UNKNOWN}: a shape that could not be recognized (legacy imports only)</li>
 * </ul>
 */
public enum ScheduleType {
    CRON,
    INTERVAL,
    DATE,
    UNKNOWN;

    /**
     * Returns the lowercase name stored in the {@code schedules.schedule_type} column.
     */
    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    public static ScheduleType fromString(String s) {
        if (s == null || s.isBlank()) return UNKNOWN;
        return switch (s.trim().toLowerCase()) {
            case "cron" -> CRON;
            case "interval" -> INTERVAL;
            case "date" -> DATE;
            default -> UNKNOWN;
        };
    }
}
