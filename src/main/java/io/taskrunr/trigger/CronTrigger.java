package io.taskrunr.trigger;

import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Crontab-style trigger. A fire instant must satisfy all five fields.
 * Day-of-week counts from 0 = Sunday.
 *
 * @param minute     0-59
 * @param hour       0-23
 * @param dayOfMonth 1-31
 * @param month      1-12
 * @param dayOfWeek  0-6
 * @param zone       zone the fields are evaluated in
 * @param schedule   the fields as a Spring cron expression, seconds pinned to 0
 */
public record CronTrigger(
        CronField minute,
        CronField hour,
        CronField dayOfMonth,
        CronField month,
        CronField dayOfWeek,
        ZoneId zone,
        CronExpression schedule
) implements TriggerDescriptor {

    /**
     * Builds a trigger from validated fields.
     *
     * @throws ScheduleParseException if Spring rejects the combined expression
     */
    public static CronTrigger of(CronField minute, CronField hour, CronField dayOfMonth,
                                 CronField month, CronField dayOfWeek, ZoneId zone) {
        // Spring steps day-of-week over 1-7, so pass the resolved days instead of the literal
        String expression = String.join(" ", "0", minute.literal(), hour.literal(),
                dayOfMonth.literal(), month.literal(), dayOfWeek.values());
        try {
            return new CronTrigger(minute, hour, dayOfMonth, month, dayOfWeek, zone,
                    CronExpression.parse(expression));
        } catch (IllegalArgumentException e) {
            throw new ScheduleParseException("Invalid cron expression: " + e.getMessage(), e);
        }
    }

    /**
     * Returns the expression in crontab order, without the {@code cron:} prefix.
     */
    public String expression() {
        return String.join(" ", minute.literal(), hour.literal(), dayOfMonth.literal(),
                month.literal(), dayOfWeek.literal());
    }

    @Override
    public ScheduleType type() {
        return ScheduleType.CRON;
    }

    /**
     * Returns null when no date matches, e.g. {@code 0 0 31 2 *}.
     */
    @Override
    public Instant nextFireTime(Instant after) {
        ZonedDateTime next = schedule.next(after.atZone(zone));
        return next != null ? next.toInstant() : null;
    }

    @Override
    public Map<String, Object> info() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("type", type().value());
        info.put("minute", minute.literal());
        info.put("hour", hour.literal());
        info.put("day", dayOfMonth.literal());
        info.put("month", month.literal());
        info.put("day_of_week", dayOfWeek.literal());
        return info;
    }
}
