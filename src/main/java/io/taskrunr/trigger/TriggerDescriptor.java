package io.taskrunr.trigger;

import java.time.Instant;
import java.util.Map;

/**
 * Parsed form of a schedule spec: exactly one of {@link CronTrigger},
 * {@link IntervalTrigger} or {@link DateTrigger}.
 */
public sealed interface TriggerDescriptor permits CronTrigger, IntervalTrigger, DateTrigger {

    ScheduleType type();

    /**
     * Computes the first fire instant strictly after {@code after}.
     *
     * @return the next fire instant, or null if this trigger will never fire again
     */
    Instant nextFireTime(Instant after);

    /**
     * Returns the trigger fields for API responses. Always contains a {@code type} entry.
     */
    Map<String, Object> info();
}
