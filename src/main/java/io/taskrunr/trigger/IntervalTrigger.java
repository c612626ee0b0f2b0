package io.taskrunr.trigger;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fixed-period trigger. Fires at {@code anchor + period}, then every {@code period} after that.
 *
 * @param count  number of units, always positive
 * @param unit   the interval unit
 * @param anchor start of the first period (the explicit start time, or the parse time)
 */
public record IntervalTrigger(long count, IntervalUnit unit, Instant anchor) implements TriggerDescriptor {

    public Duration period() {
        return unit.times(count);
    }

    @Override
    public ScheduleType type() {
        return ScheduleType.INTERVAL;
    }

    @Override
    public Instant nextFireTime(Instant after) {
        Duration period = period();
        Instant first = anchor.plus(period);
        if (first.isAfter(after)) {
            return first;
        }
        long elapsed = Duration.between(first, after).toMillis();
        long periods = elapsed / period.toMillis() + 1;
        return first.plus(period.multipliedBy(periods));
    }

    @Override
    public Map<String, Object> info() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("type", type().value());
        info.put("seconds", period().getSeconds());
        return info;
    }
}
