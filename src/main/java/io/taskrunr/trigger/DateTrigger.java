package io.taskrunr.trigger;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One-shot trigger at an absolute instant.
 *
 * @param runAt the fire instant
 * @param zone  zone used when rendering {@code run_date}
 */
public record DateTrigger(Instant runAt, ZoneId zone) implements TriggerDescriptor {

    @Override
    public ScheduleType type() {
        return ScheduleType.DATE;
    }

    @Override
    public Instant nextFireTime(Instant after) {
        return runAt.isAfter(after) ? runAt : null;
    }

    @Override
    public Map<String, Object> info() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("type", type().value());
        info.put("run_date", DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(runAt.atZone(zone)));
        return info;
    }
}
