package io.taskrunr.persistence;

import io.taskrunr.trigger.ScheduleType;

import java.time.Instant;

/**
 * A persisted schedule row. At most one exists per task id.
 *
 * @param taskId        owning task
 * @param jobId         timer job id of the last registration
 * @param scheduleType  kind of trigger
 * @param scheduleValue the raw schedule spec, re-parsed on every load
 * @param createdAt     when this schedule was (re)created
 * @param nextRunTime   next fire instant known at the last update, may be null
 */
public record Schedule(
        String taskId,
        String jobId,
        ScheduleType scheduleType,
        String scheduleValue,
        Instant createdAt,
        Instant nextRunTime
) {
}
