package io.taskrunr.scheduler;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.taskrunr.trigger.ScheduleType;

import java.time.Instant;
import java.util.Map;

/**
 * Live view of one task's schedule: the persisted spec combined with the timer state.
 *
 * @param taskId        the scheduled task
 * @param jobId         timer job id of the current registration
 * @param scheduleType  cron, interval or date
 * @param scheduleValue raw schedule spec
 * @param humanReadable English rendering of the spec
 * @param nextRunTime   next fire instant, null if the trigger will not fire again
 * @param trigger       trigger fields, see {@link io.taskrunr.trigger.TriggerDescriptor#info()}
 */
public record ScheduleInfo(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("job_id") String jobId,
        @JsonProperty("schedule_type") ScheduleType scheduleType,
        @JsonProperty("schedule_value") String scheduleValue,
        @JsonProperty("human_readable") String humanReadable,
        @JsonProperty("next_run_time") Instant nextRunTime,
        @JsonProperty("trigger") Map<String, Object> trigger
) {
}
