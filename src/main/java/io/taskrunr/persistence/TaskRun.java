package io.taskrunr.persistence;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One row of task run history. Rows are never updated once written.
 *
 * @param id        monotonic row id
 * @param taskId    the task that ran
 * @param status    running, completed or failed
 * @param startTime when the attempt started
 * @param endTime   when the attempt ended, null on the {@code running} row
 * @param error     error text for failed attempts
 */
public record TaskRun(
        @JsonProperty("id") long id,
        @JsonProperty("task_id") String taskId,
        @JsonProperty("status") RunStatus status,
        @JsonProperty("start_time") Instant startTime,
        @JsonProperty("end_time") Instant endTime,
        @JsonProperty("error") String error
) {
}
