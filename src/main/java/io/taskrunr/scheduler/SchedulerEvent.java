package io.taskrunr.scheduler;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Lifecycle events delivered to {@link SchedulerListener}s.
 * Serialized with Jackson, each event carries its {@code type} and {@code task_id}.
 */
public sealed interface SchedulerEvent {

    String type();

    String taskId();

    /**
     * A schedule was created or replaced.
     */
    record ScheduleUpdated(
            @JsonProperty("task_id") String taskId,
            @JsonProperty("schedule") ScheduleInfo schedule
    ) implements SchedulerEvent {
        @Override
        @JsonProperty("type")
        public String type() {
            return "schedule_update";
        }
    }

    /**
     * A schedule was cancelled.
     */
    record ScheduleRemoved(
            @JsonProperty("task_id") String taskId
    ) implements SchedulerEvent {
        @Override
        @JsonProperty("type")
        public String type() {
            return "schedule_removed";
        }
    }

    record TaskStarted(
            @JsonProperty("task_id") String taskId,
            @JsonProperty("start_time") Instant startTime
    ) implements SchedulerEvent {
        @Override
        @JsonProperty("type")
        public String type() {
            return "task_started";
        }
    }

    /**
     * The executor returned. {@code status} is the outcome the task reported.
     */
    record TaskFinished(
            @JsonProperty("task_id") String taskId,
            @JsonProperty("status") String status,
            @JsonProperty("start_time") Instant startTime,
            @JsonProperty("end_time") Instant endTime,
            @JsonProperty("error") String error
    ) implements SchedulerEvent {
        @Override
        @JsonProperty("type")
        public String type() {
            return "task_finished";
        }
    }

    /**
     * The executor itself threw.
     */
    record TaskErrored(
            @JsonProperty("task_id") String taskId,
            @JsonProperty("error") String error,
            @JsonProperty("start_time") Instant startTime,
            @JsonProperty("end_time") Instant endTime
    ) implements SchedulerEvent {
        @Override
        @JsonProperty("type")
        public String type() {
            return "task_error";
        }
    }
}
