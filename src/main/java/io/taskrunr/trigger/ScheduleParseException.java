package io.taskrunr.trigger;

/**
 * Thrown when a schedule spec does not match any supported grammar.
 */
public class ScheduleParseException extends IllegalArgumentException {

    public ScheduleParseException(String message) {
        super(message);
    }

    public ScheduleParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
