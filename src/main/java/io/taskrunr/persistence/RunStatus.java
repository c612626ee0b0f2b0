package io.taskrunr.persistence;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status recorded on a task run row.
 */
public enum RunStatus {
    RUNNING,
    COMPLETED,
    FAILED;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    public static RunStatus fromString(String s) {
        if (s == null || s.isBlank()) return FAILED;
        return switch (s.trim().toLowerCase()) {
            case "running" -> RUNNING;
            case "completed" -> COMPLETED;
            default -> FAILED;
        };
    }
}
