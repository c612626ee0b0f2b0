package io.taskrunr.persistence;

/**
 * Raised when the schedule store cannot complete an operation.
 * The failure has already been logged by the time this is thrown.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
