package io.github.drompincen.crewroom.persistence;

/**
 * A room or work log record could not be read or written. Never swallowed; the caller decides whether to retry.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
