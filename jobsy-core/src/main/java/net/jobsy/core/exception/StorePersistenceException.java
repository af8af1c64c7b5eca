package net.jobsy.core.exception;

/**
 * A job write did not commit (lost update, missing row or store failure).
 * Fatal to that job's tick; nothing was saved, so the next tick retries.
 */
public class StorePersistenceException extends JobsyException {

    public StorePersistenceException(String message) {
        super(message);
    }

    public StorePersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
