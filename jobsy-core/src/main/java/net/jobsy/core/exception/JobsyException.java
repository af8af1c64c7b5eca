package net.jobsy.core.exception;

/** Base type of every jobsy domain error. */
public class JobsyException extends RuntimeException {

    public JobsyException(String message) {
        super(message);
    }

    public JobsyException(String message, Throwable cause) {
        super(message, cause);
    }
}
