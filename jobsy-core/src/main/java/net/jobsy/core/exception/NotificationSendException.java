package net.jobsy.core.exception;

/**
 * Transport failure while delivering a failure notification. Never rolls back job state.
 */
public class NotificationSendException extends JobsyException {

    public NotificationSendException(String message) {
        super(message);
    }

    public NotificationSendException(String message, Throwable cause) {
        super(message, cause);
    }
}
