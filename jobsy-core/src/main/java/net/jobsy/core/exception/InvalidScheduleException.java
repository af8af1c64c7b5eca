package net.jobsy.core.exception;

/**
 * The schedule is not a parsable 5-field cron expression.
 */
public class InvalidScheduleException extends JobsyException {

    private final String expression;

    public InvalidScheduleException(String expression, Throwable cause) {
        super("Value is not a valid cron schedule: [" + expression + "]", cause);
        this.expression = expression;
    }

    public InvalidScheduleException(String expression, String reason) {
        super("Value is not a valid cron schedule: [" + expression + "] (" + reason + ")");
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }
}
