package net.jobsy.core.model;

/** Terminal state of one job within one check tick. */
public enum CheckState {
    INSIDE_WINDOW,
    UNKNOWN,
    SUCCESS,
    FAIL_NO_NOTIFY,
    FAIL_NOTIFIED,
    SKIPPED,    // deactivated or removed between listing and locking
    ERROR;      // isolated failure, nothing saved

    public static CheckState of(Outcome outcome, boolean notified) {
        return switch (outcome) {
            case INSIDE_WINDOW -> INSIDE_WINDOW;
            case UNKNOWN -> UNKNOWN;
            case SUCCESS -> SUCCESS;
            case FAIL -> notified ? FAIL_NOTIFIED : FAIL_NO_NOTIFY;
        };
    }
}
