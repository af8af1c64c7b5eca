package net.jobsy.core.model;

/**
 * Result of one workflow evaluation. The label is what gets persisted in
 * {@code Job.workflowCheckResult}.
 */
public enum Outcome {
    INSIDE_WINDOW("Inside schedule deadline"),
    UNKNOWN("Check result unknown"),
    SUCCESS("Success"),
    FAIL("Fail");

    private final String label;

    Outcome(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
