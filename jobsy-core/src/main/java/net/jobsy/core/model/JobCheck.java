package net.jobsy.core.model;

import java.util.UUID;

public record JobCheck(
        UUID jobId,
        String jobName,
        CheckState state,
        Outcome outcome,    // null for SKIPPED / ERROR
        String error        // null unless ERROR
) {
    public static JobCheck failed(UUID jobId, String jobName, Throwable t) {
        return new JobCheck(jobId, jobName, CheckState.ERROR, null,
                t.getClass().getSimpleName() + ": " + t.getMessage());
    }

    public static JobCheck skipped(UUID jobId, String jobName) {
        return new JobCheck(jobId, jobName, CheckState.SKIPPED, null, null);
    }
}
