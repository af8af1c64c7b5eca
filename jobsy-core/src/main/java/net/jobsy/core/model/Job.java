package net.jobsy.core.model;

import java.time.Instant;
import java.util.UUID;

public record Job(
        UUID id,
        String name,
        String schedule,              // 5-field cron, e.g. "0 2 * * *"
        int deadlineMinutes,          // grace after the scheduled instant
        String expectedStatus,        // report status that counts as a pass
        String ownerEmail,            // notification recipient
        boolean active,
        Instant lastChecked,          // last evaluation past the deadline
        Instant lastGood,             // last evaluation that was a Success
        Instant lastNotify,           // last failure notification
        String workflowCheckResult,   // Outcome label of the last evaluation
        String url,
        Instant createdAt,
        long version                  // optimistic lock counter
) {
    public static final int DEFAULT_DEADLINE_MINUTES = 5;

    public static Job ofNew(String name, String schedule, int deadlineMinutes,
                            String expectedStatus, String ownerEmail, String url) {
        return new Job(UUID.randomUUID(), name, schedule, deadlineMinutes, expectedStatus, ownerEmail,
                true, null, null, null, null, url, Instant.now(), 0L);
    }

    public Job withLastChecked(Instant at) {
        return new Job(id, name, schedule, deadlineMinutes, expectedStatus, ownerEmail, active,
                at, lastGood, lastNotify, workflowCheckResult, url, createdAt, version);
    }

    public Job withLastGood(Instant at) {
        return new Job(id, name, schedule, deadlineMinutes, expectedStatus, ownerEmail, active,
                lastChecked, at, lastNotify, workflowCheckResult, url, createdAt, version);
    }

    public Job withLastNotify(Instant at) {
        return new Job(id, name, schedule, deadlineMinutes, expectedStatus, ownerEmail, active,
                lastChecked, lastGood, at, workflowCheckResult, url, createdAt, version);
    }

    public Job withResult(Outcome outcome) {
        return new Job(id, name, schedule, deadlineMinutes, expectedStatus, ownerEmail, active,
                lastChecked, lastGood, lastNotify, outcome.label(), url, createdAt, version);
    }

    public Job withActive(boolean value) {
        return new Job(id, name, schedule, deadlineMinutes, expectedStatus, ownerEmail, value,
                lastChecked, lastGood, lastNotify, workflowCheckResult, url, createdAt, version);
    }

    public boolean hasUrl() {
        return url != null && !url.isBlank();
    }
}
