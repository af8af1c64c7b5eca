package net.jobsy.app.web;

import net.jobsy.core.model.Outcome;

import java.time.OffsetDateTime;
import java.util.UUID;

/** JSON shapes of the job endpoints; property names are rendered snake_case. */
public final class JobViews {
    private JobViews() {}

    public record JobSummary(
            UUID id,
            String name,
            String schedule,
            String scheduleDescription,
            int deadline,
            OffsetDateTime expectedFinish,
            String owner,
            boolean active
    ) {}

    public record JobDetail(
            UUID id,
            String name,
            String schedule,
            String scheduleDescription,
            int deadline,
            OffsetDateTime expectedFinish,
            String expectedStatus,
            String owner,
            boolean active,
            OffsetDateTime created,
            OffsetDateTime lastChecked,
            OffsetDateTime lastGood,
            OffsetDateTime lastNotify,
            String workflowCheckResult,
            String url,
            ReportView latestReport
    ) {}

    public record ReportView(OffsetDateTime created, String status) {}

    public record CheckResult(
            UUID id,
            Outcome outcome,
            String workflowCheckResult,
            OffsetDateTime lastChecked,
            OffsetDateTime lastGood,
            OffsetDateTime lastNotify
    ) {}
}
