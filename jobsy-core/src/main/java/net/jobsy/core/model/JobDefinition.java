package net.jobsy.core.model;

/** Administrative create-or-update request for a job, keyed by name. */
public record JobDefinition(
        String name,
        String schedule,
        int deadlineMinutes,
        String expectedStatus,
        String ownerEmail,
        String url,
        boolean active
) {}
