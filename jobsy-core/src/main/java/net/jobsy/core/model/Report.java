package net.jobsy.core.model;

import java.time.Instant;
import java.util.UUID;

/** A completion report posted by a monitored job. Append-only. */
public record Report(
        Long id,
        UUID jobId,
        String status,      // free text: "ok", "error", ...
        Instant createdAt
) {}
