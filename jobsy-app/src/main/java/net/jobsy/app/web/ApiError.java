package net.jobsy.app.web;

import java.time.Instant;

/**
 * Standardized error response for API clients.
 */
public record ApiError(
        String error,
        String message,
        String detail,
        Instant timestamp
) {}
