package net.jobsy.core.service;

import java.time.Duration;
import java.util.Objects;

final class FixedRetryPolicy implements RetryPolicy {
    private final Duration backoff;
    private final int maxAttempts;

    FixedRetryPolicy(Duration backoff, int maxAttempts) {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1: " + maxAttempts);
        this.backoff = Objects.requireNonNull(backoff);
        this.maxAttempts = maxAttempts;
    }

    @Override public Duration nextBackoff(long attempt) { return backoff; }
    @Override public int maxAttempts() { return maxAttempts; }
}
