package net.jobsy.core.service;

import java.time.Duration;

public interface RetryPolicy {
    Duration nextBackoff(long attempt);

    /** Total attempts including the first one. */
    int maxAttempts();

    /** 고정 백오프 정책 */
    static RetryPolicy fixed(Duration backoff, int maxAttempts) {
        return new FixedRetryPolicy(backoff, maxAttempts);
    }

    static RetryPolicy none() {
        return new FixedRetryPolicy(Duration.ZERO, 1);
    }
}
