package net.jobsy.core.service;

import net.jobsy.core.model.Job;
import net.jobsy.core.spi.Notifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Sends failure notifications off the check thread, retrying per {@link RetryPolicy}.
 * A failed send is logged and counted; the job state that triggered it is never touched.
 */
public final class NotificationDispatcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final Notifier notifier;
    private final ExecutorService executor;
    private final RetryPolicy retry;

    private final AtomicLong sent = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    public NotificationDispatcher(Notifier notifier, ExecutorService executor, RetryPolicy retry) {
        this.notifier = Objects.requireNonNull(notifier);
        this.executor = Objects.requireNonNull(executor);
        this.retry = Objects.requireNonNull(retry);
    }

    public NotificationDispatcher(Notifier notifier, int sendWorkers, RetryPolicy retry) {
        this(notifier, Executors.newFixedThreadPool(Math.max(1, sendWorkers), Threads.named("jobsy-notify-")), retry);
    }

    /** Completes with {@code true} once delivered, {@code false} once every attempt failed. */
    public CompletableFuture<Boolean> dispatch(Job job, Instant checkTime, Instant expectedFinish) {
        try {
            return CompletableFuture.supplyAsync(() -> sendWithRetry(job, checkTime, expectedFinish), executor);
        } catch (RejectedExecutionException e) {
            failed.incrementAndGet();
            log.warn("Notification for job '{}' ({}) dropped: dispatcher is shut down", job.name(), job.id());
            return CompletableFuture.completedFuture(false);
        }
    }

    boolean sendWithRetry(Job job, Instant checkTime, Instant expectedFinish) {
        int max = retry.maxAttempts();
        for (int attempt = 1; ; attempt++) {
            try {
                notifier.sendFailureNotification(job, checkTime, expectedFinish);
                sent.incrementAndGet();
                log.info("Notification sent for job '{}' ({}) to {}", job.name(), job.id(), job.ownerEmail());
                return true;
            } catch (RuntimeException e) {
                if (attempt >= max) {
                    failed.incrementAndGet();
                    log.error("Notification for job '{}' ({}) failed after {} attempt(s)", job.name(), job.id(), attempt, e);
                    return false;
                }
                Duration backoff = retry.nextBackoff(attempt);
                log.warn("Notification for job '{}' failed (attempt {}/{}): {}; retrying in {}",
                        job.name(), attempt, max, e.getMessage(), backoff);
                if (!pause(backoff)) {
                    failed.incrementAndGet();
                    log.warn("Notification for job '{}' abandoned: interrupted during back-off", job.name());
                    return false;
                }
            }
        }
    }

    private static boolean pause(Duration d) {
        if (d.isZero() || d.isNegative()) return true;
        try {
            Thread.sleep(d.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public long sentCount() { return sent.get(); }
    public long failedCount() { return failed.get(); }

    /** Waits for in-flight sends; anything still running after that is abandoned. */
    @Override
    public void close() {
        if (!Threads.shutdown(executor, 30)) {
            log.warn("Notification dispatcher closed with sends still in flight");
        }
    }
}
