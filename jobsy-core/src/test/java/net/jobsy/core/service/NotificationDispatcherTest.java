package net.jobsy.core.service;

import net.jobsy.core.model.Job;
import net.jobsy.core.support.RecordingNotifier;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class NotificationDispatcherTest {
    private static final Instant CHECK = Instant.parse("2024-03-01T10:30:00Z");
    private static final Instant FINISH = Instant.parse("2024-03-01T10:05:00Z");

    private final Job job = Job.ofNew("ingest", "0 * * * *", 5, "ok", "ops@example.com", null);

    @Test
    void deliversOnFirstAttempt() throws Exception {
        RecordingNotifier notifier = new RecordingNotifier();
        try (NotificationDispatcher d = new NotificationDispatcher(notifier, 1, RetryPolicy.none())) {
            assertTrue(d.dispatch(job, CHECK, FINISH).get(5, TimeUnit.SECONDS));
            assertEquals(1, d.sentCount());
            assertEquals(0, d.failedCount());
        }
        assertEquals(1, notifier.sent().size());
        assertEquals(CHECK, notifier.sent().get(0).checkTime());
        assertEquals(FINISH, notifier.sent().get(0).expectedFinish());
    }

    @Test
    void retriesUntilDelivered() throws Exception {
        RecordingNotifier notifier = new RecordingNotifier().failNext(2);
        try (NotificationDispatcher d = new NotificationDispatcher(notifier, 1, RetryPolicy.fixed(Duration.ofMillis(10), 3))) {
            assertTrue(d.dispatch(job, CHECK, FINISH).get(5, TimeUnit.SECONDS));
            assertEquals(1, d.sentCount());
        }
        assertEquals(3, notifier.attempts());
        assertEquals(1, notifier.sent().size());
    }

    @Test
    void givesUpAfterMaxAttempts() throws Exception {
        RecordingNotifier notifier = new RecordingNotifier().failNext(5);
        try (NotificationDispatcher d = new NotificationDispatcher(notifier, 1, RetryPolicy.fixed(Duration.ZERO, 2))) {
            assertFalse(d.dispatch(job, CHECK, FINISH).get(5, TimeUnit.SECONDS));
            assertEquals(0, d.sentCount());
            assertEquals(1, d.failedCount());
        }
        assertEquals(2, notifier.attempts());
        assertTrue(notifier.sent().isEmpty());
    }

    @Test
    void dispatchAfterCloseIsCountedAsFailed() throws Exception {
        RecordingNotifier notifier = new RecordingNotifier();
        NotificationDispatcher d = new NotificationDispatcher(notifier, Executors.newSingleThreadExecutor(), RetryPolicy.none());
        d.close();

        assertFalse(d.dispatch(job, CHECK, FINISH).get(1, TimeUnit.SECONDS));
        assertEquals(1, d.failedCount());
        assertEquals(0, notifier.attempts());
    }

    @Test
    void retryPolicyRejectsZeroAttempts() {
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.fixed(Duration.ZERO, 0));
    }
}
