package net.jobsy.core.service;

import net.jobsy.core.model.Job;

import java.time.Instant;

/**
 * At most one notification per failure episode. A job is notifiable once it has been good at
 * least once and nothing was sent since that last success.
 */
public final class NotificationGate {

    public boolean shouldNotify(Job job) {
        if (job.lastGood() == null || !job.active()) return false;
        return job.lastNotify() == null || job.lastNotify().isBefore(job.lastGood());
    }

    /** Closes the gate until the next Success moves {@code lastGood} past {@code now}. */
    public Job markNotified(Job job, Instant now) {
        return job.withLastNotify(now);
    }
}
