package net.jobsy.core.service;

import net.jobsy.core.model.Evaluation;
import net.jobsy.core.model.Job;
import net.jobsy.core.model.Outcome;
import net.jobsy.core.model.Report;
import net.jobsy.core.spi.CronCalculator;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides whether a job reported in time for its current schedule window.
 * Pure: reads nothing but its arguments and returns the job as it must be written back.
 */
public final class WorkflowEvaluator {
    private final CronCalculator cron;
    private final ZoneId zone;

    public WorkflowEvaluator(CronCalculator cron, ZoneId zone) {
        this.cron = Objects.requireNonNull(cron);
        this.zone = Objects.requireNonNull(zone);
    }

    public Evaluation evaluate(Job job, Optional<Report> latest, Instant now) {
        Instant previous = cron.previous(now, job.schedule(), zone);
        Instant expectedFinish = previous.plus(Duration.ofMinutes(job.deadlineMinutes()));

        // the current run may still report
        if (now.isBefore(expectedFinish)) {
            return new Evaluation(Outcome.INSIDE_WINDOW, job.withResult(Outcome.INSIDE_WINDOW),
                    previous, expectedFinish, now);
        }

        Job checked = job.withLastChecked(now);
        if (latest.isEmpty()) {
            return new Evaluation(Outcome.UNKNOWN, checked.withResult(Outcome.UNKNOWN),
                    previous, expectedFinish, now);
        }

        Report report = latest.get();
        boolean ok = !report.createdAt().isBefore(previous)
                && Objects.equals(report.status(), job.expectedStatus());
        if (ok) {
            return new Evaluation(Outcome.SUCCESS, checked.withLastGood(now).withResult(Outcome.SUCCESS),
                    previous, expectedFinish, now);
        }
        return new Evaluation(Outcome.FAIL, checked.withResult(Outcome.FAIL), previous, expectedFinish, now);
    }

    /** Derived, never stored: previous scheduled instant plus the deadline. */
    public Instant expectedFinish(Job job, Instant now) {
        return cron.previous(now, job.schedule(), zone).plus(Duration.ofMinutes(job.deadlineMinutes()));
    }

    public ZoneId zone() {
        return zone;
    }
}
