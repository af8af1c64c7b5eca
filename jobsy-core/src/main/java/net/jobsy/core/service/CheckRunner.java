package net.jobsy.core.service;

import net.jobsy.core.exception.NotFoundException;
import net.jobsy.core.model.CheckCycleReport;
import net.jobsy.core.model.CheckState;
import net.jobsy.core.model.Evaluation;
import net.jobsy.core.model.Job;
import net.jobsy.core.model.JobCheck;
import net.jobsy.core.model.Outcome;
import net.jobsy.core.spi.Clock;
import net.jobsy.core.spi.JobRepository;
import net.jobsy.core.spi.ReportRepository;
import net.jobsy.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * One check tick over every active job.
 * <p>
 * Each job is evaluated in its own transaction: lock the row, read the latest report, evaluate,
 * consult the gate, write back. Two overlapping ticks therefore serialize on the row and cannot
 * both notify for the same failure episode. The notification itself is dispatched only after the
 * transaction committed, so {@code lastNotify} records an attempt, not a confirmed delivery.
 * Per-job failures are logged and reported as {@link CheckState#ERROR}; they never abort the tick.
 */
public final class CheckRunner implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CheckRunner.class);

    private final JobRepository jobs;
    private final ReportRepository reports;
    private final TxRunner tx;
    private final Clock clock;
    private final WorkflowEvaluator evaluator;
    private final NotificationGate gate;
    private final NotificationDispatcher dispatcher;
    private final boolean notificationsEnabled;
    private final ExecutorService workers;

    public CheckRunner(JobRepository jobs,
                       ReportRepository reports,
                       TxRunner tx,
                       Clock clock,
                       WorkflowEvaluator evaluator,
                       NotificationGate gate,
                       NotificationDispatcher dispatcher,
                       boolean notificationsEnabled,
                       int checkWorkers) {
        this.jobs = jobs;
        this.reports = reports;
        this.tx = tx;
        this.clock = clock;
        this.evaluator = evaluator;
        this.gate = gate;
        this.dispatcher = dispatcher;
        this.notificationsEnabled = notificationsEnabled;
        this.workers = Executors.newFixedThreadPool(Math.max(1, checkWorkers), Threads.named("jobsy-check-"));
    }

    public CheckCycleReport runCheckCycle() throws Exception {
        Instant startedAt = clock.now();
        List<Job> active = tx.required(jobs::findActive);

        List<Future<JobCheck>> futures = new ArrayList<>(active.size());
        for (Job job : active) {
            futures.add(workers.submit(() -> checkIsolated(job)));
        }

        List<JobCheck> checks = new ArrayList<>(active.size());
        for (int i = 0; i < futures.size(); i++) {
            Job job = active.get(i);
            try {
                checks.add(futures.get(i).get());
            } catch (ExecutionException e) {
                checks.add(JobCheck.failed(job.id(), job.name(), e.getCause()));
            }
        }

        CheckCycleReport report = new CheckCycleReport(startedAt, clock.now(), checks);
        log.info("Check cycle finished: {}", report);
        return report;
    }

    /** On-demand check of one job, active or not. */
    public Outcome evaluateJob(Job job) throws Exception {
        return evaluateJob(job.id());
    }

    public Outcome evaluateJob(UUID jobId) throws Exception {
        return checkOne(jobId, false).outcome();
    }

    private JobCheck checkIsolated(Job job) {
        log.info("Checking job: {} ({})", job.name(), job.id());
        try {
            return checkOne(job.id(), true);
        } catch (Exception e) {
            log.error("Check failed for job '{}' ({}); continuing with the remaining jobs", job.name(), job.id(), e);
            return JobCheck.failed(job.id(), job.name(), e);
        }
    }

    JobCheck checkOne(UUID jobId, boolean requireActive) throws Exception {
        Decision d = tx.requiresNew(() -> {
            Optional<Job> locked = jobs.lockById(jobId);
            if (locked.isEmpty()) {
                if (requireActive) return Decision.skipped(jobId, null);
                throw new NotFoundException("Job", jobId);
            }
            Job job = locked.get();
            if (requireActive && !job.active()) return Decision.skipped(jobId, job.name());

            Instant now = clock.now();
            Evaluation ev = evaluator.evaluate(job, reports.findLatest(jobId), now);
            Job updated = ev.job();
            boolean notify = false;
            if (ev.outcome() == Outcome.FAIL) {
                if (!gate.shouldNotify(updated)) {
                    log.info("Job '{}': not sending a notification at this time", job.name());
                } else if (!notificationsEnabled) {
                    log.info("Job '{}': notification due but sending is disabled", job.name());
                } else {
                    updated = gate.markNotified(updated, now);
                    notify = true;
                }
            }
            jobs.save(updated);
            return new Decision(jobId, job.name(), updated, ev, notify);
        });

        if (d.evaluation() == null) {
            log.info("Job {} skipped: no longer active", d.jobName() != null ? d.jobName() : jobId);
            return JobCheck.skipped(jobId, d.jobName());
        }

        Evaluation ev = d.evaluation();
        switch (ev.outcome()) {
            case INSIDE_WINDOW -> log.info("Job '{}' is currently inside the schedule deadline ({})", d.jobName(), ev.expectedFinish());
            case UNKNOWN -> log.info("Job '{}': no report recorded, check result unknown", d.jobName());
            case SUCCESS -> log.info("Job '{}': success", d.jobName());
            case FAIL -> log.warn("Job '{}' not recorded as completed since {} (failure)", d.jobName(), ev.previous());
        }
        if (d.notified()) {
            log.info("Job '{}': sending a notification to {}", d.jobName(), d.job().ownerEmail());
            dispatcher.dispatch(d.job(), ev.checkedAt(), ev.expectedFinish());
        }
        return new JobCheck(jobId, d.jobName(), CheckState.of(ev.outcome(), d.notified()), ev.outcome(), null);
    }

    @Override
    public void close() {
        Threads.shutdown(workers, 30);
    }

    private record Decision(UUID jobId, String jobName, Job job, Evaluation evaluation, boolean notified) {
        static Decision skipped(UUID jobId, String jobName) {
            return new Decision(jobId, jobName, null, null, false);
        }
    }
}
