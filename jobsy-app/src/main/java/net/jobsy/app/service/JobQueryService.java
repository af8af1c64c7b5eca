package net.jobsy.app.service;

import net.jobsy.app.web.JobViews;
import net.jobsy.core.exception.InvalidScheduleException;
import net.jobsy.core.exception.NotFoundException;
import net.jobsy.core.model.Job;
import net.jobsy.core.model.Outcome;
import net.jobsy.core.model.Report;
import net.jobsy.core.service.CheckRunner;
import net.jobsy.core.service.WorkflowEvaluator;
import net.jobsy.core.spi.Clock;
import net.jobsy.core.spi.CronCalculator;
import net.jobsy.core.spi.JobRepository;
import net.jobsy.core.spi.ReportRepository;
import net.jobsy.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Read side of the HTTP layer plus the two write paths callers have: posting a report and
 * asking for an on-demand check.
 */
@Service
public class JobQueryService {
    private static final Logger log = LoggerFactory.getLogger(JobQueryService.class);

    private final JobRepository jobs;
    private final ReportRepository reports;
    private final TxRunner tx;
    private final Clock clock;
    private final CronCalculator cron;
    private final WorkflowEvaluator evaluator;
    private final CheckRunner checkRunner;

    public JobQueryService(JobRepository jobs, ReportRepository reports, TxRunner tx, Clock clock,
                           CronCalculator cron, WorkflowEvaluator evaluator, CheckRunner checkRunner) {
        this.jobs = jobs;
        this.reports = reports;
        this.tx = tx;
        this.clock = clock;
        this.cron = cron;
        this.evaluator = evaluator;
        this.checkRunner = checkRunner;
    }

    public List<JobViews.JobSummary> list() throws Exception {
        Instant now = clock.now();
        return tx.required(jobs::findAll).stream().map(j -> summary(j, now)).toList();
    }

    public JobViews.JobDetail detail(UUID id) throws Exception {
        Instant now = clock.now();
        return tx.required(() -> {
            Job job = jobs.findById(id).orElseThrow(() -> new NotFoundException("Job", id));
            Report latest = reports.findLatest(id).orElse(null);
            return new JobViews.JobDetail(
                    job.id(), job.name(), job.schedule(), describe(job), job.deadlineMinutes(),
                    expectedFinish(job, now), job.expectedStatus(), job.ownerEmail(), job.active(),
                    at(job.createdAt()), at(job.lastChecked()), at(job.lastGood()), at(job.lastNotify()),
                    job.workflowCheckResult(), job.url(),
                    latest == null ? null : new JobViews.ReportView(at(latest.createdAt()), latest.status()));
        });
    }

    public Report submitReport(UUID id, String status) throws Exception {
        Report r = tx.required(() -> {
            jobs.findById(id).orElseThrow(() -> new NotFoundException("Job", id));
            return reports.append(id, status, clock.now());
        });
        log.info("Report recorded for job {}: status='{}'", id, status);
        return r;
    }

    public JobViews.CheckResult check(UUID id) throws Exception {
        Outcome outcome = checkRunner.evaluateJob(id);
        Job job = tx.required(() -> jobs.findById(id)).orElseThrow(() -> new NotFoundException("Job", id));
        return new JobViews.CheckResult(id, outcome, job.workflowCheckResult(),
                at(job.lastChecked()), at(job.lastGood()), at(job.lastNotify()));
    }

    private JobViews.JobSummary summary(Job job, Instant now) {
        return new JobViews.JobSummary(job.id(), job.name(), job.schedule(), describe(job),
                job.deadlineMinutes(), expectedFinish(job, now), job.ownerEmail(), job.active());
    }

    // 잘못된 스케줄의 잡도 목록에는 보여야 한다
    private String describe(Job job) {
        try {
            return cron.describe(job.schedule());
        } catch (InvalidScheduleException e) {
            log.warn("Job '{}' has an invalid schedule '{}': {}", job.name(), job.schedule(), e.getMessage());
            return null;
        }
    }

    private OffsetDateTime expectedFinish(Job job, Instant now) {
        try {
            return at(evaluator.expectedFinish(job, now));
        } catch (InvalidScheduleException e) {
            return null;
        }
    }

    private OffsetDateTime at(Instant instant) {
        return instant == null ? null : instant.atZone(evaluator.zone()).toOffsetDateTime();
    }
}
