// jobsy-bootstrap/src/main/java/net/jobsy/bootstrap/catalog/CatalogRegistrar.java
package net.jobsy.bootstrap.catalog;

import net.jobsy.bootstrap.props.JobsyProperties;
import net.jobsy.core.model.Job;
import net.jobsy.core.model.JobDefinition;
import net.jobsy.core.spi.CronCalculator;
import net.jobsy.core.spi.JobRepository;
import net.jobsy.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Upserts the jobs declared under {@code jobsy.catalog.jobs}, keyed by name. */
public class CatalogRegistrar {
    private static final Logger log = LoggerFactory.getLogger(CatalogRegistrar.class);

    private final JobRepository jobs;
    private final TxRunner tx;
    private final CronCalculator cron;

    public CatalogRegistrar(JobRepository jobs, TxRunner tx, CronCalculator cron) {
        this.jobs = jobs;
        this.tx = tx;
        this.cron = cron;
    }

    public void register(JobsyProperties.Catalog catalog) throws Exception {
        // 전부 검증한 뒤에 등록 (잘못된 정의 하나로 절반만 반영되는 일 없게)
        var definitions = catalog.getJobs().stream().map(this::toDefinition).toList();
        tx.required(() -> {
            for (JobDefinition d : definitions) {
                Job job = jobs.upsert(d);
                log.info("Catalog registered: job='{}' id={} schedule='{}' active={}",
                        job.name(), job.id(), job.schedule(), job.active());
            }
            return null;
        });
    }

    JobDefinition toDefinition(JobsyProperties.JobDef def) {
        if (isBlank(def.getName()) || isBlank(def.getSchedule())
                || isBlank(def.getExpectedStatus()) || isBlank(def.getOwner())) {
            throw new IllegalArgumentException(
                    "job.name, job.schedule, job.expected-status and job.owner are required: " + def);
        }
        if (def.getDeadlineMinutes() < 0) {
            throw new IllegalArgumentException("job.deadline-minutes must be >= 0: " + def);
        }
        cron.validate(def.getSchedule());
        return new JobDefinition(def.getName().trim(), def.getSchedule().trim(), def.getDeadlineMinutes(),
                def.getExpectedStatus(), def.getOwner().trim(), isBlank(def.getUrl()) ? null : def.getUrl().trim(),
                def.isActive());
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
