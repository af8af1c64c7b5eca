package net.jobsy.integration.spring.sched;

import net.jobsy.core.service.CheckRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

public class JobsySchedulers {
    private static final Logger log = LoggerFactory.getLogger(JobsySchedulers.class);

    private final CheckRunner checkRunner;

    public JobsySchedulers(CheckRunner checkRunner) {
        this.checkRunner = checkRunner;
    }

    /** A failed tick is logged; the next one runs on schedule regardless. */
    @Scheduled(fixedDelayString = "${jobsy.scheduler.tick-delay-ms:60000}",
               initialDelayString = "${jobsy.scheduler.initial-delay-ms:10000}")
    public void tick() {
        try {
            checkRunner.runCheckCycle();
        } catch (Exception e) {
            log.error("Check cycle failed", e);
        }
    }
}
