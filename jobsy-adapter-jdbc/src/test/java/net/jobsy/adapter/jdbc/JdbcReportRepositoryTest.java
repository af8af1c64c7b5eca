package net.jobsy.adapter.jdbc;

import net.jobsy.adapter.jdbc.repo.JdbcJobRepository;
import net.jobsy.adapter.jdbc.repo.JdbcReportRepository;
import net.jobsy.core.model.Job;
import net.jobsy.core.model.JobDefinition;
import net.jobsy.core.model.Report;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JdbcReportRepositoryTest extends TestSupport {
    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    JdbcJobRepository jobs;
    JdbcReportRepository reports;
    Job job;

    @BeforeEach
    void init() throws Exception {
        truncateAll();
        jobs = new JdbcJobRepository(ds);
        reports = new JdbcReportRepository(ds);
        job = tx.required(() -> jobs.upsert(
                new JobDefinition("ingest", "0 * * * *", 5, "ok", "ops@example.com", null, true)));
    }

    @Test
    void noReports() throws Exception {
        assertTrue(tx.required(() -> reports.findLatest(job.id())).isEmpty());
    }

    @Test
    void latestByCreatedTimeNotInsertionOrder() throws Exception {
        tx.required(() -> {
            reports.append(job.id(), "ok", T0.plusSeconds(120));
            reports.append(job.id(), "error", T0.plusSeconds(60));
            return null;
        });

        Report latest = tx.required(() -> reports.findLatest(job.id())).orElseThrow();
        assertEquals("ok", latest.status());
        assertEquals(T0.plusSeconds(120), latest.createdAt());
        assertEquals(job.id(), latest.jobId());
    }

    @Test
    @DisplayName("같은 시각의 보고는 ID 가 큰 쪽이 최신")
    void tieBrokenByHighestId() throws Exception {
        Report second = tx.required(() -> {
            reports.append(job.id(), "ok", T0);
            return reports.append(job.id(), "error", T0);
        });

        Report latest = tx.required(() -> reports.findLatest(job.id())).orElseThrow();
        assertEquals(second.id(), latest.id());
        assertEquals("error", latest.status());
    }

    @Test
    void reportsAreScopedToTheirJob() throws Exception {
        Job other = tx.required(() -> jobs.upsert(
                new JobDefinition("other", "0 * * * *", 5, "ok", "ops@example.com", null, true)));
        tx.required(() -> reports.append(other.id(), "ok", T0));

        assertTrue(tx.required(() -> reports.findLatest(job.id())).isEmpty());
    }

    @Test
    void reportForUnknownJobIsRejected() {
        assertThrows(SQLException.class, () -> tx.required(() -> reports.append(UUID.randomUUID(), "ok", T0)));
    }
}
