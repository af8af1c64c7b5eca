package net.jobsy.core.spi;

import net.jobsy.core.model.Report;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public interface ReportRepository {
    /** Most recent report by created time (ties: highest id). */
    Optional<Report> findLatest(UUID jobId) throws Exception;

    Report append(UUID jobId, String status, Instant created) throws Exception;
}
