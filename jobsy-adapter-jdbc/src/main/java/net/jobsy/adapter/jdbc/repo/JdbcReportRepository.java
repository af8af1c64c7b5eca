package net.jobsy.adapter.jdbc.repo;

import net.jobsy.adapter.jdbc.JdbcUtil;
import net.jobsy.adapter.jdbc.TxContext;
import net.jobsy.adapter.jdbc.mapper.RowMappers;
import net.jobsy.core.exception.StorePersistenceException;
import net.jobsy.core.model.Report;
import net.jobsy.core.spi.ReportRepository;

import javax.sql.DataSource;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public final class JdbcReportRepository implements ReportRepository {
    private final DataSource ds;

    public JdbcReportRepository(DataSource ds) { this.ds = ds; }

    @Override
    public Optional<Report> findLatest(UUID jobId) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                SELECT *
                FROM TB_JOB_REPORT
                WHERE JOB_ID = ?
                ORDER BY CREATED_AT DESC, ID DESC
                FETCH FIRST 1 ROWS ONLY
            """)) {
            ps.setString(1, JdbcUtil.id(jobId));
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(RowMappers.toReport(rs));
            }
        }
    }

    @Override
    public Report append(UUID jobId, String status, Instant created) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                INSERT INTO TB_JOB_REPORT(JOB_ID, STATUS, CREATED_AT)
                VALUES (?, ?, ?)
            """, new String[]{"ID"})) {
            ps.setString(1, JdbcUtil.id(jobId));
            ps.setString(2, status);
            ps.setTimestamp(3, JdbcUtil.ts(created));
            ps.executeUpdate();
            try (ResultSet k = ps.getGeneratedKeys()) {
                if (!k.next()) throw new StorePersistenceException("no key generated for report of job " + jobId);
                return new Report(k.getLong(1), jobId, status, created);
            }
        }
    }
}
