package net.jobsy.adapter.jdbc.repo;

import net.jobsy.adapter.jdbc.JdbcUtil;
import net.jobsy.adapter.jdbc.TxContext;
import net.jobsy.adapter.jdbc.mapper.RowMappers;
import net.jobsy.core.exception.StorePersistenceException;
import net.jobsy.core.model.Job;
import net.jobsy.core.model.JobDefinition;
import net.jobsy.core.spi.JobRepository;

import javax.sql.DataSource;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public final class JdbcJobRepository implements JobRepository {
    private final DataSource ds;

    public JdbcJobRepository(DataSource ds) { this.ds = ds; }

    @Override
    public List<Job> findActive() throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                SELECT *
                FROM TB_JOB
                WHERE ACTIVE = 'Y'
                ORDER BY CREATED_AT DESC, ID
            """)) {
            return list(ps);
        }
    }

    @Override
    public List<Job> findAll() throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                SELECT *
                FROM TB_JOB
                ORDER BY CREATED_AT DESC, ID
            """)) {
            return list(ps);
        }
    }

    @Override
    public Optional<Job> findById(UUID id) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                SELECT *
                FROM TB_JOB
                WHERE ID = ?
            """)) {
            ps.setString(1, JdbcUtil.id(id));
            return one(ps);
        }
    }

    @Override
    public Optional<Job> findByName(String name) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                SELECT *
                FROM TB_JOB
                WHERE NAME = ?
            """)) {
            ps.setString(1, name);
            return one(ps);
        }
    }

    @Override
    public Optional<Job> lockById(UUID id) throws Exception {
        // 다른 체크 트랜잭션은 커밋/롤백까지 대기
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                SELECT *
                FROM TB_JOB
                WHERE ID = ?
                FOR UPDATE
            """)) {
            ps.setString(1, JdbcUtil.id(id));
            return one(ps);
        }
    }

    @Override
    public void save(Job job) throws Exception {
        // 평가 결과 컬럼만 갱신, VERSION 으로 lost update 차단
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                UPDATE TB_JOB
                   SET LAST_CHECKED          = ?,
                       LAST_GOOD             = ?,
                       LAST_NOTIFY           = ?,
                       WORKFLOW_CHECK_RESULT = ?,
                       VERSION               = VERSION + 1,
                       UPDATED_AT            = ?
                 WHERE ID = ?
                   AND VERSION = ?
            """)) {
            int i = 1;
            ps.setTimestamp(i++, JdbcUtil.ts(job.lastChecked()));
            ps.setTimestamp(i++, JdbcUtil.ts(job.lastGood()));
            ps.setTimestamp(i++, JdbcUtil.ts(job.lastNotify()));
            ps.setString(i++, job.workflowCheckResult());
            ps.setTimestamp(i++, JdbcUtil.ts(Instant.now()));
            ps.setString(i++, JdbcUtil.id(job.id()));
            ps.setLong(i, job.version());
            if (ps.executeUpdate() == 0) {
                throw new StorePersistenceException(
                        "TB_JOB not updated for ID=" + job.id() + " (missing row or stale VERSION=" + job.version() + ")");
            }
        }
    }

    @Override
    public Job upsert(JobDefinition d) throws Exception {
        Optional<Job> existing = findByName(d.name());
        Instant now = Instant.now();
        if (existing.isPresent()) {
            try (PreparedStatement ps = TxContext.require().prepareStatement("""
                    UPDATE TB_JOB
                       SET SCHEDULE         = ?,
                           DEADLINE_MINUTES = ?,
                           EXPECTED_STATUS  = ?,
                           OWNER_EMAIL      = ?,
                           URL              = ?,
                           ACTIVE           = ?,
                           VERSION          = VERSION + 1,
                           UPDATED_AT       = ?
                     WHERE ID = ?
                """)) {
                int i = bindDefinition(ps, d, 1);
                ps.setTimestamp(i++, JdbcUtil.ts(now));
                ps.setString(i, JdbcUtil.id(existing.get().id()));
                ps.executeUpdate();
            }
        } else {
            try (PreparedStatement ps = TxContext.require().prepareStatement("""
                    INSERT INTO TB_JOB
                        (SCHEDULE, DEADLINE_MINUTES, EXPECTED_STATUS, OWNER_EMAIL, URL, ACTIVE,
                         ID, NAME, VERSION, CREATED_AT, UPDATED_AT)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, 0, ?, ?)
                """)) {
                int i = bindDefinition(ps, d, 1);
                ps.setString(i++, JdbcUtil.id(UUID.randomUUID()));
                ps.setString(i++, d.name());
                ps.setTimestamp(i++, JdbcUtil.ts(now));
                ps.setTimestamp(i, JdbcUtil.ts(now));
                ps.executeUpdate();
            }
        }
        // 갱신된 행을 다시 로드해서 반환
        return findByName(d.name()).orElseThrow(
                () -> new StorePersistenceException("upsert failed to load job: " + d.name()));
    }

    private static int bindDefinition(PreparedStatement ps, JobDefinition d, int i) throws SQLException {
        ps.setString(i++, d.schedule());
        ps.setInt(i++, d.deadlineMinutes());
        ps.setString(i++, d.expectedStatus());
        ps.setString(i++, d.ownerEmail());
        ps.setString(i++, d.url());
        ps.setString(i++, JdbcUtil.yn(d.active()));
        return i;
    }

    private static Optional<Job> one(PreparedStatement ps) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) return Optional.empty();
            return Optional.of(RowMappers.toJob(rs));
        }
    }

    private static List<Job> list(PreparedStatement ps) throws SQLException {
        List<Job> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) out.add(RowMappers.toJob(rs));
        }
        return out;
    }
}
