package net.jobsy.adapter.jdbc.mapper;

import net.jobsy.adapter.jdbc.JdbcUtil;
import net.jobsy.core.model.Job;
import net.jobsy.core.model.Report;

import java.sql.ResultSet;
import java.sql.SQLException;

public final class RowMappers {
    private RowMappers() {}

    // --- Job ---
    public static Job toJob(ResultSet rs) throws SQLException {
        return new Job(
                JdbcUtil.uuid(rs, "ID"),
                rs.getString("NAME"),
                rs.getString("SCHEDULE"),
                rs.getInt("DEADLINE_MINUTES"),
                rs.getString("EXPECTED_STATUS"),
                rs.getString("OWNER_EMAIL"),
                "Y".equals(rs.getString("ACTIVE")),
                JdbcUtil.instant(rs, "LAST_CHECKED"),
                JdbcUtil.instant(rs, "LAST_GOOD"),
                JdbcUtil.instant(rs, "LAST_NOTIFY"),
                rs.getString("WORKFLOW_CHECK_RESULT"),
                rs.getString("URL"),
                rs.getTimestamp("CREATED_AT").toInstant(),
                rs.getLong("VERSION")
        );
    }

    // --- Report ---
    public static Report toReport(ResultSet rs) throws SQLException {
        return new Report(
                rs.getLong("ID"),
                JdbcUtil.uuid(rs, "JOB_ID"),
                rs.getString("STATUS"),
                rs.getTimestamp("CREATED_AT").toInstant()
        );
    }
}
