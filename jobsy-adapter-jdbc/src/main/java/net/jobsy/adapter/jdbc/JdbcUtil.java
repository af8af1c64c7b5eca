package net.jobsy.adapter.jdbc;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.UUID;

public final class JdbcUtil {
    private JdbcUtil() {}

    public static Timestamp ts(Instant i) { return i == null ? null : Timestamp.from(i); }

    public static Instant toInstant(Timestamp ts) { return ts == null ? null : ts.toInstant(); }

    public static Instant instant(ResultSet rs, String col) throws SQLException {
        return toInstant(rs.getTimestamp(col));
    }

    // UUIDs are stored as VARCHAR(36)
    public static String id(UUID id) { return id.toString(); }

    public static UUID uuid(ResultSet rs, String col) throws SQLException {
        String s = rs.getString(col);
        return s == null ? null : UUID.fromString(s);
    }

    public static String yn(boolean b) { return b ? "Y" : "N"; }
}
