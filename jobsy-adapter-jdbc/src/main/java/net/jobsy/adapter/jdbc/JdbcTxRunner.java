package net.jobsy.adapter.jdbc;

import net.jobsy.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.Callable;

/** Plain JDBC transactions, one connection per unit of work, bound through {@link TxContext}. */
public final class JdbcTxRunner implements TxRunner {
    private static final Logger log = LoggerFactory.getLogger(JdbcTxRunner.class);

    private final DataSource ds;

    public JdbcTxRunner(DataSource ds) { this.ds = ds; }

    @Override
    public <T> T required(Callable<T> body) throws Exception {
        if (TxContext.get() != null) {
            // 이미 진행 중인 트랜잭션에 참여
            return body.call();
        }
        return inNewConnection(body);
    }

    @Override
    public <T> T requiresNew(Callable<T> body) throws Exception {
        // 바깥 트랜잭션을 정지하고 종료 시 복원
        Connection suspended = TxContext.get();
        try {
            return inNewConnection(body);
        } finally {
            if (suspended != null) TxContext.set(suspended);
        }
    }

    private <T> T inNewConnection(Callable<T> body) throws Exception {
        try (Connection c = ds.getConnection()) {
            boolean prevAuto = c.getAutoCommit();
            c.setAutoCommit(false);
            TxContext.set(c);
            try {
                T r = body.call();
                c.commit();
                return r;
            } catch (Throwable t) {
                rollbackQuietly(c, t);
                sneakyThrow(t);
                return null; // unreachable
            } finally {
                TxContext.clear();
                restoreAutoCommit(c, prevAuto);
            }
        }
    }

    private static void rollbackQuietly(Connection c, Throwable cause) {
        try {
            c.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
            log.warn("Rollback failed: {}", e.getMessage());
        }
    }

    private static void restoreAutoCommit(Connection c, boolean value) {
        try {
            c.setAutoCommit(value);
        } catch (SQLException e) {
            log.debug("Could not restore autoCommit={} on pooled connection", value, e);
        }
    }

    @SuppressWarnings("unchecked")
    private static <E extends Throwable> void sneakyThrow(Throwable t) throws E { throw (E) t; }
}
