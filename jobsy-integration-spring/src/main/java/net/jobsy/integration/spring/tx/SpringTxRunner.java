package net.jobsy.integration.spring.tx;

import net.jobsy.adapter.jdbc.TxContext;
import net.jobsy.core.exception.StorePersistenceException;
import net.jobsy.core.spi.TxRunner;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.concurrent.Callable;

/**
 * Runs repository calls inside Spring-managed transactions, exposing the transaction's
 * connection to the JDBC repositories through {@link TxContext}.
 */
public final class SpringTxRunner implements TxRunner {
    private final PlatformTransactionManager tm;
    private final DataSource ds;

    public SpringTxRunner(PlatformTransactionManager tm, DataSource ds) {
        this.tm = tm;
        this.ds = ds;
    }

    @Override
    public <T> T required(Callable<T> body) {
        return execute(TransactionDefinition.PROPAGATION_REQUIRED, body);
    }

    @Override
    public <T> T requiresNew(Callable<T> body) {
        // 바깥 TxContext 를 정지해야 새 트랜잭션의 커넥션이 바인딩된다
        Connection suspended = TxContext.get();
        TxContext.clear();
        try {
            return execute(TransactionDefinition.PROPAGATION_REQUIRES_NEW, body);
        } finally {
            if (suspended != null) TxContext.set(suspended);
        }
    }

    private <T> T execute(int propagation, Callable<T> body) {
        var tpl = new TransactionTemplate(tm);
        tpl.setPropagationBehavior(propagation);

        return tpl.execute(status -> {
            // 이미 TxContext가 있다면 그대로 사용 (중첩 호출)
            if (TxContext.get() != null) {
                return call(body);
            }

            // 스프링 트랜잭션의 물리 커넥션을 끌어와 TxContext에 꽂아줌
            Connection con = DataSourceUtils.getConnection(ds);
            try {
                TxContext.set(con);
                return call(body);
            } finally {
                TxContext.clear();
                DataSourceUtils.releaseConnection(con, ds);
            }
        });
    }

    private static <T> T call(Callable<T> body) {
        try {
            return body.call();
        } catch (RuntimeException re) {
            throw re;
        } catch (Exception e) {
            throw new StorePersistenceException("transaction body failed: " + e.getMessage(), e);
        }
    }
}
