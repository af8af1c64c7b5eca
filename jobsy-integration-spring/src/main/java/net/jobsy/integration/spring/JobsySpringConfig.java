package net.jobsy.integration.spring;

import net.jobsy.adapter.jdbc.repo.JdbcJobRepository;
import net.jobsy.adapter.jdbc.repo.JdbcReportRepository;
import net.jobsy.core.spi.Clock;
import net.jobsy.core.spi.JobRepository;
import net.jobsy.core.spi.ReportRepository;
import net.jobsy.core.spi.TxRunner;
import net.jobsy.integration.spring.tx.SpringTxRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.time.Instant;

@Configuration
public class JobsySpringConfig {

    // TxRunner (Spring)
    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    // Repository 구현 등록 (adapter-jdbc 재사용)
    @Bean public JobRepository jobRepository(DataSource ds) { return new JdbcJobRepository(ds); }
    @Bean public ReportRepository reportRepository(DataSource ds) { return new JdbcReportRepository(ds); }

    @Bean public Clock systemClock() { return Instant::now; }
}
