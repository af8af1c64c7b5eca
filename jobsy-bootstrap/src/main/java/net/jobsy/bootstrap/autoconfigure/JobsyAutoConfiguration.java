package net.jobsy.bootstrap.autoconfigure;

import net.jobsy.bootstrap.catalog.CatalogRegistrar;
import net.jobsy.bootstrap.props.JobsyProperties;
import net.jobsy.core.cron.CronUtilsCalculator;
import net.jobsy.core.exception.NotificationSendException;
import net.jobsy.core.service.CheckRunner;
import net.jobsy.core.service.NotificationDispatcher;
import net.jobsy.core.service.NotificationGate;
import net.jobsy.core.service.RetryPolicy;
import net.jobsy.core.service.WorkflowEvaluator;
import net.jobsy.core.spi.Clock;
import net.jobsy.core.spi.CronCalculator;
import net.jobsy.core.spi.JobRepository;
import net.jobsy.core.spi.Notifier;
import net.jobsy.core.spi.ReportRepository;
import net.jobsy.core.spi.TxRunner;
import net.jobsy.integration.spring.JobsySpringConfig;
import net.jobsy.integration.spring.mail.MailNotifier;
import net.jobsy.integration.spring.sched.JobsySchedulers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.autoconfigure.mail.MailSenderAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.mail.javamail.JavaMailSender;

import java.time.ZoneId;

@AutoConfiguration(after = {DataSourceTransactionManagerAutoConfiguration.class, MailSenderAutoConfiguration.class})
@EnableConfigurationProperties(JobsyProperties.class)
@Import(JobsySpringConfig.class) // integration-spring: repos/tx/clock wiring
public class JobsyAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(JobsyAutoConfiguration.class);

    // --- SPI 기본 구현(없으면) 제공 ---

    @Bean
    @ConditionalOnMissingBean(CronCalculator.class)
    public CronCalculator cronCalculator() {
        return new CronUtilsCalculator();
    }

    @Bean
    @ConditionalOnMissingBean(Notifier.class)
    @ConditionalOnBean(JavaMailSender.class)
    public Notifier mailNotifier(JavaMailSender mailSender, JobsyProperties props) {
        return new MailNotifier(mailSender, props.getNotifications().getFrom(), ZoneId.of(props.getZone()));
    }

    // 메일 서버 설정이 없을 때: 발송 시도는 실패로 기록
    @Bean
    @ConditionalOnMissingBean({Notifier.class, JavaMailSender.class})
    public Notifier unconfiguredNotifier() {
        return (job, checkTime, expectedFinish) -> {
            throw new NotificationSendException("no mail transport configured (spring.mail.host)");
        };
    }

    // --- 코어 서비스 조립 ---

    @Bean
    @ConditionalOnMissingBean
    public WorkflowEvaluator workflowEvaluator(CronCalculator cron, JobsyProperties props) {
        return new WorkflowEvaluator(cron, ZoneId.of(props.getZone()));
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationGate notificationGate() {
        return new NotificationGate();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public NotificationDispatcher notificationDispatcher(Notifier notifier, JobsyProperties props) {
        var n = props.getNotifications();
        return new NotificationDispatcher(notifier, n.getSendWorkers(),
                RetryPolicy.fixed(n.getRetryBackoff(), n.getMaxAttempts()));
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public CheckRunner checkRunner(JobRepository jobs,
                                   ReportRepository reports,
                                   TxRunner tx,
                                   Clock clock,
                                   WorkflowEvaluator evaluator,
                                   NotificationGate gate,
                                   NotificationDispatcher dispatcher,
                                   JobsyProperties props) {
        if (!props.getNotifications().isEnabled()) {
            log.info("Failure notifications are disabled (jobsy.notifications.enabled=false)");
        }
        return new CheckRunner(jobs, reports, tx, clock, evaluator, gate, dispatcher,
                props.getNotifications().isEnabled(), props.getScheduler().getCheckWorkers());
    }

    // --- 스케줄러 등록 (주기는 jobsy.scheduler.tick-delay-ms) ---

    @Bean
    @ConditionalOnProperty(prefix = "jobsy.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    public JobsySchedulers jobsySchedulers(CheckRunner checkRunner) {
        return new JobsySchedulers(checkRunner);
    }

    @Bean
    public CatalogRegistrar catalogRegistrar(JobRepository jobs, TxRunner tx, CronCalculator cron) {
        return new CatalogRegistrar(jobs, tx, cron);
    }

    @Bean
    @ConditionalOnProperty(prefix = "jobsy.catalog", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ApplicationRunner catalogRunner(CatalogRegistrar registrar, JobsyProperties props) {
        log.info("Catalog: {} job definition(s)", props.getCatalog().getJobs().size());
        return args -> registrar.register(props.getCatalog());
    }
}
