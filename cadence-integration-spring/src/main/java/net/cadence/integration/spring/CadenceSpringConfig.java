package net.cadence.integration.spring;

import net.cadence.adapter.jdbc.repo.JdbcExecutionRepository;
import net.cadence.adapter.jdbc.repo.JdbcJobDependencyRepository;
import net.cadence.adapter.jdbc.repo.JdbcJobRepository;
import net.cadence.core.spi.Clock;
import net.cadence.core.spi.ExecutionRepository;
import net.cadence.core.spi.JobDependencyRepository;
import net.cadence.core.spi.JobRepository;
import net.cadence.core.spi.ScheduleDescriber;
import net.cadence.core.spi.TxRunner;
import net.cadence.integration.spring.cron.CronUtilsScheduleDescriber;
import net.cadence.integration.spring.tx.SpringTxRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

@Configuration
public class CadenceSpringConfig {

    // TxRunner (Spring)
    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    // Repository 구현 등록 (adapter-jdbc 재사용)
    @Bean public JobRepository jobRepository() { return new JdbcJobRepository(); }
    @Bean public JobDependencyRepository jobDependencyRepository() { return new JdbcJobDependencyRepository(); }
    @Bean public ExecutionRepository executionRepository() { return new JdbcExecutionRepository(); }

    @Bean public Clock systemClock() { return Clock.system(); }

    @Bean public ScheduleDescriber scheduleDescriber() { return new CronUtilsScheduleDescriber(); }
}
