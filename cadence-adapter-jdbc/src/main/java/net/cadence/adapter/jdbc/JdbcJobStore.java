package net.cadence.adapter.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import net.cadence.adapter.jdbc.repo.JdbcExecutionRepository;
import net.cadence.adapter.jdbc.repo.JdbcJobDependencyRepository;
import net.cadence.adapter.jdbc.repo.JdbcJobRepository;
import net.cadence.core.config.EngineSettings;
import net.cadence.core.event.LoggingNotificationTransport;
import net.cadence.core.service.SchedulerEngine;
import net.cadence.core.spi.Clock;
import net.cadence.core.spi.ExecutionRepository;
import net.cadence.core.spi.JobDependencyRepository;
import net.cadence.core.spi.JobRepository;
import net.cadence.core.spi.NotificationTransport;
import net.cadence.core.spi.TxRunner;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;

/**
 * Spring 없이 엔진을 임베드할 때 쓰는 저장소 묶음.
 * 커넥션 풀 생성 → 스키마 마이그레이션 → 저장소/트랜잭션 러너 제공.
 */
public final class JdbcJobStore implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JdbcJobStore.class);

    public static final String MIGRATION_LOCATION = "classpath:db/migration/h2";

    private final HikariDataSource dataSource;
    private final TxRunner tx;
    private final JobRepository jobs = new JdbcJobRepository();
    private final JobDependencyRepository dependencies = new JdbcJobDependencyRepository();
    private final ExecutionRepository executions = new JdbcExecutionRepository();

    private JdbcJobStore(HikariDataSource dataSource) {
        this.dataSource = dataSource;
        this.tx = new JdbcTxRunner(dataSource);
    }

    /** 예: jdbc:h2:file:./data/cadence, jdbc:h2:mem:cadence;DB_CLOSE_DELAY=-1 */
    public static JdbcJobStore open(String jdbcUrl, String user, String password, int poolSize) {
        HikariConfig cfg = new HikariConfig();
        cfg.setJdbcUrl(jdbcUrl);
        cfg.setUsername(user);
        cfg.setPassword(password);
        cfg.setMaximumPoolSize(poolSize);
        cfg.setMinimumIdle(1);
        cfg.setConnectionTimeout(10_000);
        cfg.setIdleTimeout(300_000);
        cfg.setPoolName("cadence-db-pool");
        HikariDataSource ds = new HikariDataSource(cfg);
        try {
            migrate(ds);
        } catch (RuntimeException e) {
            ds.close();
            throw e;
        }
        log.info("Job store opened: {}", jdbcUrl);
        return new JdbcJobStore(ds);
    }

    public static void migrate(DataSource ds) {
        Flyway.configure()
                .dataSource(ds)
                .locations(MIGRATION_LOCATION)
                .baselineOnMigrate(true)
                .load()
                .migrate();
    }

    public DataSource dataSource() { return dataSource; }
    public TxRunner tx() { return tx; }
    public JobRepository jobs() { return jobs; }
    public JobDependencyRepository dependencies() { return dependencies; }
    public ExecutionRepository executions() { return executions; }

    public SchedulerEngine newEngine(EngineSettings settings) {
        return newEngine(settings, Clock.system(), new LoggingNotificationTransport());
    }

    public SchedulerEngine newEngine(EngineSettings settings, Clock clock, NotificationTransport transport) {
        return new SchedulerEngine(jobs, dependencies, executions, tx, clock, settings, transport);
    }

    @Override
    public void close() {
        dataSource.close();
    }
}
