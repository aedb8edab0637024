package net.cadence.adapter.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import net.cadence.adapter.jdbc.repo.JdbcExecutionRepository;
import net.cadence.adapter.jdbc.repo.JdbcJobDependencyRepository;
import net.cadence.adapter.jdbc.repo.JdbcJobRepository;
import net.cadence.core.config.EngineSettings;
import net.cadence.core.model.RetrySettings;
import net.cadence.core.service.JobCatalogService;
import net.cadence.core.spi.Clock;
import net.cadence.core.spi.ExecutionRepository;
import net.cadence.core.spi.JobDependencyRepository;
import net.cadence.core.spi.JobRepository;
import net.cadence.core.spi.TxRunner;
import net.cadence.core.trigger.TriggerEvaluator;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.TestInstance;

import javax.sql.DataSource;
import java.time.Duration;
import java.time.ZoneOffset;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public abstract class TestSupport {
    protected static DataSource ds;

    protected TxRunner tx;
    protected JobRepository jobs;
    protected JobDependencyRepository deps;
    protected ExecutionRepository executions;
    protected Clock clock = Clock.system();

    @BeforeAll
    void setupDb() {
        // 테스트 클래스마다 별도 in-memory DB
        HikariConfig cfg = new HikariConfig();
        cfg.setJdbcUrl("jdbc:h2:mem:" + getClass().getSimpleName() + ";DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000");
        cfg.setUsername("sa");
        cfg.setPassword("");
        cfg.setMaximumPoolSize(12);
        cfg.setMinimumIdle(1);
        cfg.setConnectionTimeout(30_000);
        cfg.setIdleTimeout(60_000);
        ds = new HikariDataSource(cfg);

        JdbcJobStore.migrate(ds);

        tx = new JdbcTxRunner(ds);
        jobs = new JdbcJobRepository();
        deps = new JdbcJobDependencyRepository();
        executions = new JdbcExecutionRepository();
    }

    @AfterAll
    void cleanup() {
        if (ds instanceof HikariDataSource h) h.close();
    }

    protected void truncateAll() throws Exception {
        tx.required(() -> {
            try (var st = TxContext.get().createStatement()) {
                for (String t : new String[]{"JOB_EXECUTIONS", "JOB_DEPENDENCIES", "JOBS"}) {
                    st.execute("DELETE FROM " + t);
                }
            }
            return null;
        });
    }

    /** 빠른 테스트용: 짧은 kill grace / flush 주기 */
    protected static EngineSettings testSettings() {
        return EngineSettings.defaults()
                .withTickInterval(Duration.ofMillis(200))
                .withKillGrace(Duration.ofSeconds(2))
                .withOutputFlushInterval(Duration.ofMillis(200))
                .withStoreWriteBackoff(Duration.ofMillis(10))
                .withShutdownGrace(Duration.ofSeconds(5));
    }

    protected JobCatalogService newCatalog() {
        return new JobCatalogService(jobs, deps, tx, clock, new TriggerEvaluator(ZoneOffset.UTC), RetrySettings.none());
    }
}
