package net.cadence.integration.spring.tx;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import net.cadence.adapter.jdbc.JdbcJobStore;
import net.cadence.adapter.jdbc.TxContext;
import net.cadence.adapter.jdbc.repo.JdbcJobRepository;
import net.cadence.core.model.Job;
import net.cadence.core.model.JobDefinition;
import net.cadence.core.model.RetrySettings;
import net.cadence.core.model.Schedule;
import net.cadence.core.spi.JobRepository;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;

import java.io.IOException;
import java.sql.Connection;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class SpringTxRunnerTest {

    HikariDataSource ds;
    SpringTxRunner tx;
    JobRepository jobs = new JdbcJobRepository();

    @BeforeAll
    void setupDb() {
        HikariConfig cfg = new HikariConfig();
        cfg.setJdbcUrl("jdbc:h2:mem:SpringTxRunnerTest;DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000");
        cfg.setUsername("sa");
        cfg.setPassword("");
        cfg.setMaximumPoolSize(4);
        ds = new HikariDataSource(cfg);
        JdbcJobStore.migrate(ds);
        tx = new SpringTxRunner(new DataSourceTransactionManager(ds), ds);
    }

    @AfterAll
    void cleanup() {
        ds.close();
    }

    @BeforeEach
    void clean() throws Exception {
        tx.required(() -> {
            try (var st = TxContext.require().createStatement()) {
                st.execute("DELETE FROM JOBS");
            }
            return null;
        });
    }

    private static Job newJob(String name) {
        return Job.ofNew(JobDefinition.shell(name, "true", Schedule.manual()), RetrySettings.none(), null);
    }

    @Test
    void commits_and_clears_context() throws Exception {
        tx.required(() -> jobs.insert(newJob("committed")));

        assertTrue(tx.required(() -> jobs.findByName("committed")).isPresent());
        assertNull(TxContext.get());
    }

    @Test
    void checked_exception_rolls_back_and_propagates_unwrapped() {
        IOException thrown = assertThrows(IOException.class, () -> tx.required(() -> {
            jobs.insert(newJob("rolled-back"));
            throw new IOException("boom");
        }));

        assertThat(thrown).hasMessage("boom");
        assertThat(countJobs()).isZero();
    }

    @Test
    void nested_required_joins_outer_connection() throws Exception {
        tx.required(() -> {
            Connection outer = TxContext.require();
            tx.required(() -> {
                assertSame(outer, TxContext.require());
                return null;
            });
            assertSame(outer, TxContext.require());
            return null;
        });
    }

    @Test
    void requires_new_commits_independently_of_outer_rollback() {
        assertThrows(IllegalStateException.class, () -> tx.required(() -> {
            Connection outer = TxContext.require();
            jobs.insert(newJob("outer"));
            tx.requiresNew(() -> {
                assertNotSame(outer, TxContext.require());
                return jobs.insert(newJob("inner"));
            });
            assertSame(outer, TxContext.require());
            throw new IllegalStateException("outer fails");
        }));

        assertThat(names()).containsExactly("inner");
    }

    private int countJobs() {
        try {
            return tx.required(() -> jobs.findAll().size());
        } catch (Exception e) {
            throw new AssertionError(e);
        }
    }

    private List<String> names() {
        try {
            return tx.required(() -> jobs.findAll().stream().map(Job::name).toList());
        } catch (Exception e) {
            throw new AssertionError(e);
        }
    }
}
