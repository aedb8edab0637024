package net.cadence.adapter.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import net.cadence.adapter.jdbc.repo.JdbcExecutionRepository;
import net.cadence.adapter.jdbc.repo.JdbcJobDependencyRepository;
import net.cadence.adapter.jdbc.repo.JdbcJobRepository;
import net.cadence.core.event.LoggingNotificationTransport;
import net.cadence.core.maintenance.MaintenanceService;
import net.cadence.core.model.Execution;
import net.cadence.core.model.Job;
import net.cadence.core.model.JobDefinition;
import net.cadence.core.model.Schedule;
import net.cadence.core.service.JobCatalogService;
import net.cadence.core.service.JobStoreUnavailableException;
import net.cadence.core.service.SchedulerEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MaintenanceAcceptanceTest extends TestSupport {

    JobCatalogService catalog;

    @BeforeEach
    void init() throws Exception {
        truncateAll();
        catalog = newCatalog();
    }

    @Test
    void running_rows_left_by_a_previous_process_are_sealed_on_start() throws Exception {
        Job job = catalog.create(JobDefinition.shell("interrupted", "sleep 100", Schedule.manual()));
        Instant started = Instant.parse("2024-10-01T08:00:00Z");
        Execution stale = tx.required(() -> {
            Execution e = executions.start(job.id(), started, 0, Execution.TriggeredBy.SCHEDULE);
            executions.updateOutput(e.id(), "partial\n", "");
            jobs.recordRun(job.id(), started, Execution.Outcome.RUNNING);
            return e;
        });

        MaintenanceService.MaintenanceReport report;
        try (SchedulerEngine engine = new SchedulerEngine(jobs, deps, executions, tx, clock, testSettings(),
                new LoggingNotificationTransport())) {
            report = engine.start();
        }

        assertEquals(1, report.reconciledExecutions);
        assertEquals(1, report.resetJobs);
        Execution row = tx.required(() -> executions.findById(stale.id())).orElseThrow();
        assertEquals(Execution.Outcome.CANCELLED, row.outcome());
        assertNotNull(row.endTime());
        assertEquals("partial\n", row.stdout());
        assertEquals(MaintenanceService.INTERRUPTED_NOTE, row.stderr());
        assertTrue(tx.required(() -> executions.findRunning()).isEmpty());
        assertEquals(Execution.Outcome.CANCELLED, catalog.getJob(job.id()).lastStatus());
    }

    @Test
    void live_recorded_pid_is_flagged_as_possibly_orphaned() throws Exception {
        Job job = catalog.create(JobDefinition.shell("orphaned", "sleep 100", Schedule.manual()));
        long selfPid = ProcessHandle.current().pid();
        Execution stale = tx.required(() -> {
            Execution e = executions.start(job.id(), clock.now(), 0, Execution.TriggeredBy.MANUAL);
            executions.attachPid(e.id(), selfPid);
            return e;
        });

        MaintenanceService.MaintenanceReport report = new MaintenanceService(jobs, executions, tx, clock).runOnce();

        assertEquals(1, report.possiblyOrphanedProcesses);
        Execution row = tx.required(() -> executions.findById(stale.id())).orElseThrow();
        assertTrue(row.processMayBeAlive());
        assertEquals(selfPid, row.pid());
    }

    @Test
    void clean_store_needs_no_reconcile() throws Exception {
        MaintenanceService.MaintenanceReport report = new MaintenanceService(jobs, executions, tx, clock).runOnce();
        assertEquals(0, report.reconciledExecutions);
        assertEquals(0, report.resetJobs);
    }

    @Test
    void engine_does_not_start_when_store_is_unavailable() {
        HikariConfig cfg = new HikariConfig();
        cfg.setJdbcUrl("jdbc:h2:mem:unmigrated-" + System.nanoTime() + ";DB_CLOSE_DELAY=-1");
        cfg.setUsername("sa");
        cfg.setPassword("");
        cfg.setMaximumPoolSize(2);
        // 스키마가 없는 DB: 모든 조회가 실패한다
        try (HikariDataSource empty = new HikariDataSource(cfg)) {
            SchedulerEngine engine = new SchedulerEngine(new JdbcJobRepository(), new JdbcJobDependencyRepository(),
                    new JdbcExecutionRepository(), new JdbcTxRunner(empty), clock, testSettings(),
                    new LoggingNotificationTransport());

            assertThrows(JobStoreUnavailableException.class, engine::start);
            assertFalse(engine.isRunning());
            engine.close();
        }
    }
}
