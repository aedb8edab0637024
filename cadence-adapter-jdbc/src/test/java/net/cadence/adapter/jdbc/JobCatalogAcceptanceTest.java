package net.cadence.adapter.jdbc;

import net.cadence.core.event.LoggingNotificationTransport;
import net.cadence.core.model.Execution;
import net.cadence.core.model.ExecutionSeal;
import net.cadence.core.model.Job;
import net.cadence.core.model.JobDefinition;
import net.cadence.core.model.JobKind;
import net.cadence.core.model.NotificationPrefs;
import net.cadence.core.model.RetrySettings;
import net.cadence.core.model.Schedule;
import net.cadence.core.service.CyclicDependencyException;
import net.cadence.core.service.DefinitionException;
import net.cadence.core.service.JobCatalogService;
import net.cadence.core.service.SchedulerEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobCatalogAcceptanceTest extends TestSupport {

    static final Instant T0 = Instant.parse("2024-10-01T08:00:00Z");

    MutableClock mutableClock;
    JobCatalogService catalog;

    @BeforeEach
    void init() throws Exception {
        truncateAll();
        mutableClock = new MutableClock(T0);
        clock = mutableClock;
        catalog = newCatalog();
    }

    @Test
    void create_assigns_id_and_initial_next_run() throws Exception {
        Job manual = catalog.create(JobDefinition.shell("manual", "true", Schedule.manual()));
        Job interval = catalog.create(JobDefinition.shell("every-15", "true", Schedule.interval(15)));
        Job cron = catalog.create(JobDefinition.shell("nine-am", "true", Schedule.cron("0 9 * * *")));

        assertThat(manual.id()).isNotNull();
        assertNull(manual.nextRun());
        assertEquals(T0.plus(Duration.ofMinutes(15)), interval.nextRun());
        assertEquals(Instant.parse("2024-10-01T09:00:00Z"), cron.nextRun());
        assertNull(cron.lastRun());
        assertNull(cron.lastStatus());
        assertEquals(List.of("every-15", "manual", "nine-am"),
                catalog.listJobs().stream().map(Job::name).toList());
    }

    @Test
    void job_definition_round_trips_through_the_store() throws Exception {
        JobDefinition def = new JobDefinition("report", "nightly report", JobKind.SCRIPT_INTERPRETER,
                "report.py --full", "/tmp", Map.of("A", "1", "B", "two"), Schedule.cron("30 2 * * 1-5"),
                false, new RetrySettings(3, 120), 600, new NotificationPrefs("ops@example.com", true, true));

        Job created = catalog.create(def);
        Job loaded = catalog.getJob("report");

        assertEquals(created.id(), loaded.id());
        assertEquals(def, loaded.definition());
        assertThat(loaded.createdAt()).isNotNull();
    }

    @Test
    void duplicate_name_is_rejected() throws Exception {
        catalog.create(JobDefinition.shell("backup", "true", Schedule.manual()));

        DefinitionException e = assertThrows(DefinitionException.class,
                () -> catalog.create(JobDefinition.shell("backup", "false", Schedule.manual())));
        assertEquals("name", e.field());
        assertEquals(1, catalog.listJobs().size());
    }

    @Test
    void invalid_definitions_report_the_offending_field() {
        assertField("name", JobDefinition.shell(" padded", "true", Schedule.manual()));
        assertField("name", JobDefinition.shell("", "true", Schedule.manual()));
        assertField("command", JobDefinition.shell("no-command", " ", Schedule.manual()));
        assertField("schedule.intervalMinutes", JobDefinition.shell("zero", "true", Schedule.interval(0)));
        assertField("schedule.expression", JobDefinition.shell("bad-cron", "true", Schedule.cron("61 * * * *")));
        assertField("schedule.expression", JobDefinition.shell("never", "true", Schedule.cron("0 0 30 2 *")));
        assertField("retry.maxRetries", JobDefinition.shell("too-many", "true", Schedule.manual())
                .withRetry(new RetrySettings(11, 0)));
        assertField("timeoutSeconds", JobDefinition.shell("no-time", "true", Schedule.manual())
                .withTimeoutSeconds(0));
        assertField("environment", JobDefinition.shell("env", "true", Schedule.manual())
                .withEnvironment(Map.of("A=B", "x")));
        assertField("notification.address", JobDefinition.shell("mail", "true", Schedule.manual())
                .withNotification(new NotificationPrefs("not-an-address", false, true)));
        assertField("retry.retryDelaySeconds", JobDefinition.shell("forever", "true", Schedule.manual())
                .withRetry(new RetrySettings(1, 10_000_000_000_000_000L)));
    }

    @Test
    void values_longer_than_their_columns_are_rejected_before_the_store() throws Exception {
        assertField("command", JobDefinition.shell("long-command", "x".repeat(8001), Schedule.manual()));
        assertField("schedule.expression", JobDefinition.shell("long-cron", "true",
                Schedule.cron("0 9 * * " + "1,".repeat(100) + "2")));
        assertField("notification.address", JobDefinition.shell("long-mail", "true", Schedule.manual())
                .withNotification(new NotificationPrefs("a".repeat(320) + "@example.com", false, true)));
        assertField("workingDirectory", JobDefinition.shell("long-dir", "true", Schedule.manual())
                .withWorkingDirectory("/" + "d".repeat(1024)));
        assertEquals(0, catalog.listJobs().size());

        // 경계값은 저장된다
        Job atLimit = catalog.create(JobDefinition.shell("max-command", "x".repeat(8000), Schedule.manual()));
        assertEquals(8000, catalog.getJob(atLimit.id()).command().length());
    }

    private void assertField(String field, JobDefinition def) {
        DefinitionException e = assertThrows(DefinitionException.class, () -> catalog.create(def));
        assertEquals(field, e.field(), e.getMessage());
    }

    @Test
    void cycle_is_rejected_and_graph_left_unchanged() throws Exception {
        Job a = catalog.create(JobDefinition.shell("a", "true", Schedule.manual()));
        Job b = catalog.create(JobDefinition.shell("b", "true", Schedule.manual()));
        Job c = catalog.create(JobDefinition.shell("c", "true", Schedule.manual()));

        catalog.addDependency(a.id(), b.id());
        catalog.addDependency(b.id(), c.id());

        assertThrows(CyclicDependencyException.class, () -> catalog.addDependency(b.id(), a.id()));
        assertThrows(CyclicDependencyException.class, () -> catalog.addDependency(c.id(), a.id()));
        assertThrows(CyclicDependencyException.class, () -> catalog.addDependency(a.id(), a.id()));
        assertEquals(2, catalog.dependencyGraph().size());

        // 이미 있는 엣지는 그대로
        catalog.addDependency(a.id(), b.id());
        assertEquals(List.of(b.id()), catalog.dependenciesOf(a.id()));
    }

    @Test
    void dependency_on_unknown_job_is_rejected() throws Exception {
        Job a = catalog.create(JobDefinition.shell("a", "true", Schedule.manual()));

        DefinitionException e = assertThrows(DefinitionException.class, () -> catalog.addDependency(a.id(), 999_999L));
        assertEquals("dependsOn", e.field());
    }

    @Test
    void set_dependencies_replaces_atomically() throws Exception {
        Job a = catalog.create(JobDefinition.shell("a", "true", Schedule.manual()));
        Job b = catalog.create(JobDefinition.shell("b", "true", Schedule.manual()));
        Job c = catalog.create(JobDefinition.shell("c", "true", Schedule.manual()));
        Job d = catalog.create(JobDefinition.shell("d", "true", Schedule.manual()));
        catalog.setDependencies(a.id(), List.of(b.id(), c.id()));
        catalog.addDependency(d.id(), a.id());

        assertThat(catalog.dependenciesOf(a.id())).containsExactlyInAnyOrder(b.id(), c.id());

        // d 는 a 에 의존하므로 a → d 는 순환. b 도 함께 바꾸려 했지만 아무것도 바뀌지 않아야 한다
        assertThrows(CyclicDependencyException.class, () -> catalog.setDependencies(a.id(), List.of(b.id(), d.id())));
        assertThat(catalog.dependenciesOf(a.id())).containsExactlyInAnyOrder(b.id(), c.id());

        catalog.setDependencies(a.id(), List.of(c.id()));
        assertEquals(List.of(c.id()), catalog.dependenciesOf(a.id()));
        catalog.setDependencies(a.id(), List.of());
        assertTrue(catalog.dependenciesOf(a.id()).isEmpty());
    }

    @Test
    void delete_cascades_to_edges_and_history() throws Exception {
        Job a = catalog.create(JobDefinition.shell("a", "true", Schedule.manual()));
        Job b = catalog.create(JobDefinition.shell("b", "true", Schedule.manual()));
        Job c = catalog.create(JobDefinition.shell("c", "true", Schedule.manual()));
        catalog.addDependency(a.id(), b.id());
        catalog.addDependency(b.id(), c.id());
        Execution e = tx.required(() -> executions.start(b.id(), T0, 0, Execution.TriggeredBy.MANUAL));

        assertTrue(catalog.delete(b.id()));

        assertTrue(catalog.dependencyGraph().isEmpty());
        assertTrue(tx.required(() -> executions.findById(e.id())).isEmpty());
        assertThrows(NoSuchElementException.class, () -> catalog.getJob(b.id()));
        assertFalse(catalog.delete(b.id()));
    }

    @Test
    void next_run_is_recomputed_only_when_schedule_changes() throws Exception {
        Job job = catalog.create(JobDefinition.shell("hourly", "true", Schedule.interval(60)));
        Instant original = job.nextRun();

        mutableClock.advance(Duration.ofMinutes(10));
        Job renamedCommand = catalog.update(job.id(), JobDefinition.shell("hourly", "echo changed", Schedule.interval(60)));
        assertEquals(original, renamedCommand.nextRun());
        assertEquals("echo changed", renamedCommand.command());

        Job rescheduled = catalog.update(job.id(), JobDefinition.shell("hourly", "echo changed", Schedule.interval(30)));
        assertEquals(T0.plus(Duration.ofMinutes(40)), rescheduled.nextRun());

        Job manual = catalog.update(job.id(), JobDefinition.shell("hourly", "echo changed", Schedule.manual()));
        assertNull(manual.nextRun());
    }

    @Test
    void update_of_missing_job_fails() {
        assertThrows(NoSuchElementException.class,
                () -> catalog.update(424242L, JobDefinition.shell("ghost", "true", Schedule.manual())));
    }

    @Test
    void re_enabling_recomputes_next_run_from_now() throws Exception {
        Job job = catalog.create(JobDefinition.shell("interval", "true", Schedule.interval(5)));
        catalog.setEnabled(job.id(), false);
        assertFalse(catalog.getJob(job.id()).enabled());

        mutableClock.advance(Duration.ofHours(3));
        catalog.setEnabled(job.id(), true);

        Job reloaded = catalog.getJob(job.id());
        assertTrue(reloaded.enabled());
        assertEquals(mutableClock.now().plus(Duration.ofMinutes(5)), reloaded.nextRun());
    }

    @Test
    void history_is_newest_first_and_capped() throws Exception {
        Job job = catalog.create(JobDefinition.shell("busy", "true", Schedule.manual()));
        for (int i = 0; i < 60; i++) {
            Instant start = T0.plusSeconds(i * 60L);
            tx.required(() -> {
                Execution e = executions.start(job.id(), start, 0, Execution.TriggeredBy.SCHEDULE);
                executions.seal(e.id(), new ExecutionSeal(Execution.Outcome.SUCCESS, 0, start.plusSeconds(1),
                        "", "", false));
                return null;
            });
        }

        try (SchedulerEngine engine = new SchedulerEngine(jobs, deps, executions, tx, clock, testSettings(),
                new LoggingNotificationTransport())) {
            List<Execution> page = engine.executions(job.id());
            assertEquals(SchedulerEngine.DEFAULT_HISTORY_LIMIT, page.size());
            assertEquals(T0.plusSeconds(59 * 60L), page.get(0).startTime());
            for (int i = 1; i < page.size(); i++) {
                assertTrue(page.get(i - 1).startTime().isAfter(page.get(i).startTime()));
            }

            List<Execution> second = engine.executions(job.id(), 50, 50);
            assertEquals(10, second.size());
            assertEquals(T0, second.get(9).startTime());

            assertEquals(5, engine.recentExecutions(5, Execution.Outcome.SUCCESS).size());
            assertTrue(engine.recentExecutions(5, Execution.Outcome.FAILED).isEmpty());
            assertThrows(IllegalArgumentException.class, () -> engine.executions(job.id(), 0, 0));
        }
    }
}
