package net.cadence.adapter.jdbc;

import net.cadence.core.event.LoggingNotificationTransport;
import net.cadence.core.model.Execution;
import net.cadence.core.model.Job;
import net.cadence.core.model.JobDefinition;
import net.cadence.core.model.Schedule;
import net.cadence.core.service.SchedulerEngine;
import net.cadence.core.service.SchedulerLoop;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SchedulerLoopAcceptanceTest extends TestSupport {

    static final Instant T0 = Instant.parse("2024-10-01T08:00:00Z");

    MutableClock mutableClock;
    SchedulerEngine engine;
    SchedulerLoop loop;

    @BeforeEach
    void init() throws Exception {
        truncateAll();
        mutableClock = new MutableClock(T0);
        clock = mutableClock;
        engine = new SchedulerEngine(jobs, deps, executions, tx, mutableClock, testSettings(),
                new LoggingNotificationTransport());
        loop = engine.loop();
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private Job job(String name, String command, Schedule schedule) throws Exception {
        return engine.createJob(JobDefinition.shell(name, command, schedule));
    }

    private Optional<Execution> latest(long jobId) throws Exception {
        return engine.executions(jobId, 1, 0).stream().findFirst();
    }

    private Execution awaitSealed(long jobId) {
        await().atMost(Duration.ofSeconds(20)).until(() -> latest(jobId).map(Execution::isSealed).orElse(false)
                && !engine.supervisor().isInFlight(jobId));
        try {
            return latest(jobId).orElseThrow();
        } catch (Exception e) {
            throw new AssertionError(e);
        }
    }

    @Test
    void interval_job_fires_when_due_and_advances_next_run() throws Exception {
        Job job = job("every-5", "echo tick", Schedule.interval(5));

        SchedulerLoop.TickReport early = loop.tickOnce();
        assertEquals(0, early.due());
        assertTrue(latest(job.id()).isEmpty());

        mutableClock.advance(Duration.ofMinutes(5));
        SchedulerLoop.TickReport due = loop.tickOnce();
        assertEquals(1, due.dispatched());

        Execution e = awaitSealed(job.id());
        assertEquals(Execution.Outcome.SUCCESS, e.outcome());
        assertEquals(Execution.TriggeredBy.SCHEDULE, e.triggeredBy());
        assertEquals(T0.plus(Duration.ofMinutes(10)), engine.getJob(job.id()).nextRun());
    }

    @Test
    void missed_slots_are_coalesced_into_one_run() throws Exception {
        Job job = job("every-5", "true", Schedule.interval(5));

        mutableClock.advance(Duration.ofHours(1));
        assertEquals(1, loop.tickOnce().dispatched());
        awaitSealed(job.id());
        assertEquals(0, loop.tickOnce().dispatched());

        assertEquals(1L, (long) tx.required(() -> executions.countByJob(job.id())));
        // 예정 그리드(T0+5m 기준)에서 now 다음 슬롯
        assertEquals(T0.plus(Duration.ofMinutes(65)), engine.getJob(job.id()).nextRun());
    }

    @Test
    void job_with_two_dependencies_runs_after_both_succeed() throws Exception {
        Job a = job("extract-a", "sleep 0.3", Schedule.manual());
        Job b = job("extract-b", "sleep 0.6", Schedule.manual());
        Job c = job("merge", "echo merged", Schedule.manual());
        engine.setDependencies(c.id(), List.of(a.id(), b.id()));

        loop.requestRun(a.id(), Execution.TriggeredBy.MANUAL);
        loop.requestRun(b.id(), Execution.TriggeredBy.MANUAL);
        loop.requestRun(c.id(), Execution.TriggeredBy.MANUAL);
        SchedulerLoop.TickReport first = loop.tickOnce();
        assertEquals(3, first.due());
        assertEquals(2, first.dispatched());
        assertEquals(1, first.blocked());

        Execution merged = awaitSealed(c.id());
        assertEquals(Execution.Outcome.SUCCESS, merged.outcome());
        assertEquals(Execution.TriggeredBy.MANUAL, merged.triggeredBy());
        assertThat(merged.startTime()).isAfterOrEqualTo(latest(b.id()).orElseThrow().endTime());
        assertEquals(Execution.Outcome.SUCCESS, latest(a.id()).orElseThrow().outcome());
        assertEquals(Execution.Outcome.SUCCESS, latest(b.id()).orElseThrow().outcome());
    }

    @Test
    void blocked_job_stays_pending_while_dependency_fails() throws Exception {
        Job upstream = job("upstream", "exit 1", Schedule.manual());
        Job downstream = job("downstream", "true", Schedule.manual());
        engine.addDependency(downstream.id(), upstream.id());

        loop.requestRun(downstream.id(), Execution.TriggeredBy.MANUAL);
        SchedulerLoop.TickReport report = loop.tickOnce();
        assertEquals(1, report.blocked());
        assertTrue(loop.pendingJobs().containsKey(downstream.id()));

        loop.requestRun(upstream.id(), Execution.TriggeredBy.MANUAL);
        loop.tickOnce();
        assertEquals(Execution.Outcome.FAILED, awaitSealed(upstream.id()).outcome());

        assertEquals(1, loop.tickOnce().blocked());
        assertTrue(latest(downstream.id()).isEmpty());
        assertEquals(Execution.TriggeredBy.MANUAL, loop.pendingJobs().get(downstream.id()));
    }

    @Test
    void dependent_due_in_same_tick_waits_for_its_dependency() throws Exception {
        Job load = job("load", "true", Schedule.interval(10));
        Job report = job("report", "true", Schedule.interval(10));
        engine.addDependency(report.id(), load.id());

        // load 의 성공 이력을 먼저 만든다
        loop.requestRun(load.id(), Execution.TriggeredBy.MANUAL);
        loop.tickOnce();
        awaitSealed(load.id());

        mutableClock.advance(Duration.ofMinutes(10));
        SchedulerLoop.TickReport sameTick = loop.tickOnce();
        assertEquals(2, sameTick.due());
        assertEquals(1, sameTick.dispatched());
        assertEquals(1, sameTick.blocked());
        assertTrue(loop.pendingJobs().containsKey(report.id()));

        Execution loadRun = awaitSealed(load.id());
        assertEquals(1, loop.tickOnce().dispatched());
        Execution reportRun = awaitSealed(report.id());
        assertEquals(Execution.TriggeredBy.SCHEDULE, reportRun.triggeredBy());
        assertThat(reportRun.id()).isGreaterThan(loadRun.id());
    }

    @Test
    void successful_dependency_triggers_manual_dependents_in_chain() throws Exception {
        Job a = job("a", "true", Schedule.manual());
        Job b = job("b", "true", Schedule.manual());
        Job c = job("c", "true", Schedule.manual());
        engine.addDependency(b.id(), a.id());
        engine.addDependency(c.id(), b.id());

        engine.runNow(a.id());

        await().atMost(Duration.ofSeconds(20)).until(() -> latest(c.id()).map(Execution::isSealed).orElse(false));
        assertEquals(Execution.TriggeredBy.MANUAL, latest(a.id()).orElseThrow().triggeredBy());
        assertEquals(Execution.TriggeredBy.DEPENDENCY, latest(b.id()).orElseThrow().triggeredBy());
        Execution last = latest(c.id()).orElseThrow();
        assertEquals(Execution.TriggeredBy.DEPENDENCY, last.triggeredBy());
        assertEquals(Execution.Outcome.SUCCESS, last.outcome());
    }

    @Test
    void pending_request_of_disabled_job_is_dropped() throws Exception {
        Job job = job("switch-off", "true", Schedule.manual());
        loop.requestRun(job.id(), Execution.TriggeredBy.MANUAL);
        engine.disableJob(job.id());

        SchedulerLoop.TickReport report = loop.tickOnce();

        assertEquals(0, report.dispatched());
        assertFalse(loop.pendingJobs().containsKey(job.id()));
        assertTrue(latest(job.id()).isEmpty());
        assertThrows(IllegalStateException.class, () -> engine.runNow(job.id()));
    }

    @Test
    void disabled_interval_job_is_not_triggered() throws Exception {
        Job job = job("paused", "true", Schedule.interval(1));
        engine.disableJob(job.id());

        mutableClock.advance(Duration.ofMinutes(5));
        assertEquals(0, loop.tickOnce().due());
        assertTrue(latest(job.id()).isEmpty());
    }

    @Test
    void run_now_dispatches_without_waiting_for_the_next_tick() throws Exception {
        Job job = job("adhoc", "echo now", Schedule.manual());
        engine.start();

        engine.runNow(job.id());

        Execution e = awaitSealed(job.id());
        assertEquals(Execution.TriggeredBy.MANUAL, e.triggeredBy());
        assertEquals("now\n", e.stdout());
    }

    @Test
    void stopped_loop_does_not_dispatch() throws Exception {
        Job job = job("late", "true", Schedule.manual());
        engine.start();
        assertTrue(engine.isRunning());

        engine.stop();

        assertEquals(SchedulerLoop.Phase.STOPPED, loop.phase());
        loop.requestRun(job.id(), Execution.TriggeredBy.MANUAL);
        assertTrue(loop.tickOnce().skipped());
        assertTrue(latest(job.id()).isEmpty());
        assertFalse(engine.isRunning());
    }
}
