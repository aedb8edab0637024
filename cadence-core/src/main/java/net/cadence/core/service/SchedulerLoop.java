package net.cadence.core.service;

import net.cadence.core.event.ExecutionListener;
import net.cadence.core.model.DependencyEdge;
import net.cadence.core.model.Execution;
import net.cadence.core.model.Job;
import net.cadence.core.model.Schedule;
import net.cadence.core.spi.Clock;
import net.cadence.core.spi.ExecutionRepository;
import net.cadence.core.spi.JobDependencyRepository;
import net.cadence.core.spi.JobRepository;
import net.cadence.core.spi.TxRunner;
import net.cadence.core.trigger.TriggerEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 한 번의 틱: (1) 트리거 평가 → due 잡을 pending 에 올리고 nextRun 전진
 * (2) 의존성 판정 (3) eligible 한 pending 잡을 due 시각 순으로 슈퍼바이저에 제출.
 * 막힌 잡은 pending 에 남아 다음 틱에 다시 본다.
 */
public final class SchedulerLoop {
    private static final Logger log = LoggerFactory.getLogger(SchedulerLoop.class);

    public enum Phase { IDLE, EVALUATE_TRIGGERS, RESOLVE_DEPENDENCIES, DISPATCH, STOPPED }

    private final JobRepository jobs;
    private final JobDependencyRepository deps;
    private final ExecutionRepository executions;
    private final TxRunner tx;
    private final Clock clock;
    private final TriggerEvaluator triggers;
    private final DependencyResolver resolver;
    private final ExecutionSupervisor supervisor;

    /** jobId → 트리거 원인. 디스패치될 때까지 유지 */
    private final Map<Long, Execution.TriggeredBy> pending = new ConcurrentHashMap<>();
    private final Object tickLock = new Object();
    private final ScheduledExecutorService ticker = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "cadence-scheduler");
        t.setDaemon(true);
        return t;
    });
    private ScheduledFuture<?> cadence;
    private volatile Phase phase = Phase.IDLE;

    public SchedulerLoop(JobRepository jobs,
                         JobDependencyRepository deps,
                         ExecutionRepository executions,
                         TxRunner tx,
                         Clock clock,
                         TriggerEvaluator triggers,
                         DependencyResolver resolver,
                         ExecutionSupervisor supervisor) {
        this.jobs = jobs;
        this.deps = deps;
        this.executions = executions;
        this.tx = tx;
        this.clock = clock;
        this.triggers = triggers;
        this.resolver = resolver;
        this.supervisor = supervisor;
    }

    /* ===================== 수명주기 ===================== */

    public synchronized void start(Duration tickInterval) {
        if (phase == Phase.STOPPED) throw new IllegalStateException("scheduler loop already stopped");
        if (cadence != null) return;
        cadence = ticker.scheduleWithFixedDelay(this::safeTick, 0, tickInterval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Scheduler loop started (tick every {}ms)", tickInterval.toMillis());
    }

    /** 틱 주기 변경. 다음 틱부터 적용 */
    public synchronized void reschedule(Duration tickInterval) {
        if (cadence == null || phase == Phase.STOPPED) return;
        cadence.cancel(false);
        cadence = ticker.scheduleWithFixedDelay(this::safeTick, tickInterval.toMillis(), tickInterval.toMillis(),
                TimeUnit.MILLISECONDS);
    }

    /**
     * 진행 중인 틱이 끝나기를 기다린 뒤 멈춘다. 이후 디스패치는 없다.
     * 실행 중인 잡은 grace 동안 기다리고 남은 것은 취소한다.
     */
    public synchronized void stop(Duration grace) {
        if (phase == Phase.STOPPED) return;
        if (cadence != null) cadence.cancel(false);
        ticker.shutdown();
        try {
            if (!ticker.awaitTermination(30, TimeUnit.SECONDS)) ticker.shutdownNow();
        } catch (InterruptedException e) {
            ticker.shutdownNow();
            Thread.currentThread().interrupt();
        }
        synchronized (tickLock) {
            phase = Phase.STOPPED;
        }
        log.info("Scheduler loop stopped, draining executions (grace {}s)", grace.toSeconds());
        supervisor.shutdown(grace);
    }

    public Phase phase() {
        return phase;
    }

    /** 다음 틱을 기다리지 않고 한 번 더 돈다 */
    public void wakeUp() {
        try {
            ticker.execute(this::safeTick);
        } catch (RejectedExecutionException e) {
            log.debug("Scheduler loop stopped, wake-up ignored");
        }
    }

    /** 수동 실행/의존성 트리거 요청. 잡이 eligible 해지면 다음 틱에 디스패치된다 */
    public void requestRun(long jobId, Execution.TriggeredBy triggeredBy) {
        pending.merge(jobId, triggeredBy,
                (old, neu) -> neu == Execution.TriggeredBy.MANUAL ? neu : old);
    }

    public Map<Long, Execution.TriggeredBy> pendingJobs() {
        return Map.copyOf(pending);
    }

    /** 의존 대상의 최종 시도가 성공하면 수동 스케줄인 후속 잡을 pending 에 올린다 */
    public ExecutionListener dependencyTrigger() {
        return event -> {
            if (event.finalAttempt() && event.succeeded()) onDependencySucceeded(event.jobId());
        };
    }

    private void onDependencySucceeded(long jobId) {
        try {
            List<Job> triggered = tx.required(() -> {
                List<Job> out = new ArrayList<>();
                for (Long dependent : deps.findDependents(jobId)) {
                    jobs.findById(dependent)
                            .filter(j -> j.enabled() && j.schedule() instanceof Schedule.Manual)
                            .ifPresent(out::add);
                }
                return out;
            });
            for (Job j : triggered) {
                pending.putIfAbsent(j.id(), Execution.TriggeredBy.DEPENDENCY);
                log.info("Job '{}' triggered by successful dependency {}", j.name(), jobId);
            }
            if (!triggered.isEmpty()) wakeUp();
        } catch (Exception e) {
            log.warn("Could not evaluate dependents of job {}: {}", jobId, e.getMessage());
        }
    }

    private void safeTick() {
        try {
            tickOnce();
        } catch (RuntimeException e) {
            // 예외가 ScheduledExecutor 까지 올라가면 이후 틱이 모두 취소된다
            log.error("Scheduler tick failed", e);
        }
    }

    /* ===================== 틱 ===================== */

    public TickReport tickOnce() {
        synchronized (tickLock) {
            if (phase == Phase.STOPPED) return TickReport.skipped(clock.now());
            Instant now = clock.now();
            try {
                TickReport report = runTick(now);
                log.debug("Tick {}", report);
                return report;
            } finally {
                if (phase != Phase.STOPPED) phase = Phase.IDLE;
            }
        }
    }

    private TickReport runTick(Instant now) {
        phase = Phase.EVALUATE_TRIGGERS;
        List<Job> enabled;
        try {
            enabled = tx.required(jobs::findEnabled);
        } catch (Exception e) {
            log.warn("Job store read failed, skipping tick: {}", e.getMessage());
            return TickReport.skipped(now);
        }
        Map<Long, Job> byId = enabled.stream().collect(Collectors.toMap(Job::id, Function.identity()));
        // 비활성화/삭제된 잡의 대기 요청은 버린다
        pending.keySet().removeIf(id -> !byId.containsKey(id));

        for (Job job : enabled) {
            try {
                evaluateTrigger(job, now);
            } catch (Exception e) {
                log.warn("Skipping job '{}' this tick: {}", job.name(), e.getMessage());
            }
        }
        if (pending.isEmpty()) return new TickReport(now, 0, 0, 0, false);

        phase = Phase.RESOLVE_DEPENDENCIES;
        List<DependencyEdge> edges;
        Set<Long> eligible;
        try {
            edges = tx.required(deps::findAll);
            Map<Long, Execution> latest = tx.required(executions::findLatestPerJob);
            eligible = resolver.eligible(enabled, edges, latest, supervisor.inFlightJobIds());
        } catch (Exception e) {
            log.warn("Dependency state read failed, pending jobs kept: {}", e.getMessage());
            return new TickReport(now, pending.size(), 0, 0, true);
        }

        phase = Phase.DISPATCH;
        List<Job> due = enabled.stream()
                .filter(j -> pending.containsKey(j.id()))
                .sorted(Comparator.comparing((Job j) -> dueTime(j, now)).thenComparing(Job::name))
                .collect(Collectors.toList());
        Set<Long> dueIds = new HashSet<>();
        for (Job j : due) dueIds.add(j.id());
        Map<Long, List<Long>> dependencies = DependencyResolver.index(edges);

        int dispatched = 0, blocked = 0;
        for (Job job : due) {
            // 같은 틱에 의존 대상도 실행 예정이면 그 결과를 기다린다
            boolean waitsOnPeer = dependencies.getOrDefault(job.id(), List.of()).stream()
                    .anyMatch(d -> (dueIds.contains(d) && eligible.contains(d)) || supervisor.isInFlight(d));
            if (!eligible.contains(job.id()) || waitsOnPeer) {
                blocked++;
                log.debug("Job '{}' is due but blocked", job.name());
                continue;
            }
            Execution.TriggeredBy by = pending.get(job.id());
            if (by == null) continue;
            Optional<ExecutionHandle> handle = supervisor.submit(job, by);
            if (handle.isPresent()) {
                pending.remove(job.id(), by);
                dispatched++;
                log.info("Dispatched job '{}' ({})", job.name(), by);
            }
        }
        return new TickReport(now, due.size(), dispatched, blocked, false);
    }

    private void evaluateTrigger(Job job, Instant now) throws Exception {
        Schedule schedule = job.schedule();
        if (schedule instanceof Schedule.Manual) return;

        if (job.nextRun() == null) {
            Instant first = triggers.nextRun(schedule, now).orElse(null);
            tx.required(() -> {
                jobs.updateNextRun(job.id(), first);
                return null;
            });
            return;
        }
        if (now.isBefore(job.nextRun())) return;

        pending.putIfAbsent(job.id(), Execution.TriggeredBy.SCHEDULE);
        // 놓친 슬롯은 한 번으로 합치고 커서는 now 이후로
        Instant next = triggers.nextRunAfter(schedule, job.nextRun(), now).orElse(null);
        tx.required(() -> {
            jobs.updateNextRun(job.id(), next);
            return null;
        });
    }

    private static Instant dueTime(Job job, Instant now) {
        return job.nextRun() == null || job.schedule() instanceof Schedule.Manual ? now : job.nextRun();
    }

    /** 틱 결과 요약 */
    public record TickReport(Instant timestamp, int due, int dispatched, int blocked, boolean skipped) {
        static TickReport skipped(Instant now) {
            return new TickReport(now, 0, 0, 0, true);
        }
    }
}
