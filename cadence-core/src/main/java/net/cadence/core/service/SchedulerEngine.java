package net.cadence.core.service;

import net.cadence.core.config.EngineSettings;
import net.cadence.core.event.ExecutionEventBus;
import net.cadence.core.event.ExecutionListener;
import net.cadence.core.event.NotificationDispatcher;
import net.cadence.core.event.Subscription;
import net.cadence.core.maintenance.MaintenanceService;
import net.cadence.core.model.DependencyEdge;
import net.cadence.core.model.Execution;
import net.cadence.core.model.Job;
import net.cadence.core.model.JobDefinition;
import net.cadence.core.spi.Clock;
import net.cadence.core.spi.ExecutionRepository;
import net.cadence.core.spi.JobDependencyRepository;
import net.cadence.core.spi.JobRepository;
import net.cadence.core.spi.NotificationTransport;
import net.cadence.core.spi.TxRunner;
import net.cadence.core.transfer.JobTransferService;
import net.cadence.core.trigger.TriggerEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * 외부 협력자(편집기, 로그 뷰어, 설정 화면)가 쓰는 엔진 진입점.
 * 내부 구성요소를 조립하고 기동/정지 순서를 관리한다.
 */
public final class SchedulerEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SchedulerEngine.class);

    public static final int DEFAULT_HISTORY_LIMIT = 50;

    private enum State { NEW, RUNNING, STOPPED }

    private final JobRepository jobs;
    private final ExecutionRepository executions;
    private final TxRunner tx;

    private final ExecutionEventBus events;
    private final ExecutionSupervisor supervisor;
    private final SchedulerLoop loop;
    private final JobCatalogService catalog;
    private final JobTransferService transfer;
    private final MaintenanceService maintenance;

    private volatile EngineSettings settings;
    private volatile State state = State.NEW;

    public SchedulerEngine(JobRepository jobs,
                           JobDependencyRepository deps,
                           ExecutionRepository executions,
                           TxRunner tx,
                           Clock clock,
                           EngineSettings settings,
                           NotificationTransport transport) {
        this.jobs = jobs;
        this.executions = executions;
        this.tx = tx;
        this.settings = settings;

        TriggerEvaluator triggers = new TriggerEvaluator(settings.zone());
        this.events = new ExecutionEventBus();
        this.supervisor = new ExecutionSupervisor(jobs, executions, tx, clock, events, settings);
        this.loop = new SchedulerLoop(jobs, deps, executions, tx, clock, triggers, new DependencyResolver(), supervisor);
        this.catalog = new JobCatalogService(jobs, deps, tx, clock, triggers, settings.defaultRetry());
        this.transfer = new JobTransferService(catalog, clock);
        this.maintenance = new MaintenanceService(jobs, executions, tx, clock);

        events.subscribe(loop.dependencyTrigger());
        events.subscribe(new NotificationDispatcher(jobs, executions, tx, transport, settings.zone()));
    }

    /* ===================== 수명주기 ===================== */

    /**
     * 저장소 확인 → 이전 실행 정리 → 스케줄러 루프 시작.
     * @throws JobStoreUnavailableException 저장소에 접근할 수 없으면 루프를 시작하지 않는다
     */
    public synchronized MaintenanceService.MaintenanceReport start() {
        if (state != State.NEW) throw new IllegalStateException("engine already " + state.name().toLowerCase(Locale.ROOT));
        MaintenanceService.MaintenanceReport report;
        try {
            tx.required(jobs::findEnabled);
            report = maintenance.runOnce();
        } catch (Exception e) {
            log.error("Job store unavailable, engine not started", e);
            throw new JobStoreUnavailableException("job store unavailable: " + e.getMessage(), e);
        }
        loop.start(settings.tickInterval());
        state = State.RUNNING;
        log.info("Cadence engine started ({})", settings);
        return report;
    }

    public synchronized void stop() {
        if (state == State.STOPPED) return;
        State was = state;
        state = State.STOPPED;
        if (was == State.RUNNING) {
            loop.stop(settings.shutdownGrace());
        } else {
            supervisor.shutdown(settings.shutdownGrace());
        }
        events.close();
        log.info("Cadence engine stopped");
    }

    public boolean isRunning() {
        return state == State.RUNNING;
    }

    @Override
    public void close() {
        stop();
    }

    /* ===================== 잡 정의 ===================== */

    public Job createJob(JobDefinition def) throws Exception {
        return catalog.create(def);
    }

    public Job updateJob(long jobId, JobDefinition def) throws Exception {
        return catalog.update(jobId, def);
    }

    public boolean deleteJob(long jobId) throws Exception {
        return catalog.delete(jobId);
    }

    public void enableJob(long jobId) throws Exception {
        catalog.setEnabled(jobId, true);
    }

    public void disableJob(long jobId) throws Exception {
        catalog.setEnabled(jobId, false);
    }

    public void addDependency(long jobId, long dependsOnJobId) throws Exception {
        catalog.addDependency(jobId, dependsOnJobId);
    }

    public boolean removeDependency(long jobId, long dependsOnJobId) throws Exception {
        return catalog.removeDependency(jobId, dependsOnJobId);
    }

    public void setDependencies(long jobId, Collection<Long> dependsOn) throws Exception {
        catalog.setDependencies(jobId, dependsOn);
    }

    /* ===================== 실행 제어 ===================== */

    /**
     * 즉시 실행 요청. 의존성이 막혀 있으면 풀릴 때까지 대기 상태로 남는다.
     * @throws IllegalStateException 비활성 잡
     */
    public void runNow(long jobId) throws Exception {
        Job job = catalog.getJob(jobId);
        if (!job.enabled()) throw new IllegalStateException("job '" + job.name() + "' is disabled");
        loop.requestRun(jobId, Execution.TriggeredBy.MANUAL);
        loop.wakeUp();
        log.info("Run-now requested for job '{}'", job.name());
    }

    public boolean cancel(long executionId) throws Exception {
        return supervisor.cancel(executionId);
    }

    /* ===================== 조회 ===================== */

    public List<Job> listJobs() throws Exception {
        return catalog.listJobs();
    }

    public Job getJob(long jobId) throws Exception {
        return catalog.getJob(jobId);
    }

    public Optional<Job> findJob(String name) throws Exception {
        return tx.required(() -> jobs.findByName(name));
    }

    public List<DependencyEdge> dependencyGraph() throws Exception {
        return catalog.dependencyGraph();
    }

    public List<Long> dependenciesOf(long jobId) throws Exception {
        return catalog.dependenciesOf(jobId);
    }

    /** 최신순 50건 */
    public List<Execution> executions(long jobId) throws Exception {
        return executions(jobId, DEFAULT_HISTORY_LIMIT, 0);
    }

    public List<Execution> executions(long jobId, int limit, int offset) throws Exception {
        if (limit <= 0) throw new IllegalArgumentException("limit must be positive");
        if (offset < 0) throw new IllegalArgumentException("offset must not be negative");
        return tx.required(() -> executions.findByJob(jobId, limit, offset));
    }

    /** 전체 잡 대상 최신 실행. outcome 이 null 이면 필터 없음 */
    public List<Execution> recentExecutions(int limit, Execution.Outcome outcome) throws Exception {
        if (limit <= 0) throw new IllegalArgumentException("limit must be positive");
        return tx.required(() -> executions.findRecent(limit, outcome));
    }

    public Execution execution(long executionId) throws Exception {
        return tx.required(() -> executions.findById(executionId))
                .orElseThrow(() -> new NoSuchElementException("execution " + executionId + " not found"));
    }

    public Subscription subscribe(ExecutionListener listener) {
        return events.subscribe(listener);
    }

    /* ===================== 가져오기/내보내기 ===================== */

    public String exportJobs() throws Exception {
        return transfer.exportJobs();
    }

    public List<Job> importJobs(String json) throws Exception {
        return transfer.importJobs(json);
    }

    /* ===================== 설정 ===================== */

    public EngineSettings settings() {
        return settings;
    }

    /** 틱 주기/슬롯 수/기본 재시도 등은 즉시 반영된다. zone 변경은 재기동이 필요하다 */
    public synchronized void applySettings(EngineSettings next) {
        EngineSettings prev = this.settings;
        this.settings = next;
        supervisor.applySettings(next);
        catalog.setDefaultRetry(next.defaultRetry());
        if (!prev.tickInterval().equals(next.tickInterval())) loop.reschedule(next.tickInterval());
        if (!prev.zone().equals(next.zone())) {
            log.warn("Time zone change to {} takes effect after restart", next.zone());
        }
        log.info("Settings applied: {}", next);
    }

    // 테스트/진단용
    public SchedulerLoop loop() {
        return loop;
    }

    public ExecutionSupervisor supervisor() {
        return supervisor;
    }

    public JobCatalogService catalog() {
        return catalog;
    }
}
