package net.cadence.core.maintenance;

import net.cadence.core.model.Execution;
import net.cadence.core.model.ExecutionSeal;
import net.cadence.core.spi.Clock;
import net.cadence.core.spi.ExecutionRepository;
import net.cadence.core.spi.JobRepository;
import net.cadence.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;

/** 기동 시 정리: 이전 프로세스가 남긴 RUNNING 실행을 종료 상태로 봉인 */
public final class MaintenanceService {
    private static final Logger log = LoggerFactory.getLogger(MaintenanceService.class);

    public static final String INTERRUPTED_NOTE = "interrupted: engine restarted before this execution finished";

    private final JobRepository jobs;
    private final ExecutionRepository executions;
    private final TxRunner tx;
    private final Clock clock;

    public MaintenanceService(JobRepository jobs,
                              ExecutionRepository executions,
                              TxRunner tx,
                              Clock clock) {
        this.jobs = jobs;
        this.executions = executions;
        this.tx = tx;
        this.clock = clock;
    }

    /**
     * 기동 점검.
     * - RUNNING 실행 → CANCELLED (+ stderr 메모). 기록된 PID 가 아직 살아 있으면 processMayBeAlive 표시
     * - 잡의 lastStatus RUNNING → CANCELLED
     */
    public MaintenanceReport runOnce() throws Exception {
        Instant now = clock.now();
        MaintenanceReport r = new MaintenanceReport();

        List<Execution> running = tx.required(executions::findRunning);
        for (Execution e : running) {
            boolean alive = e.pid() != null && ProcessHandle.of(e.pid()).map(ProcessHandle::isAlive).orElse(false);
            ExecutionSeal seal = new ExecutionSeal(Execution.Outcome.CANCELLED, null, now,
                    e.stdout() == null ? "" : e.stdout(),
                    e.stderr() == null || e.stderr().isEmpty() ? INTERRUPTED_NOTE : e.stderr() + "\n" + INTERRUPTED_NOTE,
                    e.processMayBeAlive() || alive);
            boolean sealed = tx.required(() -> executions.seal(e.id(), seal));
            if (sealed) {
                r.reconciledExecutions++;
                if (alive) r.possiblyOrphanedProcesses++;
            }
        }

        r.resetJobs = tx.required(() -> jobs.resetRunningStatus(Execution.Outcome.CANCELLED));
        r.timestamp = now;
        if (r.reconciledExecutions > 0 || r.resetJobs > 0) log.info("Startup reconcile: {}", r);
        if (r.possiblyOrphanedProcesses > 0) {
            log.warn("{} process(es) from a previous run may still be alive", r.possiblyOrphanedProcesses);
        }
        return r;
    }

    /** 간단 리포트 DTO */
    public static final class MaintenanceReport {
        public Instant timestamp;
        public int reconciledExecutions;
        public int possiblyOrphanedProcesses;
        public int resetJobs;

        @Override public String toString() {
            return "MaintenanceReport{" +
                    "timestamp=" + timestamp +
                    ", reconciledExecutions=" + reconciledExecutions +
                    ", possiblyOrphanedProcesses=" + possiblyOrphanedProcesses +
                    ", resetJobs=" + resetJobs +
                    '}';
        }
    }
}
