package net.cadence.core.service;

import net.cadence.core.config.EngineSettings;
import net.cadence.core.event.ExecutionEvent;
import net.cadence.core.event.ExecutionEventBus;
import net.cadence.core.event.StoreFault;
import net.cadence.core.model.Execution;
import net.cadence.core.model.ExecutionSeal;
import net.cadence.core.model.Job;
import net.cadence.core.process.BoundedOutputBuffer;
import net.cadence.core.process.OutputPump;
import net.cadence.core.process.ProcessCommands;
import net.cadence.core.process.ProcessControl;
import net.cadence.core.spi.Clock;
import net.cadence.core.spi.ExecutionRepository;
import net.cadence.core.spi.JobRepository;
import net.cadence.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 고정 개수의 실행 슬롯에서 잡 프로세스를 돌린다.
 * <ul>
 *   <li>슬롯 = 풀 스레드. 슬롯이 모두 차면 제출은 FIFO 대기열에 쌓인다.</li>
 *   <li>잡당 동시에 하나의 실행만 허용 (inFlight 에 이미 있으면 제출 거절).</li>
 *   <li>시도 상태는 RUNNING 에서 한 번만 전이한다 (취소/타임아웃/정상 종료 중 먼저 온 쪽).</li>
 *   <li>실행 행 봉인은 슬롯 스레드만 한다.</li>
 * </ul>
 */
public final class ExecutionSupervisor {
    private static final Logger log = LoggerFactory.getLogger(ExecutionSupervisor.class);

    static final String ORPHAN_CANCEL_NOTE = "cancelled: no live process for this execution";

    private final JobRepository jobs;
    private final ExecutionRepository executions;
    private final TxRunner tx;
    private final Clock clock;
    private final ExecutionEventBus events;

    private volatile EngineSettings settings;
    private volatile ProcessCommands commands;

    private final ThreadPoolExecutor slots;
    private final ScheduledExecutorService retryTimer;
    private final ExecutorService pumps;

    private final ConcurrentMap<Long, Submission> inFlight = new ConcurrentHashMap<>();
    private final ConcurrentMap<Long, Attempt> attempts = new ConcurrentHashMap<>();
    private final AtomicInteger active = new AtomicInteger();
    private final AtomicInteger peakActive = new AtomicInteger();
    private volatile boolean accepting = true;

    public ExecutionSupervisor(JobRepository jobs,
                               ExecutionRepository executions,
                               TxRunner tx,
                               Clock clock,
                               ExecutionEventBus events,
                               EngineSettings settings) {
        this.jobs = jobs;
        this.executions = executions;
        this.tx = tx;
        this.clock = clock;
        this.events = events;
        this.settings = settings;
        this.commands = new ProcessCommands(settings);

        int n = settings.maxSlots();
        this.slots = new ThreadPoolExecutor(n, n, 30, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(), named("cadence-slot", false));
        this.retryTimer = Executors.newSingleThreadScheduledExecutor(named("cadence-retry", true));
        this.pumps = Executors.newCachedThreadPool(named("cadence-output", true));
    }

    private static ThreadFactory named(String prefix, boolean daemon) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(daemon);
            return t;
        };
    }

    /* ===================== 제출 / 조회 ===================== */

    /**
     * 잡 실행을 대기열에 넣는다.
     * @return 이미 같은 잡이 진행 중이거나 종료 중이면 empty
     */
    public Optional<ExecutionHandle> submit(Job job, Execution.TriggeredBy triggeredBy) {
        Objects.requireNonNull(job.id(), "job must be persisted");
        if (!accepting) return Optional.empty();

        Submission s = new Submission(job, triggeredBy);
        if (inFlight.putIfAbsent(job.id(), s) != null) {
            log.debug("Job '{}' already in flight, submission skipped", job.name());
            return Optional.empty();
        }
        try {
            slots.execute(() -> runAttempt(s));
        } catch (RejectedExecutionException e) {
            inFlight.remove(job.id(), s);
            return Optional.empty();
        }
        return Optional.of(s.handle);
    }

    public Set<Long> inFlightJobIds() {
        return Set.copyOf(inFlight.keySet());
    }

    public boolean isInFlight(long jobId) {
        return inFlight.containsKey(jobId);
    }

    /** 현재 프로세스를 돌리고 있는 슬롯 수 */
    public int activeSlots() {
        return active.get();
    }

    public int peakActiveSlots() {
        return peakActive.get();
    }

    /** 슬롯 수 변경. 줄이는 경우 실행 중인 시도는 끝까지 돌고, 이후 새 시도부터 적용 */
    public synchronized void resize(int maxSlots) {
        if (maxSlots < 1) throw new IllegalArgumentException("maxSlots must be >= 1");
        if (maxSlots > slots.getMaximumPoolSize()) {
            slots.setMaximumPoolSize(maxSlots);
            slots.setCorePoolSize(maxSlots);
        } else {
            slots.setCorePoolSize(maxSlots);
            slots.setMaximumPoolSize(maxSlots);
        }
    }

    /** 이후 시작되는 시도부터 반영 */
    public void applySettings(EngineSettings next) {
        this.settings = next;
        this.commands = new ProcessCommands(next);
        if (next.maxSlots() != slots.getMaximumPoolSize()) resize(next.maxSlots());
    }

    /* ===================== 취소 ===================== */

    /**
     * 실행 취소. 살아 있는 시도면 프로세스 트리를 종료시키고 봉인은 슬롯 스레드에 맡긴다.
     * 살아 있는 시도가 없는 RUNNING 행은 바로 CANCELLED 로 봉인한다.
     * @return 이번 호출로 취소가 일어났으면 true, 이미 종료된 실행이면 false
     */
    public boolean cancel(long executionId) throws Exception {
        Attempt live = attempts.get(executionId);
        if (live != null) return live.cancel(settings.killGrace());

        Optional<Execution> row = tx.required(() -> executions.findById(executionId));
        if (row.isEmpty() || row.get().isSealed()) return false;
        Execution e = row.get();
        if (inFlight.containsKey(e.jobId())) {
            // 시도는 끝났고 결과 봉인이 진행 중
            Attempt late = attempts.get(executionId);
            return late != null && late.cancel(settings.killGrace());
        }
        ExecutionSeal seal = new ExecutionSeal(Execution.Outcome.CANCELLED, null, clock.now(),
                nullToEmpty(e.stdout()), appendNote(e.stderr(), ORPHAN_CANCEL_NOTE), e.processMayBeAlive());
        boolean sealed = tx.required(() -> {
            boolean ok = executions.seal(executionId, seal);
            if (ok) jobs.recordRun(e.jobId(), e.startTime(), Execution.Outcome.CANCELLED);
            return ok;
        });
        if (sealed) log.info("Sealed orphan execution {} of job {} as CANCELLED", executionId, e.jobId());
        return sealed;
    }

    /* ===================== 시도 실행 (슬롯 스레드) ===================== */

    private void runAttempt(Submission s) {
        if (!accepting || s.cancelled) {
            finish(s);
            return;
        }
        s.waitingRetry = false;
        int now = active.incrementAndGet();
        peakActive.accumulateAndGet(now, Math::max);

        Job job = s.job;
        EngineSettings cfg = settings;
        Execution row;
        AtomicReference<Attempt> registered = new AtomicReference<>();
        try {
            Instant started = clock.now();
            row = storeWrite(cfg, "create execution row", () -> tx.required(() -> {
                Execution created = executions.start(job.id(), started, s.retryCount, s.triggeredBy);
                // 커밋 전에 등록: 행이 보이는 순간부터 cancel 이 시도를 찾을 수 있다
                Attempt a = new Attempt(created.id(), s);
                attempts.put(created.id(), a);
                Attempt stale = registered.getAndSet(a);
                if (stale != null) attempts.remove(stale.executionId);
                jobs.recordRun(job.id(), started, Execution.Outcome.RUNNING);
                return created;
            }));
        } catch (Exception e) {
            Attempt stale = registered.get();
            if (stale != null) attempts.remove(stale.executionId);
            active.decrementAndGet();
            log.error("Store-integrity fault: could not record start of job '{}'", job.name(), e);
            events.publish(new StoreFault(job.id(), null, Execution.Outcome.RUNNING, e.getMessage()));
            finish(s);
            return;
        }

        Attempt attempt = registered.get();
        if (s.cancelled) attempt.transition(Execution.Outcome.CANCELLED);
        ExecutionSeal seal;
        boolean interrupted = false;
        try {
            seal = execute(job, row, attempt, cfg);
        } catch (InterruptedException e) {
            interrupted = true;
            attempt.cancel(cfg.killGrace());
            seal = new ExecutionSeal(Execution.Outcome.CANCELLED, null, clock.now(), "",
                    "interrupted while running", attempt.mayBeAlive);
        } catch (RuntimeException e) {
            log.error("Supervisor error while running job '{}'", job.name(), e);
            if (attempt.transition(Execution.Outcome.FAILED)) attempt.kill(cfg.killGrace());
            seal = new ExecutionSeal(attempt.state(), null, clock.now(), "",
                    "supervisor error: " + e, attempt.mayBeAlive);
        } finally {
            attempts.remove(row.id());
        }

        Execution sealed = persistSeal(job, row, seal, cfg);
        s.last = sealed;
        active.decrementAndGet();

        try {
            int attemptNo = s.retryCount;
            long retryDelayMs = seal.outcome().isRetryable()
                    && attemptNo < maxRetries(job)
                    && accepting && !s.cancelled
                    ? retryDelayMillis(job, attemptNo + 1) : -1;
            boolean retry = retryDelayMs >= 0;
            ExecutionEvent event = new ExecutionEvent(job.id(), job.name(), row.id(), seal.outcome(),
                    seal.exitCode(), attemptNo, Duration.between(row.startTime(), seal.endTime()), !retry);
            log.info("Job '{}' attempt {} finished: {}{}", job.name(), attemptNo, seal.outcome(),
                    seal.exitCode() == null ? "" : " (exit " + seal.exitCode() + ")");

            if (retry) {
                events.publish(event);
                scheduleRetry(s, retryDelayMs);
            } else {
                // inFlight 해제 후 발행해야 후속 잡 판정이 이 잡을 진행 중으로 보지 않는다
                finish(s);
                events.publish(event);
            }
        } catch (RuntimeException e) {
            log.error("Supervisor error after sealing execution {} of job '{}'", row.id(), job.name(), e);
            finish(s);
        }
        if (interrupted) Thread.currentThread().interrupt();
    }

    private ExecutionSeal execute(Job job, Execution row, Attempt attempt, EngineSettings cfg)
            throws InterruptedException {
        if (attempt.state() == Execution.Outcome.CANCELLED) {
            return new ExecutionSeal(Execution.Outcome.CANCELLED, null, clock.now(), "",
                    "cancelled before launch", false);
        }
        List<String> command = commands.commandFor(job);
        ProcessBuilder pb = new ProcessBuilder(command);
        String wd = job.workingDirectory();
        if (wd != null && !wd.isBlank()) pb.directory(new File(wd));
        pb.environment().putAll(job.environment());

        BoundedOutputBuffer out = new BoundedOutputBuffer(cfg.outputLimitChars());
        BoundedOutputBuffer err = new BoundedOutputBuffer(cfg.outputLimitChars());

        Process p;
        try {
            p = pb.start();
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to launch job '{}': {}", job.name(), e.getMessage());
            Execution.Outcome outcome = attempt.transition(Execution.Outcome.FAILED)
                    ? Execution.Outcome.FAILED : attempt.state();
            return new ExecutionSeal(outcome, null, clock.now(), "",
                    "failed to launch " + command + ": " + e.getMessage(), false);
        }
        attempt.attach(p, cfg.killGrace());
        log.debug("Job '{}' started as pid {}", job.name(), p.pid());
        tryWrite("attach pid", () -> tx.required(() -> {
            executions.attachPid(row.id(), p.pid());
            return null;
        }));
        closeStdin(p);

        Future<?> outPump = pumps.submit(new OutputPump(p.getInputStream(), out));
        Future<?> errPump = pumps.submit(new OutputPump(p.getErrorStream(), err));

        Duration timeout = job.timeout();
        long deadline = timeout == null ? 0 : System.nanoTime() + timeout.toNanos();
        long flushEvery = Math.max(10, cfg.outputFlushInterval().toMillis());
        long flushedOut = -1, flushedErr = -1;

        while (true) {
            long waitMs = flushEvery;
            if (timeout != null) {
                long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remainingMs <= 0) {
                    if (attempt.transition(Execution.Outcome.TIMED_OUT)) {
                        log.warn("Job '{}' exceeded timeout of {}s, terminating", job.name(), timeout.toSeconds());
                        attempt.kill(cfg.killGrace());
                    }
                    break;
                }
                waitMs = Math.min(waitMs, remainingMs);
            }
            if (p.waitFor(waitMs, TimeUnit.MILLISECONDS)) break;
            if (attempt.state() == Execution.Outcome.CANCELLED) break;

            long ov = out.version(), ev = err.version();
            if (ov != flushedOut || ev != flushedErr) {
                flushedOut = ov;
                flushedErr = ev;
                tryWrite("flush output", () -> tx.required(() -> {
                    executions.updateOutput(row.id(), out.snapshot(), err.snapshot());
                    return null;
                }));
            }
        }

        // 종료됐거나 kill 이 확인된 상태. 파이프는 손자 프로세스가 잡고 있을 수 있어 제한 시간만 기다린다
        awaitPump(outPump, cfg.killGrace());
        awaitPump(errPump, cfg.killGrace());

        Integer exitCode = null;
        Execution.Outcome natural = null;
        if (!p.isAlive()) {
            exitCode = p.exitValue();
            natural = exitCode == 0 ? Execution.Outcome.SUCCESS : Execution.Outcome.FAILED;
        }
        Execution.Outcome outcome = natural != null && attempt.transition(natural) ? natural : attempt.state();
        Integer recordedExit = outcome == Execution.Outcome.SUCCESS || outcome == Execution.Outcome.FAILED
                ? exitCode : null;
        return new ExecutionSeal(outcome, recordedExit, clock.now(), out.snapshot(), err.snapshot(),
                attempt.mayBeAlive || p.isAlive());
    }

    private static void closeStdin(Process p) {
        try {
            p.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Could not close stdin of pid {}: {}", p.pid(), e.getMessage());
        }
    }

    private static void awaitPump(Future<?> pump, Duration grace) throws InterruptedException {
        try {
            pump.get(grace.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pump.cancel(true);
            log.debug("Output pump still attached after {}ms, detaching", grace.toMillis());
        } catch (java.util.concurrent.ExecutionException e) {
            log.debug("Output pump failed", e.getCause());
        }
    }

    /* ===================== 저장 ===================== */

    private Execution persistSeal(Job job, Execution row, ExecutionSeal seal, EngineSettings cfg) {
        Execution sealedRow = new Execution(row.id(), row.jobId(), row.startTime(), seal.endTime(), seal.outcome(),
                seal.exitCode(), seal.stdout(), seal.stderr(), row.retryCount(), row.triggeredBy(), row.pid(),
                seal.processMayBeAlive());
        try {
            boolean sealed = storeWrite(cfg, "seal execution", () -> tx.required(() -> {
                boolean ok = executions.seal(row.id(), seal);
                if (ok) jobs.recordRun(job.id(), row.startTime(), seal.outcome());
                return ok;
            }));
            if (!sealed) {
                // 잡 삭제(연쇄 삭제) 또는 외부에서 먼저 봉인된 경우
                Optional<Execution> current = tx.required(() -> executions.findById(row.id()));
                if (current.isEmpty()) {
                    log.info("Execution {} of job '{}' no longer exists (job deleted while running)",
                            row.id(), job.name());
                    return sealedRow;
                }
                return current.get();
            }
        } catch (Exception e) {
            log.error("Store-integrity fault: outcome {} of execution {} (job '{}') could not be recorded",
                    seal.outcome(), row.id(), job.name(), e);
            events.publish(new StoreFault(job.id(), row.id(), seal.outcome(), String.valueOf(e.getMessage())));
        }
        return sealedRow;
    }

    /** 백오프를 두 배씩 늘리며 재시도. 마지막 실패는 호출자에게 전달 */
    private <T> T storeWrite(EngineSettings cfg, String what, Callable<T> body) throws Exception {
        int attemptsLeft = Math.max(1, cfg.storeWriteAttempts());
        RetryPolicy backoff = RetryPolicy.doubling(cfg.storeWriteBackoff());
        for (int i = 1; ; i++) {
            try {
                return body.call();
            } catch (Exception e) {
                if (i >= attemptsLeft) throw e;
                log.warn("Store write '{}' failed (attempt {}/{}): {}", what, i, attemptsLeft, e.getMessage());
                Thread.sleep(backoff.nextBackoff(i).toMillis());
            }
        }
    }

    /** 실패해도 실행을 멈추지 않는 부가 쓰기 (pid, 중간 출력) */
    private void tryWrite(String what, Callable<?> body) {
        try {
            body.call();
        } catch (Exception e) {
            log.warn("Store write '{}' failed, continuing: {}", what, e.getMessage());
        }
    }

    /* ===================== 재시도 / 종료 ===================== */

    /** 다음 재시도까지의 대기(ms). 표현할 수 없는 값이면 -1 (재시도 포기) */
    private static long retryDelayMillis(Job job, int retry) {
        try {
            return RetryPolicy.of(job.retry()).nextBackoff(retry).toMillis();
        } catch (ArithmeticException e) {
            log.warn("Retry delay of job '{}' is out of range, giving up retries", job.name());
            return -1;
        }
    }

    private void scheduleRetry(Submission s, long delayMs) {
        s.retryCount++;
        s.waitingRetry = true;
        log.info("Retrying job '{}' in {}s (retry {}/{})", s.job.name(), TimeUnit.MILLISECONDS.toSeconds(delayMs),
                s.retryCount, maxRetries(s.job));
        try {
            retryTimer.schedule(() -> admit(s), delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            finish(s);
        }
    }

    private void admit(Submission s) {
        if (!accepting || s.cancelled) {
            finish(s);
            return;
        }
        try {
            slots.execute(() -> runAttempt(s));
        } catch (RejectedExecutionException e) {
            finish(s);
        }
    }

    private void finish(Submission s) {
        inFlight.remove(s.job.id(), s);
        if (s.last != null) s.handle.completion().complete(s.last);
        else s.handle.completion().cancel(false);
    }

    /**
     * 새 제출을 막고, grace 동안 실행 중인 시도를 기다린 뒤 남은 시도는 취소한다.
     * 대기열에 있던 제출과 재시도 대기는 시작되지 않는다.
     */
    public void shutdown(Duration grace) {
        accepting = false;
        retryTimer.shutdownNow();
        for (Submission s : inFlight.values()) {
            if (s.waitingRetry) finish(s);
        }
        slots.shutdown();
        try {
            if (!slots.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("{} execution(s) still running after {}s grace, cancelling", attempts.size(),
                        grace.toSeconds());
                for (Attempt a : attempts.values()) a.cancel(settings.killGrace());
                long extra = settings.killGrace().multipliedBy(3).toMillis() + 1000;
                if (!slots.awaitTermination(extra, TimeUnit.MILLISECONDS)) {
                    log.error("Execution slots did not stop, interrupting");
                    slots.shutdownNow();
                }
            }
        } catch (InterruptedException e) {
            slots.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            pumps.shutdownNow();
        }
    }

    private static int maxRetries(Job job) {
        return job.retry() == null ? 0 : job.retry().maxRetries();
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    static String appendNote(String stderr, String note) {
        if (stderr == null || stderr.isEmpty()) return note;
        return stderr.endsWith("\n") ? stderr + note : stderr + "\n" + note;
    }

    /* ===================== 내부 상태 ===================== */

    private static final class Submission {
        final Job job;
        final Execution.TriggeredBy triggeredBy;
        final ExecutionHandle handle;
        volatile int retryCount;
        volatile boolean cancelled;
        volatile boolean waitingRetry;
        volatile Execution last;

        Submission(Job job, Execution.TriggeredBy triggeredBy) {
            this.job = job;
            this.triggeredBy = triggeredBy;
            this.handle = new ExecutionHandle(job.id(), triggeredBy, new CompletableFuture<>());
        }
    }

    /** 시도 1건의 상태. RUNNING 에서의 CAS 한 번이 결과를 정한다 */
    private static final class Attempt {
        final long executionId;
        final Submission submission;
        private final AtomicReference<Execution.Outcome> state = new AtomicReference<>(Execution.Outcome.RUNNING);
        private volatile Process process;
        volatile boolean mayBeAlive;

        Attempt(long executionId, Submission submission) {
            this.executionId = executionId;
            this.submission = submission;
        }

        boolean transition(Execution.Outcome to) {
            return state.compareAndSet(Execution.Outcome.RUNNING, to);
        }

        Execution.Outcome state() {
            return state.get();
        }

        void attach(Process p, Duration grace) {
            this.process = p;
            // attach 전에 취소가 들어온 경우
            if (state.get() == Execution.Outcome.CANCELLED) kill(grace);
        }

        boolean cancel(Duration grace) {
            submission.cancelled = true;
            if (!transition(Execution.Outcome.CANCELLED)) return false;
            log.info("Cancelling execution {} of job '{}'", executionId, submission.job.name());
            kill(grace);
            return true;
        }

        void kill(Duration grace) {
            Process p = process;
            if (p == null) return;
            if (!ProcessControl.terminate(p, grace)) {
                mayBeAlive = true;
                log.warn("Process {} of execution {} may still be alive after forced kill", p.pid(), executionId);
            }
        }
    }
}
