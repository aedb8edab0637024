package net.cadence.core.service;

import net.cadence.core.model.DependencyEdge;
import net.cadence.core.model.Job;
import net.cadence.core.model.JobDefinition;
import net.cadence.core.model.RetrySettings;
import net.cadence.core.model.Schedule;
import net.cadence.core.spi.Clock;
import net.cadence.core.spi.JobDependencyRepository;
import net.cadence.core.spi.JobRepository;
import net.cadence.core.spi.TxRunner;
import net.cadence.core.trigger.CronSyntaxException;
import net.cadence.core.trigger.NoMatchingTimeException;
import net.cadence.core.trigger.TriggerEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 잡 정의와 의존성 그래프 편집. 모든 변경은 검증을 통과한 뒤에만 저장되며,
 * 그래프 변경은 하나의 락으로 직렬화되어 순환 검사와 저장 사이에 끼어드는 변경이 없다.
 */
public final class JobCatalogService {
    private static final Logger log = LoggerFactory.getLogger(JobCatalogService.class);

    // 저장소 컬럼 길이와 맞춘다
    static final int MAX_NAME_LENGTH = 200;
    static final int MAX_DESCRIPTION_LENGTH = 2000;
    static final int MAX_COMMAND_LENGTH = 8000;
    static final int MAX_WORKING_DIRECTORY_LENGTH = 1024;
    static final int MAX_CRON_LENGTH = 200;
    static final int MAX_ADDRESS_LENGTH = 320;

    private final JobRepository jobs;
    private final JobDependencyRepository deps;
    private final TxRunner tx;
    private final Clock clock;
    private final TriggerEvaluator triggers;
    private final ReentrantLock graphLock = new ReentrantLock();
    private volatile RetrySettings defaultRetry;

    public JobCatalogService(JobRepository jobs,
                             JobDependencyRepository deps,
                             TxRunner tx,
                             Clock clock,
                             TriggerEvaluator triggers,
                             RetrySettings defaultRetry) {
        this.jobs = jobs;
        this.deps = deps;
        this.tx = tx;
        this.clock = clock;
        this.triggers = triggers;
        this.defaultRetry = Objects.requireNonNull(defaultRetry);
    }

    public void setDefaultRetry(RetrySettings defaultRetry) {
        this.defaultRetry = Objects.requireNonNull(defaultRetry);
    }

    /* ===================== 잡 정의 ===================== */

    public Job create(JobDefinition def) throws Exception {
        validate(def, "");
        RetrySettings retry = resolveRetry(def);
        Instant next = initialNextRun(def.schedule());
        Job created = tx.required(() -> {
            if (jobs.findByName(def.name()).isPresent()) {
                throw new DefinitionException("name", "a job named '" + def.name() + "' already exists");
            }
            return jobs.insert(Job.ofNew(def, retry, next));
        });
        log.info("Created job '{}' (id={}, schedule={})", created.name(), created.id(), created.schedule());
        return created;
    }

    /** 정의 교체. 스케줄이 바뀐 경우에만 nextRun 을 다시 계산한다 */
    public Job update(long id, JobDefinition def) throws Exception {
        validate(def, "");
        RetrySettings retry = resolveRetry(def);
        Job updated = tx.required(() -> {
            Job existing = jobs.findById(id).orElseThrow(() -> notFound(id));
            var clash = jobs.findByName(def.name());
            if (clash.isPresent() && !clash.get().id().equals(id)) {
                throw new DefinitionException("name", "a job named '" + def.name() + "' already exists");
            }
            Instant next = def.schedule().equals(existing.schedule()) && existing.nextRun() != null
                    ? existing.nextRun()
                    : initialNextRun(def.schedule());
            Job job = existing.redefine(def, retry, next);
            jobs.update(job);
            return jobs.findById(id).orElse(job);
        });
        log.info("Updated job '{}' (id={})", updated.name(), id);
        return updated;
    }

    /** 잡과 양방향 의존 엣지, 실행 이력을 함께 삭제 */
    public boolean delete(long id) throws Exception {
        graphLock.lock();
        try {
            boolean deleted = tx.required(() -> {
                deps.removeAllFor(id);
                return jobs.delete(id);
            });
            if (deleted) log.info("Deleted job {}", id);
            return deleted;
        } finally {
            graphLock.unlock();
        }
    }

    public void setEnabled(long id, boolean enabled) throws Exception {
        tx.required(() -> {
            Job job = jobs.findById(id).orElseThrow(() -> notFound(id));
            jobs.setEnabled(id, enabled);
            // 다시 켤 때는 꺼져 있던 동안의 슬롯을 따라잡지 않는다
            if (enabled && !job.enabled()) jobs.updateNextRun(id, initialNextRun(job.schedule()));
            return null;
        });
        log.info("Job {} {}", id, enabled ? "enabled" : "disabled");
    }

    public List<Job> listJobs() throws Exception {
        return tx.required(jobs::findAll);
    }

    public Job getJob(long id) throws Exception {
        return tx.required(() -> jobs.findById(id)).orElseThrow(() -> notFound(id));
    }

    public Job getJob(String name) throws Exception {
        return tx.required(() -> jobs.findByName(name))
                .orElseThrow(() -> new NoSuchElementException("no job named '" + name + "'"));
    }

    /* ===================== 의존성 ===================== */

    public void addDependency(long jobId, long dependsOnJobId) throws Exception {
        graphLock.lock();
        try {
            tx.required(() -> {
                requireJob(jobId, "jobId");
                requireJob(dependsOnJobId, "dependsOn");
                DependencyGraph graph = DependencyGraph.of(deps.findAll());
                if (graph.contains(jobId, dependsOnJobId)) return null;
                checkEdge(graph, jobId, dependsOnJobId, "dependsOn");
                deps.add(jobId, dependsOnJobId);
                return null;
            });
        } finally {
            graphLock.unlock();
        }
        log.info("Job {} now depends on job {}", jobId, dependsOnJobId);
    }

    public boolean removeDependency(long jobId, long dependsOnJobId) throws Exception {
        graphLock.lock();
        try {
            return tx.required(() -> deps.remove(jobId, dependsOnJobId));
        } finally {
            graphLock.unlock();
        }
    }

    /** jobId 의 의존 대상 전체 교체. 하나라도 순환이면 아무것도 바꾸지 않는다 */
    public void setDependencies(long jobId, Collection<Long> dependsOn) throws Exception {
        Set<Long> wanted = new LinkedHashSet<>(dependsOn);
        graphLock.lock();
        try {
            tx.required(() -> {
                requireJob(jobId, "jobId");
                DependencyGraph graph = DependencyGraph.of(deps.findAll());
                graph.removeAllFrom(jobId);
                for (Long dep : wanted) {
                    requireJob(dep, "dependsOn");
                    checkEdge(graph, jobId, dep, "dependsOn");
                    graph.add(jobId, dep);
                }
                for (Long old : deps.findDependencies(jobId)) {
                    if (!wanted.contains(old)) deps.remove(jobId, old);
                }
                Set<Long> existing = new LinkedHashSet<>(deps.findDependencies(jobId));
                for (Long dep : wanted) {
                    if (!existing.contains(dep)) deps.add(jobId, dep);
                }
                return null;
            });
        } finally {
            graphLock.unlock();
        }
    }

    public List<Long> dependenciesOf(long jobId) throws Exception {
        return tx.required(() -> deps.findDependencies(jobId));
    }

    public List<DependencyEdge> dependencyGraph() throws Exception {
        return tx.required(deps::findAll);
    }

    /* ===================== 일괄 등록 (임포트) ===================== */

    /**
     * 정의 묶음을 원자적으로 등록한다. dependsOn.get(i) 는 defs.get(i) 의 의존 대상 이름 목록이며
     * 묶음 안의 잡이나 이미 등록된 잡을 가리킬 수 있다. 검증 오류는 "jobs[i].field" 경로로 보고하고
     * 하나라도 실패하면 아무것도 저장하지 않는다.
     */
    public List<Job> createAll(List<JobDefinition> defs, List<List<String>> dependsOn) throws Exception {
        if (defs.size() != dependsOn.size()) throw new IllegalArgumentException("defs/dependsOn size mismatch");
        Map<String, Integer> indexByName = new HashMap<>();
        for (int i = 0; i < defs.size(); i++) {
            String p = "jobs[" + i + "].";
            validate(defs.get(i), p);
            if (indexByName.putIfAbsent(defs.get(i).name(), i) != null) {
                throw new DefinitionException(p + "name", "duplicate name '" + defs.get(i).name() + "' in batch");
            }
        }

        graphLock.lock();
        try {
            List<Job> created = tx.required(() -> {
                // 1) 이름 → ID. 묶음 안의 잡은 저장 전이므로 음수 임시 ID
                Map<String, Long> idByName = new HashMap<>();
                for (int i = 0; i < defs.size(); i++) {
                    if (jobs.findByName(defs.get(i).name()).isPresent()) {
                        throw new DefinitionException("jobs[" + i + "].name",
                                "a job named '" + defs.get(i).name() + "' already exists");
                    }
                    idByName.put(defs.get(i).name(), -(i + 1L));
                }
                // 2) 저장 전에 전체 엣지 검증
                DependencyGraph graph = DependencyGraph.of(deps.findAll());
                List<long[]> edges = new ArrayList<>();
                for (int i = 0; i < defs.size(); i++) {
                    String field = "jobs[" + i + "].dependsOn";
                    long self = idByName.get(defs.get(i).name());
                    for (String depName : dependsOn.get(i)) {
                        Long dep = idByName.get(depName);
                        if (dep == null) {
                            dep = jobs.findByName(depName).map(Job::id).orElseThrow(() ->
                                    new DefinitionException(field, "unknown job '" + depName + "'"));
                        }
                        if (graph.contains(self, dep)) continue;
                        checkEdge(graph, self, dep, field);
                        graph.add(self, dep);
                        edges.add(new long[]{self, dep});
                    }
                }
                // 3) 저장
                Map<Long, Long> realId = new HashMap<>();
                List<Job> out = new ArrayList<>();
                Instant now = clock.now();
                for (int i = 0; i < defs.size(); i++) {
                    JobDefinition def = defs.get(i);
                    Instant next = triggers.nextRun(def.schedule(), now).orElse(null);
                    Job job = jobs.insert(Job.ofNew(def, resolveRetry(def), next));
                    realId.put(-(i + 1L), job.id());
                    out.add(job);
                }
                for (long[] e : edges) {
                    deps.add(realId.getOrDefault(e[0], e[0]), realId.getOrDefault(e[1], e[1]));
                }
                return out;
            });
            log.info("Registered {} job(s) in one batch", created.size());
            return created;
        } finally {
            graphLock.unlock();
        }
    }

    /* ===================== 검증 ===================== */

    /** 정의 검증. 실패 시 prefix 가 붙은 필드 경로와 함께 DefinitionException */
    public void validate(JobDefinition def, String prefix) {
        if (def == null) throw new DefinitionException(prefix.isEmpty() ? "job" : prefix + "job", "definition is required");
        String name = def.name();
        if (name == null || name.isBlank()) throw new DefinitionException(prefix + "name", "name is required");
        if (!name.equals(name.strip())) {
            throw new DefinitionException(prefix + "name", "name must not start or end with whitespace");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw new DefinitionException(prefix + "name", "name is longer than " + MAX_NAME_LENGTH + " characters");
        }
        requireMaxLength(def.description(), MAX_DESCRIPTION_LENGTH, prefix + "description");
        if (def.kind() == null) throw new DefinitionException(prefix + "kind", "job kind is required");
        if (def.command() == null || def.command().isBlank()) {
            throw new DefinitionException(prefix + "command", "command is required");
        }
        requireMaxLength(def.command(), MAX_COMMAND_LENGTH, prefix + "command");
        requireMaxLength(def.workingDirectory(), MAX_WORKING_DIRECTORY_LENGTH, prefix + "workingDirectory");
        for (String key : def.environment().keySet()) {
            if (key == null || key.isBlank() || key.contains("=")) {
                throw new DefinitionException(prefix + "environment", "invalid variable name '" + key + "'");
            }
        }
        validateSchedule(def.schedule(), prefix);

        RetrySettings retry = def.retry();
        if (retry != null) {
            if (retry.maxRetries() < 0 || retry.maxRetries() > RetrySettings.MAX_RETRIES_LIMIT) {
                throw new DefinitionException(prefix + "retry.maxRetries",
                        "must be between 0 and " + RetrySettings.MAX_RETRIES_LIMIT);
            }
            if (retry.retryDelaySeconds() < 0 || retry.retryDelaySeconds() > RetrySettings.MAX_RETRY_DELAY_SECONDS) {
                throw new DefinitionException(prefix + "retry.retryDelaySeconds",
                        "must be between 0 and " + RetrySettings.MAX_RETRY_DELAY_SECONDS + " seconds");
            }
        }
        if (def.timeoutSeconds() != null && def.timeoutSeconds() <= 0) {
            throw new DefinitionException(prefix + "timeoutSeconds", "must be a positive number of seconds");
        }
        String address = def.notification().address();
        if (address != null && !address.isBlank() && !address.contains("@")) {
            throw new DefinitionException(prefix + "notification.address", "not an e-mail address: " + address);
        }
        requireMaxLength(address, MAX_ADDRESS_LENGTH, prefix + "notification.address");
    }

    private static void requireMaxLength(String value, int max, String field) {
        if (value != null && value.length() > max) {
            throw new DefinitionException(field, "longer than " + max + " characters");
        }
    }

    private void validateSchedule(Schedule schedule, String prefix) {
        if (schedule instanceof Schedule.Interval i && i.minutes() <= 0) {
            throw new DefinitionException(prefix + "schedule.intervalMinutes", "must be a positive number of minutes");
        }
        if (schedule instanceof Schedule.Cron c) {
            if (c.expression() == null || c.expression().isBlank()) {
                throw new DefinitionException(prefix + "schedule.expression", "cron expression is required");
            }
            requireMaxLength(c.expression(), MAX_CRON_LENGTH, prefix + "schedule.expression");
            try {
                triggers.validate(schedule, clock.now());
            } catch (CronSyntaxException e) {
                throw new DefinitionException(prefix + "schedule.expression", e.getMessage(), e);
            } catch (NoMatchingTimeException e) {
                throw new DefinitionException(prefix + "schedule.expression",
                        "expression never matches: " + c.expression(), e);
            }
        }
    }

    private RetrySettings resolveRetry(JobDefinition def) {
        return def.retry() == null ? defaultRetry : def.retry();
    }

    private Instant initialNextRun(Schedule schedule) {
        return triggers.nextRun(schedule, clock.now()).orElse(null);
    }

    private void requireJob(long id, String field) throws Exception {
        if (jobs.findById(id).isEmpty()) throw new DefinitionException(field, "unknown job id " + id);
    }

    private static void checkEdge(DependencyGraph graph, long jobId, long dependsOnJobId, String field) {
        if (jobId == dependsOnJobId) {
            throw new CyclicDependencyException(field, "a job cannot depend on itself");
        }
        if (graph.wouldCreateCycle(jobId, dependsOnJobId)) {
            throw new CyclicDependencyException(field,
                    "dependency " + describe(jobId) + " -> " + describe(dependsOnJobId) + " would create a cycle");
        }
    }

    private static String describe(long id) {
        return id < 0 ? "#" + (-id - 1) + " in batch" : "job " + id;
    }

    private static NoSuchElementException notFound(long id) {
        return new NoSuchElementException("job " + id + " not found");
    }
}
