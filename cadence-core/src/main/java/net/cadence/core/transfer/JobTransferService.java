package net.cadence.core.transfer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import net.cadence.core.model.DependencyEdge;
import net.cadence.core.model.Job;
import net.cadence.core.model.JobDefinition;
import net.cadence.core.model.JobKind;
import net.cadence.core.model.NotificationPrefs;
import net.cadence.core.model.RetrySettings;
import net.cadence.core.model.Schedule;
import net.cadence.core.service.DefinitionException;
import net.cadence.core.service.DependencyGraph;
import net.cadence.core.service.JobCatalogService;
import net.cadence.core.spi.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/** 잡 정의 + 의존성 JSON 내보내기/가져오기 */
public final class JobTransferService {
    private static final Logger log = LoggerFactory.getLogger(JobTransferService.class);

    private final JobCatalogService catalog;
    private final Clock clock;
    private final ObjectMapper mapper;

    public JobTransferService(JobCatalogService catalog, Clock clock) {
        this(catalog, clock, defaultMapper());
    }

    public JobTransferService(JobCatalogService catalog, Clock clock, ObjectMapper mapper) {
        this.catalog = catalog;
        this.clock = clock;
        this.mapper = mapper;
    }

    static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /* ===================== export ===================== */

    /** 의존 대상이 먼저 나오도록 정렬해 내보낸다 */
    public String exportJobs() throws Exception {
        List<Job> all = catalog.listJobs();
        List<DependencyEdge> edges = catalog.dependencyGraph();
        Map<Long, Job> byId = all.stream().collect(Collectors.toMap(Job::id, Function.identity()));
        DependencyGraph graph = DependencyGraph.of(edges);

        List<JobDocument.JobEntry> entries = new ArrayList<>();
        for (Long id : graph.topologicalOrder(all.stream().map(Job::id).collect(Collectors.toList()))) {
            Job job = byId.get(id);
            List<String> dependsOn = edges.stream()
                    .filter(e -> e.jobId() == id)
                    .map(e -> byId.get(e.dependsOnJobId()).name())
                    .sorted()
                    .collect(Collectors.toList());
            entries.add(toEntry(job, dependsOn));
        }
        JobDocument doc = new JobDocument(JobDocument.CURRENT_VERSION, clock.now().toString(), entries);
        log.info("Exported {} job(s)", entries.size());
        return mapper.writeValueAsString(doc);
    }

    static JobDocument.JobEntry toEntry(Job job, List<String> dependsOn) {
        Schedule s = job.schedule();
        JobDocument.ScheduleEntry schedule = new JobDocument.ScheduleEntry(s.type().code(),
                s instanceof Schedule.Interval i ? i.minutes() : null,
                s instanceof Schedule.Cron c ? c.expression() : null);
        NotificationPrefs n = job.notification();
        JobDocument.NotificationEntry notification = n.hasAddress()
                ? new JobDocument.NotificationEntry(n.address(), n.notifyOnSuccess(), n.notifyOnFailure())
                : null;
        RetrySettings retry = job.retry() == null ? RetrySettings.none() : job.retry();
        return new JobDocument.JobEntry(job.name(), job.description(), job.kind().code(), job.command(),
                job.workingDirectory(), job.environment(), schedule, job.enabled(), retry.maxRetries(),
                retry.retryDelaySeconds(), job.timeoutSeconds(), notification, dependsOn);
    }

    /* ===================== import ===================== */

    /**
     * 문서 전체를 검증한 뒤 한 트랜잭션으로 등록한다. 중복 이름, 알 수 없는 의존 대상, 순환이
     * 하나라도 있으면 아무것도 등록하지 않는다.
     */
    public List<Job> importJobs(String json) throws Exception {
        JobDocument doc;
        try {
            doc = mapper.readValue(json, JobDocument.class);
        } catch (JsonProcessingException e) {
            throw new DefinitionException("document", "malformed job document: " + e.getOriginalMessage(), e);
        }
        if (doc == null || doc.jobs() == null) throw new DefinitionException("jobs", "job list is missing");
        if (doc.version() != null && doc.version() > JobDocument.CURRENT_VERSION) {
            throw new DefinitionException("version", "unsupported document version " + doc.version());
        }

        List<JobDefinition> defs = new ArrayList<>();
        List<List<String>> dependsOn = new ArrayList<>();
        for (int i = 0; i < doc.jobs().size(); i++) {
            JobDocument.JobEntry entry = doc.jobs().get(i);
            String p = "jobs[" + i + "].";
            if (entry == null) throw new DefinitionException("jobs[" + i + "]", "entry is empty");
            defs.add(toDefinition(entry, p));
            dependsOn.add(entry.dependsOn() == null ? List.of() : entry.dependsOn());
        }
        List<Job> created = catalog.createAll(defs, dependsOn);
        log.info("Imported {} job(s)", created.size());
        return created;
    }

    static JobDefinition toDefinition(JobDocument.JobEntry e, String p) {
        JobKind kind;
        try {
            kind = JobKind.from(e.kind());
        } catch (IllegalArgumentException ex) {
            throw new DefinitionException(p + "kind", "unknown job kind '" + e.kind() + "'", ex);
        }
        Schedule schedule = toSchedule(e.schedule(), p);
        RetrySettings retry = null;
        if (e.maxRetries() != null || e.retryDelaySeconds() != null) {
            RetrySettings base = RetrySettings.none();
            retry = new RetrySettings(
                    e.maxRetries() == null ? base.maxRetries() : e.maxRetries(),
                    e.retryDelaySeconds() == null ? base.retryDelaySeconds() : e.retryDelaySeconds());
        }
        NotificationPrefs notification = null;
        if (e.notification() != null) {
            JobDocument.NotificationEntry n = e.notification();
            notification = new NotificationPrefs(n.address(),
                    Boolean.TRUE.equals(n.onSuccess()),
                    n.onFailure() == null || n.onFailure());
        }
        Map<String, String> env = e.environment() == null ? Map.of() : new HashMap<>(e.environment());
        for (Map.Entry<String, String> var : env.entrySet()) {
            if (var.getValue() == null) {
                throw new DefinitionException(p + "environment", "variable '" + var.getKey() + "' has no value");
            }
        }
        return new JobDefinition(e.name(), e.description(), kind, e.command(), e.workingDirectory(), env,
                schedule, e.enabled() == null || e.enabled(), retry, e.timeoutSeconds(), notification);
    }

    private static Schedule toSchedule(JobDocument.ScheduleEntry s, String p) {
        if (s == null) return Schedule.manual();
        Schedule.Type type;
        try {
            type = Schedule.Type.from(s.type());
        } catch (IllegalArgumentException ex) {
            throw new DefinitionException(p + "schedule.type", "unknown schedule type '" + s.type() + "'", ex);
        }
        switch (type) {
            case INTERVAL:
                if (s.intervalMinutes() == null) {
                    throw new DefinitionException(p + "schedule.intervalMinutes", "interval minutes are required");
                }
                return Schedule.interval(s.intervalMinutes());
            case CRON:
                return Schedule.cron(s.cronExpression());
            default:
                return Schedule.manual();
        }
    }
}
