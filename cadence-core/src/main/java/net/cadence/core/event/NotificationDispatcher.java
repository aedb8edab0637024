package net.cadence.core.event;

import net.cadence.core.model.Execution;
import net.cadence.core.model.Job;
import net.cadence.core.spi.ExecutionRepository;
import net.cadence.core.spi.JobRepository;
import net.cadence.core.spi.NotificationTransport;
import net.cadence.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/** 최종 시도 결과를 잡의 알림 설정에 따라 전송 경계로 넘긴다 */
public final class NotificationDispatcher implements ExecutionListener {
    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);
    private static final int OUTPUT_EXCERPT_CHARS = 4000;
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final JobRepository jobs;
    private final ExecutionRepository executions;
    private final TxRunner tx;
    private final NotificationTransport transport;
    private final ZoneId zone;

    public NotificationDispatcher(JobRepository jobs,
                                  ExecutionRepository executions,
                                  TxRunner tx,
                                  NotificationTransport transport,
                                  ZoneId zone) {
        this.jobs = jobs;
        this.executions = executions;
        this.tx = tx;
        this.transport = transport;
        this.zone = zone;
    }

    @Override
    public void onExecutionFinished(ExecutionEvent event) {
        if (!event.finalAttempt()) return;
        try {
            Optional<Job> job = tx.required(() -> jobs.findById(event.jobId()));
            if (job.isEmpty() || !job.get().notification().wants(event.succeeded())) return;

            Optional<Execution> execution = tx.required(() -> executions.findById(event.executionId()));
            transport.send(compose(job.get(), event, execution.orElse(null)));
        } catch (Exception e) {
            log.warn("Notification for job '{}' failed: {}", event.jobName(), e.getMessage(), e);
        }
    }

    Notification compose(Job job, ExecutionEvent event, Execution execution) {
        String status = event.succeeded() ? "SUCCESS" : "FAILED";
        String subject = "Job " + job.name() + " " + status;
        StringBuilder body = new StringBuilder()
                .append("Job: ").append(job.name()).append('\n')
                .append("Status: ").append(status).append(" (").append(event.outcome().code()).append(")\n")
                .append("Attempt: ").append(event.retryCount() + 1).append('\n');
        if (event.exitCode() != null) body.append("Exit code: ").append(event.exitCode()).append('\n');
        if (execution != null && execution.endTime() != null) {
            body.append("Time: ").append(TIME.format(execution.endTime().atZone(zone))).append('\n');
        }
        if (execution != null) {
            body.append("\nOutput:\n").append(excerpt(execution.stdout()))
                .append("\n\nError Output:\n").append(excerpt(execution.stderr()));
        }
        return new Notification(job.notification().address(), subject, body.toString());
    }

    private static String excerpt(String s) {
        if (s == null) return "";
        return s.length() <= OUTPUT_EXCERPT_CHARS ? s : s.substring(s.length() - OUTPUT_EXCERPT_CHARS);
    }
}
