package net.cadence.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

public record Job(
        Long id,
        String name,
        String description,
        JobKind kind,
        String command,
        String workingDirectory,
        Map<String, String> environment,
        Schedule schedule,
        boolean enabled,
        RetrySettings retry,
        Integer timeoutSeconds,
        NotificationPrefs notification,
        Instant lastRun,
        Instant nextRun,
        Execution.Outcome lastStatus,   // null = 아직 실행 이력 없음
        Instant createdAt,
        Instant updatedAt
) {
    public Job {
        environment = environment == null ? Map.of() : Map.copyOf(environment);
    }

    public static Job ofNew(JobDefinition def, RetrySettings retry, Instant nextRun) {
        return new Job(null, def.name(), def.description(), def.kind(), def.command(), def.workingDirectory(),
                def.environment(), def.schedule(), def.enabled(), retry, def.timeoutSeconds(),
                def.notification(), null, nextRun, null, null, null);
    }

    /** 정의 필드만 교체 (id / 파생 필드 유지) */
    public Job redefine(JobDefinition def, RetrySettings retry, Instant nextRun) {
        return new Job(id, def.name(), def.description(), def.kind(), def.command(), def.workingDirectory(),
                def.environment(), def.schedule(), def.enabled(), retry, def.timeoutSeconds(),
                def.notification(), lastRun, nextRun, lastStatus, createdAt, updatedAt);
    }

    public JobDefinition definition() {
        return new JobDefinition(name, description, kind, command, workingDirectory, environment, schedule,
                enabled, retry, timeoutSeconds, notification);
    }

    public Duration timeout() {
        return timeoutSeconds == null ? null : Duration.ofSeconds(timeoutSeconds);
    }
}
