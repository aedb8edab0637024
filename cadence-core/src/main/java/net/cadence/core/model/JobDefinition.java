package net.cadence.core.model;

import java.util.Map;

/** 편집기/임포트가 넘겨주는 잡 정의 (파생 필드 없음) */
public record JobDefinition(
        String name,
        String description,
        JobKind kind,
        String command,
        String workingDirectory,
        Map<String, String> environment,
        Schedule schedule,
        boolean enabled,
        RetrySettings retry,          // null = 엔진 기본 재시도 정책
        Integer timeoutSeconds,       // null = 무제한
        NotificationPrefs notification
) {
    public JobDefinition {
        environment = environment == null ? Map.of() : Map.copyOf(environment);
        schedule = schedule == null ? Schedule.manual() : schedule;
        notification = notification == null ? NotificationPrefs.none() : notification;
    }

    public static JobDefinition shell(String name, String command, Schedule schedule) {
        return new JobDefinition(name, null, JobKind.SHELL, command, null, Map.of(), schedule,
                true, null, null, null);
    }

    public JobDefinition withRetry(RetrySettings retry) {
        return new JobDefinition(name, description, kind, command, workingDirectory, environment, schedule,
                enabled, retry, timeoutSeconds, notification);
    }

    public JobDefinition withTimeoutSeconds(Integer timeoutSeconds) {
        return new JobDefinition(name, description, kind, command, workingDirectory, environment, schedule,
                enabled, retry, timeoutSeconds, notification);
    }

    public JobDefinition withEnvironment(Map<String, String> environment) {
        return new JobDefinition(name, description, kind, command, workingDirectory, environment, schedule,
                enabled, retry, timeoutSeconds, notification);
    }

    public JobDefinition withWorkingDirectory(String workingDirectory) {
        return new JobDefinition(name, description, kind, command, workingDirectory, environment, schedule,
                enabled, retry, timeoutSeconds, notification);
    }

    public JobDefinition withNotification(NotificationPrefs notification) {
        return new JobDefinition(name, description, kind, command, workingDirectory, environment, schedule,
                enabled, retry, timeoutSeconds, notification);
    }

    public JobDefinition withEnabled(boolean enabled) {
        return new JobDefinition(name, description, kind, command, workingDirectory, environment, schedule,
                enabled, retry, timeoutSeconds, notification);
    }
}
