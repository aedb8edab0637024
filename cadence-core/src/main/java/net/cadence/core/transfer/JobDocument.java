package net.cadence.core.transfer;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/** 잡 정의 교환 문서 (JSON). 파생 필드(lastRun/nextRun/lastStatus)는 포함하지 않는다 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record JobDocument(Integer version, String exportedAt, List<JobEntry> jobs) {

    public static final int CURRENT_VERSION = 1;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record JobEntry(
            String name,
            String description,
            String kind,
            String command,
            String workingDirectory,
            Map<String, String> environment,
            ScheduleEntry schedule,
            Boolean enabled,
            Integer maxRetries,
            Long retryDelaySeconds,
            Integer timeoutSeconds,
            NotificationEntry notification,
            List<String> dependsOn
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ScheduleEntry(String type, Integer intervalMinutes, String cronExpression) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record NotificationEntry(String address, Boolean onSuccess, Boolean onFailure) {}
}
