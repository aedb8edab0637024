package net.cadence.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

public record Execution(
        Long id,
        long jobId,
        Instant startTime,
        Instant endTime,        // RUNNING 동안 null
        Outcome outcome,
        Integer exitCode,       // FAILED 일 때만 의미 있음
        String stdout,
        String stderr,
        int retryCount,         // 0-based 시도 번호
        TriggeredBy triggeredBy,
        Long pid,
        boolean processMayBeAlive
) {
    public enum Outcome {
        RUNNING, SUCCESS, FAILED, TIMED_OUT, CANCELLED, UNKNOWN;

        public static Outcome from(String s) {
            if (s == null) return UNKNOWN;
            try { return Outcome.valueOf(s.toUpperCase(Locale.ROOT)); } catch (IllegalArgumentException e) { return UNKNOWN; }
        }
        public String code() { return name(); }

        public boolean isTerminal() { return this != RUNNING; }

        /** 재시도 정책 대상 */
        public boolean isRetryable() { return this == FAILED || this == TIMED_OUT; }
    }

    public enum TriggeredBy {
        SCHEDULE, MANUAL, DEPENDENCY, UNKNOWN;

        public static TriggeredBy from(String s) {
            if (s == null) return UNKNOWN;
            try { return TriggeredBy.valueOf(s.toUpperCase(Locale.ROOT)); } catch (IllegalArgumentException e) { return UNKNOWN; }
        }
        public String code() { return name(); }
    }

    public boolean isSealed() { return endTime != null; }

    public Duration duration() {
        if (startTime == null || endTime == null) return null;
        return Duration.between(startTime, endTime);
    }
}
