package net.cadence.core.event;

import net.cadence.core.model.Execution;

import java.time.Duration;

/** 시도 1건의 종료 통지 */
public record ExecutionEvent(
        long jobId,
        String jobName,
        long executionId,
        Execution.Outcome outcome,
        Integer exitCode,
        int retryCount,
        Duration duration,
        boolean finalAttempt
) {
    public boolean succeeded() { return outcome == Execution.Outcome.SUCCESS; }
}
