package net.cadence.core.event;

import net.cadence.core.model.Execution;

/** 완료 기록을 재시도 후에도 저장하지 못함 (저장소 무결성 경고) */
public record StoreFault(
        long jobId,
        Long executionId,
        Execution.Outcome attemptedOutcome,
        String message
) {}
