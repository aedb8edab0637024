package net.cadence.core.model;

import java.time.Instant;

/** RUNNING → 종료 결과 전이에 필요한 값 묶음 */
public record ExecutionSeal(
        Execution.Outcome outcome,
        Integer exitCode,
        Instant endTime,
        String stdout,
        String stderr,
        boolean processMayBeAlive
) {
    public ExecutionSeal {
        if (outcome == null || !outcome.isTerminal()) {
            throw new IllegalArgumentException("seal requires a terminal outcome: " + outcome);
        }
    }
}
