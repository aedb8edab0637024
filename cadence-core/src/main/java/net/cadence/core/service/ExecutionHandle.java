package net.cadence.core.service;

import net.cadence.core.model.Execution;

import java.util.concurrent.CompletableFuture;

/**
 * 제출된 잡 실행 한 건. completion 은 재시도를 포함한 마지막 시도가 봉인되면 완료되고,
 * 시작 전에 엔진이 멈추면 취소된다.
 */
public record ExecutionHandle(long jobId, Execution.TriggeredBy triggeredBy, CompletableFuture<Execution> completion) {
}
