package net.cadence.core.service;

import net.cadence.core.model.RetrySettings;

import java.time.Duration;

/** 실패 후 다음 시도까지 기다릴 시간 */
@FunctionalInterface
public interface RetryPolicy {
    /** @param retry 1부터 시작하는 재시도 번호 */
    Duration nextBackoff(int retry);

    /** 고정 백오프 정책 */
    static RetryPolicy fixed(Duration backoff) {
        return retry -> backoff;
    }

    /** 잡 재시도: 설정된 간격 고정 */
    static RetryPolicy of(RetrySettings settings) {
        return fixed(settings.retryDelay());
    }

    /** 저장소 쓰기 재시도: initial, 2x, 4x ... */
    static RetryPolicy doubling(Duration initial) {
        return retry -> initial.multipliedBy(1L << Math.min(Math.max(retry - 1, 0), 16));
    }
}
