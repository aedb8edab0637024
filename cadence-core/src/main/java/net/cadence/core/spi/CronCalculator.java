package net.cadence.core.spi;

import java.time.Instant;
import java.time.ZoneId;

/**
 * cron 식 → 다음 실행 시각.
 * 구현체는 형식 오류에 {@code CronSyntaxException}, 탐색 한계 초과에 {@code NoMatchingTimeException} 을 던진다.
 */
public interface CronCalculator {
    /** from 보다 엄격히 뒤인 첫 일치 시각 (zone 의 벽시계 기준) */
    Instant next(Instant from, String cronExpr, ZoneId zone);
}
