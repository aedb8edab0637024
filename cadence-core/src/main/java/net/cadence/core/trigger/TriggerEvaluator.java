package net.cadence.core.trigger;

import net.cadence.core.model.Schedule;
import net.cadence.core.spi.CronCalculator;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;
import java.util.Optional;

/** 스케줄 기술자 + 기준 시각 → 다음 실행 시각. cron 계산은 {@link CronCalculator} 에 맡긴다 */
public final class TriggerEvaluator {
    private final ZoneId zone;
    private final CronCalculator cron;

    public TriggerEvaluator(ZoneId zone) {
        this(zone, new CronUtilsCalculator());
    }

    public TriggerEvaluator(ZoneId zone, CronCalculator cron) {
        this.zone = Objects.requireNonNull(zone);
        this.cron = Objects.requireNonNull(cron);
    }

    public ZoneId zone() { return zone; }

    /**
     * Manual → empty, Interval → from + minutes, Cron → from 이후 첫 일치 시각.
     *
     * @throws CronSyntaxException     cron 식 오류
     * @throws NoMatchingTimeException 탐색 한계 초과
     */
    public Optional<Instant> nextRun(Schedule schedule, Instant from) {
        Objects.requireNonNull(from);
        if (schedule instanceof Schedule.Interval i) {
            requirePositive(i);
            return Optional.of(from.plus(Duration.ofMinutes(i.minutes())));
        }
        if (schedule instanceof Schedule.Cron c) {
            return Optional.of(cron.next(from, c.expression(), zone));
        }
        return Optional.empty();
    }

    /**
     * 직전 예정 시각 기준 그리드에서 now 보다 뒤인 첫 슬롯. 다운타임으로 놓친 슬롯은 하나로 합쳐진다.
     * lastScheduled 가 null 이면 now 기준으로 계산한다.
     */
    public Optional<Instant> nextRunAfter(Schedule schedule, Instant lastScheduled, Instant now) {
        if (lastScheduled == null || lastScheduled.isAfter(now)) {
            return lastScheduled == null ? nextRun(schedule, now) : Optional.of(lastScheduled);
        }
        if (schedule instanceof Schedule.Interval i) {
            requirePositive(i);
            Duration step = Duration.ofMinutes(i.minutes());
            long behind = Duration.between(lastScheduled, now).toMillis();
            long slots = behind / step.toMillis() + 1;
            return Optional.of(lastScheduled.plus(step.multipliedBy(slots)));
        }
        return nextRun(schedule, now);
    }

    /** 스케줄 기술자 형식 검증 (cron 은 실제 다음 시각까지 계산) */
    public void validate(Schedule schedule, Instant from) {
        Objects.requireNonNull(schedule, "schedule");
        nextRun(schedule, from);
    }

    private static void requirePositive(Schedule.Interval i) {
        if (i.minutes() <= 0) {
            throw new IllegalArgumentException("interval minutes must be positive: " + i.minutes());
        }
    }
}
