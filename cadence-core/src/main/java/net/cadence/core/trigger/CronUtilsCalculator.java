package net.cadence.core.trigger;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import net.cadence.core.spi.CronCalculator;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * cron-utils(UNIX 5필드) 기반 계산기.
 * day-of-month 와 day-of-week 가 모두 제한되면 OR 로 평가된다.
 */
public final class CronUtilsCalculator implements CronCalculator {
    public static final int SEARCH_HORIZON_YEARS = 4;

    static final String[] FIELD_NAMES = {"minute", "hour", "day-of-month", "month", "day-of-week"};

    private static final CronParser PARSER =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    // 간단 LRU(최대 256개)
    private final Map<String, ExecutionTime> cache = new LruMap<>(256);

    @Override
    public Instant next(Instant from, String cronExpr, ZoneId zone) {
        Objects.requireNonNull(from);
        Objects.requireNonNull(zone);
        ExecutionTime et = compile(cronExpr);
        ZonedDateTime base = from.atZone(zone);
        Optional<ZonedDateTime> next = et.nextExecution(base);
        if (next.isEmpty() || next.get().isAfter(base.plusYears(SEARCH_HORIZON_YEARS))) {
            throw new NoMatchingTimeException(cronExpr, from);
        }
        return next.get().toInstant();
    }

    /** 파싱 결과는 정규화된 식 기준으로 캐시된다 */
    ExecutionTime compile(String cronExpr) {
        String key = normalize(cronExpr);
        synchronized (cache) {
            ExecutionTime cached = cache.get(key);
            if (cached != null) return cached;
        }
        ExecutionTime parsed = ExecutionTime.forCron(parse(cronExpr, key));
        synchronized (cache) {
            cache.put(key, parsed);
        }
        return parsed;
    }

    private static Cron parse(String original, String normalized) {
        if (normalized.isEmpty()) throw new CronSyntaxException(original, null, "expression is empty");
        String[] parts = normalized.split(" ");
        if (parts.length != FIELD_NAMES.length) {
            throw new CronSyntaxException(original, null,
                    "expected " + FIELD_NAMES.length + " fields but found " + parts.length);
        }
        try {
            return PARSER.parse(normalized);
        } catch (IllegalArgumentException e) {
            throw new CronSyntaxException(original, offendingField(parts), e.getMessage());
        }
    }

    /** 한 필드만 * 로 바꿔 파싱이 통과하면 그 필드가 원인. 여럿이 틀리면 null */
    private static String offendingField(String[] parts) {
        for (int i = 0; i < parts.length; i++) {
            if ("*".equals(parts[i])) continue;
            String[] masked = parts.clone();
            masked[i] = "*";
            if (parses(String.join(" ", masked))) return FIELD_NAMES[i];
        }
        return null;
    }

    private static boolean parses(String expression) {
        try {
            PARSER.parse(expression);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static String normalize(String cronExpr) {
        return cronExpr == null ? "" : cronExpr.trim().replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
    }

    // --- 내부 LRU ---
    private static final class LruMap<K, V> extends LinkedHashMap<K, V> {
        private final int max;

        LruMap(int max) {
            super(16, 0.75f, true);
            this.max = max;
        }

        @Override
        protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
            return size() > max;
        }
    }
}
