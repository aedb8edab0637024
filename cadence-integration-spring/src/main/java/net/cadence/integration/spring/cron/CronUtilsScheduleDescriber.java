package net.cadence.integration.spring.cron;

import com.cronutils.descriptor.CronDescriptor;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.parser.CronParser;
import net.cadence.core.model.Schedule;
import net.cadence.core.spi.ScheduleDescriber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/** cron-utils 기반 스케줄 설명 (목록/편집 화면용). 실행 시각 계산은 코어의 CronUtilsCalculator 가 한다 */
public final class CronUtilsScheduleDescriber implements ScheduleDescriber {
    private static final Logger log = LoggerFactory.getLogger(CronUtilsScheduleDescriber.class);

    private static final CronParser PARSER =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    private final CronDescriptor descriptor;

    // 간단 LRU(최대 256개)
    private final Map<String, String> cache = Collections.synchronizedMap(new LruMap<>(256));

    public CronUtilsScheduleDescriber() {
        this(Locale.ENGLISH);
    }

    public CronUtilsScheduleDescriber(Locale locale) {
        this.descriptor = CronDescriptor.instance(locale);
    }

    @Override
    public String describe(Schedule schedule) {
        if (schedule instanceof Schedule.Interval i) {
            return i.minutes() == 1 ? "every minute" : "every " + i.minutes() + " minutes";
        }
        if (schedule instanceof Schedule.Cron c) {
            return cache.computeIfAbsent(c.expression(), this::describeCron);
        }
        return "manual only";
    }

    private String describeCron(String expression) {
        try {
            return descriptor.describe(PARSER.parse(expression));
        } catch (IllegalArgumentException e) {
            // 설명을 만들 수 없는 표기는 원문 그대로
            log.debug("cron-utils could not describe [{}]: {}", expression, e.getMessage());
            return "cron " + expression;
        }
    }

    private static final class LruMap<K, V> extends LinkedHashMap<K, V> {
        private final int max;
        LruMap(int max) { super(16, 0.75f, true); this.max = max; }
        @Override protected boolean removeEldestEntry(Map.Entry<K, V> eldest) { return size() > max; }
    }
}
