package net.cadence.core.model;

import java.util.Locale;

/**
 * 잡 트리거 기술자: Manual | Interval | Cron.
 * 유효성(분 > 0, cron 문법)은 TriggerEvaluator / JobCatalogService 에서 검증한다.
 */
public sealed interface Schedule permits Schedule.Manual, Schedule.Interval, Schedule.Cron {

    Type type();

    enum Type {
        MANUAL, INTERVAL, CRON;

        public static Type from(String s) {
            if (s == null || s.isBlank()) return MANUAL;
            return Type.valueOf(s.trim().toUpperCase(Locale.ROOT));
        }
        public String code() { return name(); }
    }

    record Manual() implements Schedule {
        @Override public Type type() { return Type.MANUAL; }
    }

    record Interval(int minutes) implements Schedule {
        @Override public Type type() { return Type.INTERVAL; }
    }

    record Cron(String expression) implements Schedule {
        @Override public Type type() { return Type.CRON; }
    }

    static Schedule manual() { return new Manual(); }
    static Schedule interval(int minutes) { return new Interval(minutes); }
    static Schedule cron(String expression) { return new Cron(expression); }
}
