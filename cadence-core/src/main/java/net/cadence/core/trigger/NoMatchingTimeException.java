package net.cadence.core.trigger;

import java.time.Instant;

/** 탐색 한계(4년) 안에 일치하는 시각이 없음 */
public class NoMatchingTimeException extends IllegalStateException {
    private final String expression;

    public NoMatchingTimeException(String expression, Instant from) {
        super("No execution time for [" + expression + "] within "
                + CronUtilsCalculator.SEARCH_HORIZON_YEARS + " years after " + from);
        this.expression = expression;
    }

    public String expression() { return expression; }
}
