package net.cadence.core.trigger;

/** 5필드 cron 식 파싱 실패. field 는 문제 필드 이름 (전체 식 문제면 null) */
public class CronSyntaxException extends IllegalArgumentException {
    private final String expression;
    private final String field;

    public CronSyntaxException(String expression, String field, String message) {
        super(field == null
                ? "Invalid cron expression [" + expression + "]: " + message
                : "Invalid cron expression [" + expression + "], field " + field + ": " + message);
        this.expression = expression;
        this.field = field;
    }

    public String expression() { return expression; }
    public String field() { return field; }
}
