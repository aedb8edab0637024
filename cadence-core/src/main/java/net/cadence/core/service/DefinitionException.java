package net.cadence.core.service;

/** 잡 정의/의존성 검증 실패. field 는 문제가 된 입력 경로 (예: "schedule.expression", "jobs[2].name") */
public class DefinitionException extends IllegalArgumentException {
    private final String field;

    public DefinitionException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }

    public DefinitionException(String field, String message, Throwable cause) {
        super(field + ": " + message, cause);
        this.field = field;
    }

    public String field() {
        return field;
    }
}
