package net.cadence.core.model;

import java.util.Locale;

/** 명령 문자열을 어떻게 실행할지 결정하는 잡 종류 */
public enum JobKind {
    SCRIPT_INTERPRETER, SHELL, SQL_TOOL;

    public static JobKind from(String s) {
        if (s == null) throw new IllegalArgumentException("job kind is required");
        return JobKind.valueOf(s.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
    public String code() { return name(); }
}
