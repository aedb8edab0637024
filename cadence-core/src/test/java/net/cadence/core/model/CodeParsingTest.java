package net.cadence.core.model;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.assertEquals;

class CodeParsingTest {

    private Locale saved;

    @BeforeEach
    void turkishDefaultLocale() {
        // 터키어 로캘에서는 "i".toUpperCase() 가 점 있는 İ 가 된다
        saved = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
    }

    @AfterEach
    void restoreLocale() {
        Locale.setDefault(saved);
    }

    @Test
    void lower_case_codes_parse_regardless_of_default_locale() {
        assertEquals(Schedule.Type.INTERVAL, Schedule.Type.from("interval"));
        assertEquals(JobKind.SCRIPT_INTERPRETER, JobKind.from("script-interpreter"));
        assertEquals(Execution.Outcome.TIMED_OUT, Execution.Outcome.from("timed_out"));
        assertEquals(Execution.TriggeredBy.DEPENDENCY, Execution.TriggeredBy.from("dependency"));
    }

    @Test
    void unknown_codes_fall_back_instead_of_failing() {
        assertEquals(Execution.Outcome.UNKNOWN, Execution.Outcome.from("exploded"));
        assertEquals(Schedule.Type.MANUAL, Schedule.Type.from(" "));
    }
}
