package net.cadence.core.process;

import net.cadence.core.config.EngineSettings;
import net.cadence.core.model.Job;
import net.cadence.core.model.JobKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** JobKind → 실행 인자 목록 변환 테이블 */
public final class ProcessCommands {

    @FunctionalInterface
    interface CommandBuilder {
        List<String> build(String command);
    }

    private final Map<JobKind, CommandBuilder> builders = new EnumMap<>(JobKind.class);

    public ProcessCommands(EngineSettings settings) {
        for (JobKind kind : JobKind.values()) {
            builders.put(kind, builderFor(kind, settings));
        }
    }

    private static CommandBuilder builderFor(JobKind kind, EngineSettings settings) {
        return switch (kind) {
            case SCRIPT_INTERPRETER -> command -> concat(tokenize(settings.scriptInterpreter()), tokenize(command));
            case SHELL -> ProcessCommands::shell;
            case SQL_TOOL -> settings.hasSqlTool()
                    ? command -> concat(tokenize(settings.sqlTool()), tokenize(command))
                    : ProcessCommands::shell;
        };
    }

    public List<String> commandFor(Job job) {
        return builders.get(job.kind()).build(job.command());
    }

    static List<String> shell(String command) {
        if (isWindows()) return List.of("cmd.exe", "/c", command);
        return List.of("sh", "-c", command);
    }

    private static boolean isWindows() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows");
    }

    private static List<String> concat(List<String> head, List<String> tail) {
        List<String> out = new ArrayList<>(head.size() + tail.size());
        out.addAll(head);
        out.addAll(tail);
        return Collections.unmodifiableList(out);
    }

    /** 공백 분리, 작은/큰따옴표 묶음 지원 (셸 확장 없음) */
    static List<String> tokenize(String s) {
        List<String> tokens = new ArrayList<>();
        if (s == null) return tokens;
        StringBuilder cur = new StringBuilder();
        boolean inToken = false;
        char quote = 0;
        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);
            if (quote != 0) {
                if (ch == quote) quote = 0;
                else cur.append(ch);
            } else if (ch == '"' || ch == '\'') {
                quote = ch;
                inToken = true;
            } else if (Character.isWhitespace(ch)) {
                if (inToken) {
                    tokens.add(cur.toString());
                    cur.setLength(0);
                    inToken = false;
                }
            } else {
                cur.append(ch);
                inToken = true;
            }
        }
        if (quote != 0) throw new IllegalArgumentException("unterminated quote in: " + s);
        if (inToken) tokens.add(cur.toString());
        return tokens;
    }
}
