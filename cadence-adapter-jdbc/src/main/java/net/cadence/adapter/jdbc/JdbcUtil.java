package net.cadence.adapter.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.TreeMap;

public final class JdbcUtil {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<TreeMap<String, String>> ENV_TYPE = new TypeReference<>() {};

    private JdbcUtil() {}

    // TIMESTAMP WITH TIME ZONE 컬럼 ↔ Instant (JVM 기본 타임존 영향 없음)
    public static void setInstant(PreparedStatement ps, int idx, Instant i) throws SQLException {
        if (i == null) ps.setNull(idx, Types.TIMESTAMP_WITH_TIMEZONE);
        else ps.setObject(idx, OffsetDateTime.ofInstant(i, ZoneOffset.UTC));
    }

    public static Instant getInstant(ResultSet rs, String col) throws SQLException {
        OffsetDateTime t = rs.getObject(col, OffsetDateTime.class);
        return t == null ? null : t.toInstant();
    }

    public static void setNullableInt(PreparedStatement ps, int idx, Integer v) throws SQLException {
        if (v == null) ps.setNull(idx, Types.INTEGER);
        else ps.setInt(idx, v);
    }

    public static Integer getNullableInt(ResultSet rs, String col) throws SQLException {
        int v = rs.getInt(col);
        return rs.wasNull() ? null : v;
    }

    public static Long getNullableLong(ResultSet rs, String col) throws SQLException {
        long v = rs.getLong(col);
        return rs.wasNull() ? null : v;
    }

    public static String yn(boolean b) { return b ? "Y" : "N"; }

    public static boolean yn(String s) { return "Y".equals(s); }

    // ENV_VARS 컬럼: JSON 객체 문자열
    public static String envToJson(Map<String, String> env) {
        if (env == null || env.isEmpty()) return null;
        try {
            return JSON.writeValueAsString(new TreeMap<>(env));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("environment is not serializable", e);
        }
    }

    public static Map<String, String> envFromJson(String json) {
        if (json == null || json.isBlank()) return Map.of();
        try {
            return JSON.readValue(json, ENV_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("corrupt ENV_VARS column: " + e.getOriginalMessage(), e);
        }
    }
}
