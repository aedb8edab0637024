package net.cadence.adapter.jdbc.mapper;

import net.cadence.adapter.jdbc.JdbcUtil;
import net.cadence.core.model.DependencyEdge;
import net.cadence.core.model.Execution;
import net.cadence.core.model.Job;
import net.cadence.core.model.JobKind;
import net.cadence.core.model.NotificationPrefs;
import net.cadence.core.model.RetrySettings;
import net.cadence.core.model.Schedule;

import java.sql.ResultSet;
import java.sql.SQLException;

public final class RowMappers {
    private RowMappers() {}

    // --- Job ---
    public static Job toJob(ResultSet rs) throws SQLException {
        String lastStatus = rs.getString("LAST_STATUS");
        return new Job(
                rs.getLong("ID"),
                rs.getString("NAME"),
                rs.getString("DESCRIPTION"),
                JobKind.from(rs.getString("JOB_KIND")),
                rs.getString("COMMAND"),
                rs.getString("WORKING_DIRECTORY"),
                JdbcUtil.envFromJson(rs.getString("ENV_VARS")),
                toSchedule(rs),
                JdbcUtil.yn(rs.getString("ENABLED")),
                new RetrySettings(rs.getInt("MAX_RETRIES"), rs.getLong("RETRY_DELAY_SECONDS")),
                JdbcUtil.getNullableInt(rs, "TIMEOUT_SECONDS"),
                new NotificationPrefs(
                        rs.getString("NOTIFY_ADDRESS"),
                        JdbcUtil.yn(rs.getString("NOTIFY_ON_SUCCESS")),
                        JdbcUtil.yn(rs.getString("NOTIFY_ON_FAILURE"))),
                JdbcUtil.getInstant(rs, "LAST_RUN"),
                JdbcUtil.getInstant(rs, "NEXT_RUN"),
                lastStatus == null ? null : Execution.Outcome.from(lastStatus),
                JdbcUtil.getInstant(rs, "CREATED_AT"),
                JdbcUtil.getInstant(rs, "UPDATED_AT")
        );
    }

    private static Schedule toSchedule(ResultSet rs) throws SQLException {
        switch (Schedule.Type.from(rs.getString("SCHEDULE_TYPE"))) {
            case INTERVAL:
                return Schedule.interval(rs.getInt("INTERVAL_MINUTES"));
            case CRON:
                return Schedule.cron(rs.getString("CRON_EXPR"));
            default:
                return Schedule.manual();
        }
    }

    // --- DependencyEdge ---
    public static DependencyEdge toEdge(ResultSet rs) throws SQLException {
        return new DependencyEdge(
                rs.getLong("JOB_ID"),
                rs.getLong("DEPENDS_ON_JOB_ID"),
                JdbcUtil.getInstant(rs, "CREATED_AT")
        );
    }

    // --- Execution ---
    public static Execution toExecution(ResultSet rs) throws SQLException {
        return new Execution(
                rs.getLong("ID"),
                rs.getLong("JOB_ID"),
                JdbcUtil.getInstant(rs, "START_TIME"),
                JdbcUtil.getInstant(rs, "END_TIME"),
                Execution.Outcome.from(rs.getString("OUTCOME")),
                JdbcUtil.getNullableInt(rs, "EXIT_CODE"),
                rs.getString("STDOUT"),
                rs.getString("STDERR"),
                rs.getInt("RETRY_COUNT"),
                Execution.TriggeredBy.from(rs.getString("TRIGGERED_BY")),
                JdbcUtil.getNullableLong(rs, "PID"),
                JdbcUtil.yn(rs.getString("PROCESS_MAY_BE_ALIVE"))
        );
    }
}
