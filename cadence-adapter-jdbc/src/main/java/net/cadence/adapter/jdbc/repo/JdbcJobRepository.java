package net.cadence.adapter.jdbc.repo;

import net.cadence.adapter.jdbc.JdbcUtil;
import net.cadence.adapter.jdbc.TxContext;
import net.cadence.adapter.jdbc.mapper.RowMappers;
import net.cadence.core.model.Execution;
import net.cadence.core.model.Job;
import net.cadence.core.model.Schedule;
import net.cadence.core.spi.JobRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class JdbcJobRepository implements JobRepository {

    @Override
    public Job insert(Job job) throws Exception {
        Connection c = TxContext.require();
        try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO JOBS(NAME, DESCRIPTION, JOB_KIND, COMMAND, WORKING_DIRECTORY, ENV_VARS,
                                 SCHEDULE_TYPE, INTERVAL_MINUTES, CRON_EXPR, ENABLED,
                                 MAX_RETRIES, RETRY_DELAY_SECONDS, TIMEOUT_SECONDS,
                                 NOTIFY_ADDRESS, NOTIFY_ON_SUCCESS, NOTIFY_ON_FAILURE,
                                 NEXT_RUN, CREATED_AT, UPDATED_AT)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)
            """, new String[]{"ID"})) {
            int i = bindDefinition(ps, job);
            JdbcUtil.setInstant(ps, i, job.nextRun());
            ps.executeUpdate();
            try (ResultSet k = ps.getGeneratedKeys()) {
                k.next();
                long id = k.getLong(1);
                return findById(id).orElseThrow(() -> new IllegalStateException("insert failed to load job " + id));
            }
        }
    }

    @Override
    public void update(Job job) throws Exception {
        Connection c = TxContext.require();
        try (PreparedStatement ps = c.prepareStatement("""
                UPDATE JOBS
                   SET NAME = ?, DESCRIPTION = ?, JOB_KIND = ?, COMMAND = ?, WORKING_DIRECTORY = ?, ENV_VARS = ?,
                       SCHEDULE_TYPE = ?, INTERVAL_MINUTES = ?, CRON_EXPR = ?, ENABLED = ?,
                       MAX_RETRIES = ?, RETRY_DELAY_SECONDS = ?, TIMEOUT_SECONDS = ?,
                       NOTIFY_ADDRESS = ?, NOTIFY_ON_SUCCESS = ?, NOTIFY_ON_FAILURE = ?,
                       NEXT_RUN = ?, UPDATED_AT = CURRENT_TIMESTAMP
                 WHERE ID = ?
            """)) {
            int i = bindDefinition(ps, job);
            JdbcUtil.setInstant(ps, i++, job.nextRun());
            ps.setLong(i, job.id());
            if (ps.executeUpdate() == 0) {
                throw new IllegalStateException("JOBS not found for ID=" + job.id());
            }
        }
    }

    /** 정의 컬럼 16개 바인딩. 다음 파라미터 인덱스를 반환 */
    private static int bindDefinition(PreparedStatement ps, Job job) throws SQLException {
        int i = 1;
        ps.setString(i++, job.name());
        ps.setString(i++, job.description());
        ps.setString(i++, job.kind().code());
        ps.setString(i++, job.command());
        ps.setString(i++, job.workingDirectory());
        ps.setString(i++, JdbcUtil.envToJson(job.environment()));
        Schedule s = job.schedule();
        ps.setString(i++, s.type().code());
        JdbcUtil.setNullableInt(ps, i++, s instanceof Schedule.Interval iv ? iv.minutes() : null);
        ps.setString(i++, s instanceof Schedule.Cron cr ? cr.expression() : null);
        ps.setString(i++, JdbcUtil.yn(job.enabled()));
        ps.setInt(i++, job.retry().maxRetries());
        ps.setLong(i++, job.retry().retryDelaySeconds());
        JdbcUtil.setNullableInt(ps, i++, job.timeoutSeconds());
        ps.setString(i++, job.notification().address());
        ps.setString(i++, JdbcUtil.yn(job.notification().notifyOnSuccess()));
        ps.setString(i++, JdbcUtil.yn(job.notification().notifyOnFailure()));
        return i;
    }

    @Override
    public boolean delete(long id) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("DELETE FROM JOBS WHERE ID = ?")) {
            ps.setLong(1, id);
            return ps.executeUpdate() > 0;
        }
    }

    @Override
    public Optional<Job> findById(long id) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("SELECT * FROM JOBS WHERE ID = ?")) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(RowMappers.toJob(rs));
            }
        }
    }

    @Override
    public Optional<Job> findByName(String name) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("SELECT * FROM JOBS WHERE NAME = ?")) {
            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(RowMappers.toJob(rs));
            }
        }
    }

    @Override
    public List<Job> findAll() throws Exception {
        return query("SELECT * FROM JOBS ORDER BY NAME");
    }

    @Override
    public List<Job> findEnabled() throws Exception {
        return query("SELECT * FROM JOBS WHERE ENABLED = 'Y' ORDER BY NAME");
    }

    private static List<Job> query(String sql) throws SQLException {
        try (PreparedStatement ps = TxContext.require().prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            List<Job> out = new ArrayList<>();
            while (rs.next()) out.add(RowMappers.toJob(rs));
            return out;
        }
    }

    @Override
    public void setEnabled(long id, boolean enabled) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                UPDATE JOBS SET ENABLED = ?, UPDATED_AT = CURRENT_TIMESTAMP WHERE ID = ?
            """)) {
            ps.setString(1, JdbcUtil.yn(enabled));
            ps.setLong(2, id);
            ps.executeUpdate();
        }
    }

    @Override
    public void updateNextRun(long id, Instant nextRun) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("UPDATE JOBS SET NEXT_RUN = ? WHERE ID = ?")) {
            JdbcUtil.setInstant(ps, 1, nextRun);
            ps.setLong(2, id);
            ps.executeUpdate();
        }
    }

    @Override
    public void recordRun(long id, Instant lastRun, Execution.Outcome lastStatus) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                UPDATE JOBS SET LAST_RUN = ?, LAST_STATUS = ? WHERE ID = ?
            """)) {
            JdbcUtil.setInstant(ps, 1, lastRun);
            ps.setString(2, lastStatus == null ? null : lastStatus.code());
            ps.setLong(3, id);
            ps.executeUpdate();
        }
    }

    @Override
    public int resetRunningStatus(Execution.Outcome replacement) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                UPDATE JOBS SET LAST_STATUS = ? WHERE LAST_STATUS = 'RUNNING'
            """)) {
            ps.setString(1, replacement.code());
            return ps.executeUpdate();
        }
    }
}
