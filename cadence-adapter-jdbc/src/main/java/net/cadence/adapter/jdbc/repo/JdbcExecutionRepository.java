package net.cadence.adapter.jdbc.repo;

import net.cadence.adapter.jdbc.JdbcUtil;
import net.cadence.adapter.jdbc.TxContext;
import net.cadence.adapter.jdbc.mapper.RowMappers;
import net.cadence.core.model.Execution;
import net.cadence.core.model.ExecutionSeal;
import net.cadence.core.spi.ExecutionRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class JdbcExecutionRepository implements ExecutionRepository {

    @Override
    public Execution start(long jobId, Instant startTime, int retryCount, Execution.TriggeredBy triggeredBy) throws Exception {
        Connection c = TxContext.require();
        try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO JOB_EXECUTIONS(JOB_ID, START_TIME, OUTCOME, RETRY_COUNT, TRIGGERED_BY, STDOUT, STDERR)
                VALUES (?, ?, 'RUNNING', ?, ?, '', '')
            """, new String[]{"ID"})) {
            ps.setLong(1, jobId);
            JdbcUtil.setInstant(ps, 2, startTime);
            ps.setInt(3, retryCount);
            ps.setString(4, triggeredBy.code());
            ps.executeUpdate();
            try (ResultSet k = ps.getGeneratedKeys()) {
                k.next();
                long id = k.getLong(1);
                return new Execution(id, jobId, startTime, null, Execution.Outcome.RUNNING, null, "", "",
                        retryCount, triggeredBy, null, false);
            }
        }
    }

    @Override
    public void attachPid(long executionId, long pid) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                UPDATE JOB_EXECUTIONS SET PID = ? WHERE ID = ? AND END_TIME IS NULL
            """)) {
            ps.setLong(1, pid);
            ps.setLong(2, executionId);
            ps.executeUpdate();
        }
    }

    @Override
    public void updateOutput(long executionId, String stdout, String stderr) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                UPDATE JOB_EXECUTIONS SET STDOUT = ?, STDERR = ? WHERE ID = ? AND END_TIME IS NULL
            """)) {
            ps.setString(1, stdout);
            ps.setString(2, stderr);
            ps.setLong(3, executionId);
            ps.executeUpdate();
        }
    }

    @Override
    public boolean seal(long executionId, ExecutionSeal seal) throws Exception {
        // END_TIME IS NULL 조건: 먼저 봉인한 쪽만 반영
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                UPDATE JOB_EXECUTIONS
                   SET END_TIME = ?, OUTCOME = ?, EXIT_CODE = ?, STDOUT = ?, STDERR = ?,
                       PROCESS_MAY_BE_ALIVE = ?
                 WHERE ID = ? AND END_TIME IS NULL
            """)) {
            JdbcUtil.setInstant(ps, 1, seal.endTime());
            ps.setString(2, seal.outcome().code());
            JdbcUtil.setNullableInt(ps, 3, seal.exitCode());
            ps.setString(4, seal.stdout());
            ps.setString(5, seal.stderr());
            ps.setString(6, JdbcUtil.yn(seal.processMayBeAlive()));
            ps.setLong(7, executionId);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public Optional<Execution> findById(long id) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("SELECT * FROM JOB_EXECUTIONS WHERE ID = ?")) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(RowMappers.toExecution(rs));
            }
        }
    }

    @Override
    public List<Execution> findByJob(long jobId, int limit, int offset) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                SELECT * FROM JOB_EXECUTIONS
                 WHERE JOB_ID = ?
                 ORDER BY START_TIME DESC, ID DESC
                 OFFSET ? ROWS FETCH NEXT ? ROWS ONLY
            """)) {
            ps.setLong(1, jobId);
            ps.setInt(2, offset);
            ps.setInt(3, limit);
            return list(ps);
        }
    }

    @Override
    public List<Execution> findRecent(int limit, Execution.Outcome outcome) throws Exception {
        String where = outcome == null ? "" : "WHERE OUTCOME = ? ";
        try (PreparedStatement ps = TxContext.require().prepareStatement(
                "SELECT * FROM JOB_EXECUTIONS " + where + "ORDER BY START_TIME DESC, ID DESC FETCH FIRST ? ROWS ONLY")) {
            int i = 1;
            if (outcome != null) ps.setString(i++, outcome.code());
            ps.setInt(i, limit);
            return list(ps);
        }
    }

    @Override
    public Map<Long, Execution> findLatestPerJob() throws Exception {
        // ID 는 단조 증가 → 잡별 MAX(ID) 가 가장 최근 시도
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                SELECT e.* FROM JOB_EXECUTIONS e
                  JOIN (SELECT JOB_ID, MAX(ID) AS MAX_ID FROM JOB_EXECUTIONS GROUP BY JOB_ID) m
                    ON e.ID = m.MAX_ID
            """)) {
            Map<Long, Execution> out = new HashMap<>();
            for (Execution e : list(ps)) out.put(e.jobId(), e);
            return out;
        }
    }

    @Override
    public List<Execution> findRunning() throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                SELECT * FROM JOB_EXECUTIONS WHERE END_TIME IS NULL ORDER BY ID
            """)) {
            return list(ps);
        }
    }

    @Override
    public long countByJob(long jobId) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement(
                "SELECT COUNT(*) FROM JOB_EXECUTIONS WHERE JOB_ID = ?")) {
            ps.setLong(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return rs.getLong(1);
            }
        }
    }

    private static List<Execution> list(PreparedStatement ps) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            List<Execution> out = new ArrayList<>();
            while (rs.next()) out.add(RowMappers.toExecution(rs));
            return out;
        }
    }
}
