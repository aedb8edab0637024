package net.cadence.adapter.jdbc.repo;

import net.cadence.adapter.jdbc.TxContext;
import net.cadence.adapter.jdbc.mapper.RowMappers;
import net.cadence.core.model.DependencyEdge;
import net.cadence.core.spi.JobDependencyRepository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.ArrayList;
import java.util.List;

public final class JdbcJobDependencyRepository implements JobDependencyRepository {

    @Override
    public void add(long jobId, long dependsOnJobId) throws Exception {
        // 중복은 무시 (PK 충돌 없이)
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                MERGE INTO JOB_DEPENDENCIES d
                USING (SELECT CAST(? AS BIGINT) JOB_ID, CAST(? AS BIGINT) DEPENDS_ON_JOB_ID) s
                   ON (d.JOB_ID = s.JOB_ID AND d.DEPENDS_ON_JOB_ID = s.DEPENDS_ON_JOB_ID)
                WHEN NOT MATCHED THEN INSERT (JOB_ID, DEPENDS_ON_JOB_ID, CREATED_AT)
                     VALUES (s.JOB_ID, s.DEPENDS_ON_JOB_ID, CURRENT_TIMESTAMP)
            """)) {
            ps.setLong(1, jobId);
            ps.setLong(2, dependsOnJobId);
            ps.executeUpdate();
        }
    }

    @Override
    public boolean remove(long jobId, long dependsOnJobId) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                DELETE FROM JOB_DEPENDENCIES WHERE JOB_ID = ? AND DEPENDS_ON_JOB_ID = ?
            """)) {
            ps.setLong(1, jobId);
            ps.setLong(2, dependsOnJobId);
            return ps.executeUpdate() > 0;
        }
    }

    @Override
    public int removeAllFor(long jobId) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                DELETE FROM JOB_DEPENDENCIES WHERE JOB_ID = ? OR DEPENDS_ON_JOB_ID = ?
            """)) {
            ps.setLong(1, jobId);
            ps.setLong(2, jobId);
            return ps.executeUpdate();
        }
    }

    @Override
    public List<Long> findDependencies(long jobId) throws Exception {
        return ids("SELECT DEPENDS_ON_JOB_ID FROM JOB_DEPENDENCIES WHERE JOB_ID = ? ORDER BY DEPENDS_ON_JOB_ID", jobId);
    }

    @Override
    public List<Long> findDependents(long jobId) throws Exception {
        return ids("SELECT JOB_ID FROM JOB_DEPENDENCIES WHERE DEPENDS_ON_JOB_ID = ? ORDER BY JOB_ID", jobId);
    }

    private static List<Long> ids(String sql, long jobId) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement(sql)) {
            ps.setLong(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                List<Long> out = new ArrayList<>();
                while (rs.next()) out.add(rs.getLong(1));
                return out;
            }
        }
    }

    @Override
    public List<DependencyEdge> findAll() throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                SELECT JOB_ID, DEPENDS_ON_JOB_ID, CREATED_AT FROM JOB_DEPENDENCIES ORDER BY JOB_ID, DEPENDS_ON_JOB_ID
            """);
             ResultSet rs = ps.executeQuery()) {
            List<DependencyEdge> out = new ArrayList<>();
            while (rs.next()) out.add(RowMappers.toEdge(rs));
            return out;
        }
    }
}
