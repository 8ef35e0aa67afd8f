package com.govsignal.sla;

import com.govsignal.config.GovernanceProperties;
import com.govsignal.store.JdbcValues;
import com.govsignal.store.StoreException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Delete-all plus chunked bulk insert for both tables, inside one transaction.
 */
@Repository
@ConditionalOnProperty(prefix = "governance.store", name = "type", havingValue = "jdbc")
public class JdbcSlaCacheStore implements SlaCacheStore {

    private static final String CACHE_COLUMNS =
        "step_id, source, project_id, artifact_type, stage_key, approver_user_id, approver_group_id, "
            + "approver_label, submitted_at, due_at, sla_status, hours_to_due, hours_overdue, sla_hours, computed_at";

    private static final String BOTTLENECK_COLUMNS =
        "approver_user_id, approver_group_id, approver_label, open_steps, breached_steps, at_risk_steps, "
            + "max_hours_overdue, blocker_score, computed_at";

    private static final RowMapper<SlaCacheRow> CACHE_MAPPER = (rs, rowNum) -> new SlaCacheRow(
        rs.getString("step_id"),
        ApprovalSource.fromValue(rs.getString("source")),
        rs.getString("project_id"),
        rs.getString("artifact_type"),
        rs.getString("stage_key"),
        rs.getString("approver_user_id"),
        rs.getString("approver_group_id"),
        rs.getString("approver_label"),
        JdbcValues.getInstant(rs, "submitted_at"),
        JdbcValues.getInstant(rs, "due_at"),
        SlaStatus.fromValue(rs.getString("sla_status")),
        JdbcValues.getNullableLong(rs, "hours_to_due"),
        JdbcValues.getNullableLong(rs, "hours_overdue"),
        rs.getInt("sla_hours"),
        JdbcValues.getInstant(rs, "computed_at"));

    private static final RowMapper<BottleneckRow> BOTTLENECK_MAPPER = (rs, rowNum) -> new BottleneckRow(
        rs.getString("approver_user_id"),
        rs.getString("approver_group_id"),
        rs.getString("approver_label"),
        rs.getInt("open_steps"),
        rs.getInt("breached_steps"),
        rs.getInt("at_risk_steps"),
        rs.getLong("max_hours_overdue"),
        rs.getInt("blocker_score"),
        JdbcValues.getInstant(rs, "computed_at"));

    private final JdbcTemplate jdbcTemplate;
    private final int chunkSize;

    public JdbcSlaCacheStore(JdbcTemplate jdbcTemplate, GovernanceProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.chunkSize = Math.max(1, properties.getSla().getInsertChunkSize());
    }

    @Override
    @Transactional
    public void replaceAll(List<SlaCacheRow> cacheRows, List<BottleneckRow> bottlenecks) {
        try {
            jdbcTemplate.update("DELETE FROM exec_approval_cache");
            jdbcTemplate.update("DELETE FROM exec_approval_bottlenecks");

            for (int from = 0; from < cacheRows.size(); from += chunkSize) {
                List<SlaCacheRow> chunk = cacheRows.subList(from, Math.min(from + chunkSize, cacheRows.size()));
                jdbcTemplate.batchUpdate(
                    "INSERT INTO exec_approval_cache (" + CACHE_COLUMNS + ") "
                        + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                    chunk, chunk.size(), (ps, row) -> {
                        ps.setString(1, row.stepId());
                        ps.setString(2, row.source().getValue());
                        ps.setString(3, row.projectId());
                        ps.setString(4, row.artifactType());
                        ps.setString(5, row.stageKey());
                        ps.setString(6, row.approverUserId());
                        ps.setString(7, row.approverGroupId());
                        ps.setString(8, row.approverLabel());
                        JdbcValues.setTimestamp(ps, 9, row.submittedAt());
                        JdbcValues.setTimestamp(ps, 10, row.dueAt());
                        ps.setString(11, row.slaStatus().getValue());
                        JdbcValues.setNullableLong(ps, 12, row.hoursToDue());
                        JdbcValues.setNullableLong(ps, 13, row.hoursOverdue());
                        ps.setInt(14, row.slaHours());
                        JdbcValues.setTimestamp(ps, 15, row.computedAt());
                    });
            }

            for (int from = 0; from < bottlenecks.size(); from += chunkSize) {
                List<BottleneckRow> chunk = bottlenecks.subList(from, Math.min(from + chunkSize, bottlenecks.size()));
                jdbcTemplate.batchUpdate(
                    "INSERT INTO exec_approval_bottlenecks (" + BOTTLENECK_COLUMNS + ") "
                        + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
                    chunk, chunk.size(), (ps, row) -> {
                        ps.setString(1, row.approverUserId());
                        ps.setString(2, row.approverGroupId());
                        ps.setString(3, row.approverLabel());
                        ps.setInt(4, row.openSteps());
                        ps.setInt(5, row.breachedSteps());
                        ps.setInt(6, row.atRiskSteps());
                        ps.setLong(7, row.maxHoursOverdue());
                        ps.setInt(8, row.blockerScore());
                        JdbcValues.setTimestamp(ps, 9, row.computedAt());
                    });
            }
        } catch (DataAccessException ex) {
            throw new StoreException("replace of SLA cache failed: " + ex.getMessage(), ex);
        }
    }

    @Override
    public List<SlaCacheRow> findCacheRows() {
        return jdbcTemplate.query(
            "SELECT " + CACHE_COLUMNS + " FROM exec_approval_cache ORDER BY due_at ASC NULLS LAST, step_id ASC",
            CACHE_MAPPER);
    }

    @Override
    public List<BottleneckRow> findBottlenecks() {
        return jdbcTemplate.query(
            "SELECT " + BOTTLENECK_COLUMNS + " FROM exec_approval_bottlenecks "
                + "ORDER BY blocker_score DESC, approver_label ASC",
            BOTTLENECK_MAPPER);
    }
}
