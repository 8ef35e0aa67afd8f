package com.govsignal.sla;

import com.govsignal.store.JdbcValues;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Reads undecided approval work. An artifact step counts as pending while its status is
 * {@code pending} and no decision row references it.
 */
@Repository
@ConditionalOnProperty(prefix = "governance.store", name = "type", havingValue = "jdbc")
public class JdbcPendingStepStore implements PendingStepStore {

    private final JdbcTemplate jdbcTemplate;

    public JdbcPendingStepStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<PendingStep> findPendingArtifactSteps() {
        return jdbcTemplate.query(
            "SELECT s.id, s.project_id, s.artifact_type, s.stage_key, s.submitted_at, s.due_at, "
                + "s.approver_user_id, s.approver_group_id, g.name AS group_name "
                + "FROM artifact_approval_steps s "
                + "LEFT JOIN approval_groups g ON g.id = s.approver_group_id "
                + "WHERE s.status = 'pending' "
                + "AND NOT EXISTS (SELECT 1 FROM artifact_approval_decisions d WHERE d.step_id = s.id) "
                + "ORDER BY s.submitted_at ASC, s.id ASC",
            (rs, rowNum) -> new PendingStep(
                rs.getString("id"),
                ApprovalSource.ARTIFACT_STEP,
                rs.getString("project_id"),
                rs.getString("artifact_type"),
                rs.getString("stage_key"),
                JdbcValues.getInstant(rs, "submitted_at"),
                JdbcValues.getInstant(rs, "due_at"),
                rs.getString("approver_user_id"),
                rs.getString("approver_group_id"),
                rs.getString("group_name")));
    }

    @Override
    public List<PendingStep> findPendingAdHocApprovals() {
        return jdbcTemplate.query(
            "SELECT a.id, a.project_id, a.artifact_type, a.requested_at, a.due_at, "
                + "a.approver_user_id, a.approver_group_id, g.name AS group_name "
                + "FROM adhoc_approvals a "
                + "LEFT JOIN approval_groups g ON g.id = a.approver_group_id "
                + "WHERE a.status = 'pending' AND a.decided_at IS NULL "
                + "ORDER BY a.requested_at ASC, a.id ASC",
            (rs, rowNum) -> new PendingStep(
                rs.getString("id"),
                ApprovalSource.AD_HOC,
                rs.getString("project_id"),
                rs.getString("artifact_type"),
                null,
                JdbcValues.getInstant(rs, "requested_at"),
                JdbcValues.getInstant(rs, "due_at"),
                rs.getString("approver_user_id"),
                rs.getString("approver_group_id"),
                rs.getString("group_name")));
    }
}
