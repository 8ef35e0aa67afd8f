package com.govsignal.sla;

import com.govsignal.store.StoreException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
@ConditionalOnProperty(prefix = "governance.store", name = "type", havingValue = "jdbc")
public class JdbcSlaPolicyStore implements SlaPolicyStore {

    private static final RowMapper<SlaPolicy> ROW_MAPPER = (rs, rowNum) -> new SlaPolicy(
        rs.getString("project_id"),
        rs.getString("artifact_type"),
        rs.getString("stage_key"),
        rs.getInt("sla_hours"),
        rs.getInt("warn_hours"),
        rs.getInt("breach_grace_hours"),
        rs.getBoolean("is_active"));

    private final JdbcTemplate jdbcTemplate;

    public JdbcSlaPolicyStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<SlaPolicy> findActive() {
        return jdbcTemplate.query(
            "SELECT project_id, artifact_type, stage_key, sla_hours, warn_hours, breach_grace_hours, is_active "
                + "FROM approval_sla_config WHERE is_active = TRUE ORDER BY id ASC",
            ROW_MAPPER);
    }

    @Override
    public void save(SlaPolicy policy) {
        try {
            jdbcTemplate.update(
                "INSERT INTO approval_sla_config "
                    + "(project_id, artifact_type, stage_key, sla_hours, warn_hours, breach_grace_hours, is_active) "
                    + "VALUES (?, ?, ?, ?, ?, ?, ?)",
                policy.projectId(), policy.artifactType(), policy.stageKey(),
                policy.slaHours(), policy.warnHours(), policy.breachGraceHours(), policy.active());
        } catch (DataAccessException ex) {
            throw new StoreException("insert approval_sla_config failed: " + ex.getMessage(), ex);
        }
    }
}
