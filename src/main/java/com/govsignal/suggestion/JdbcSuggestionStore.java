package com.govsignal.suggestion;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.govsignal.store.JdbcValues;
import com.govsignal.store.StoreException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;

@Repository
@ConditionalOnProperty(prefix = "governance.store", name = "type", havingValue = "jdbc")
public class JdbcSuggestionStore implements SuggestionStore {

    private static final String COLUMNS =
        "id, project_id, source_event_id, target_artifact_id, target_artifact_type, suggestion_type, "
            + "patch, rationale, confidence, status, rule_id, rule_version, trigger_key, created_at";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<Suggestion> rowMapper;

    public JdbcSuggestionStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = (rs, rowNum) -> new Suggestion(
            rs.getString("id"),
            rs.getString("project_id"),
            rs.getString("source_event_id"),
            rs.getString("target_artifact_id"),
            rs.getString("target_artifact_type"),
            SuggestionType.fromValue(rs.getString("suggestion_type")),
            JdbcValues.readJsonObject(objectMapper, rs.getString("patch")),
            rs.getString("rationale"),
            rs.getDouble("confidence"),
            SuggestionStatus.fromValue(rs.getString("status")),
            rs.getString("rule_id"),
            rs.getString("rule_version"),
            rs.getString("trigger_key"),
            JdbcValues.getInstant(rs, "created_at"));
    }

    @Override
    public void insertAll(List<Suggestion> suggestions) {
        if (suggestions == null || suggestions.isEmpty()) {
            return;
        }
        try {
            jdbcTemplate.batchUpdate(
                "INSERT INTO ai_suggestions (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                new BatchPreparedStatementSetter() {
                    @Override
                    public void setValues(PreparedStatement ps, int idx) throws SQLException {
                        bind(ps, suggestions.get(idx));
                    }

                    @Override
                    public int getBatchSize() {
                        return suggestions.size();
                    }
                });
        } catch (DataAccessException ex) {
            throw new StoreException("insert ai_suggestions failed: " + ex.getMessage(), ex);
        }
    }

    @Override
    public List<Suggestion> findByProject(String projectId) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM ai_suggestions WHERE project_id = ? ORDER BY created_at ASC, id ASC",
            rowMapper, projectId);
    }

    @Override
    public List<Suggestion> findBySourceEvent(String sourceEventId) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM ai_suggestions WHERE source_event_id = ? ORDER BY created_at ASC, id ASC",
            rowMapper, sourceEventId);
    }

    @Override
    public List<Suggestion> findProposedCreatedBefore(String projectId, Instant cutoff, int limit) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM ai_suggestions "
                + "WHERE project_id = ? AND status = ? AND suggestion_type <> ? AND created_at < ? "
                + "ORDER BY created_at ASC, id ASC LIMIT ?",
            rowMapper, projectId, SuggestionStatus.PROPOSED.getValue(), SuggestionType.SLA_ESCALATION.getValue(),
            JdbcValues.timestamp(cutoff),
            Math.max(0, limit));
    }

    @Override
    public boolean existsProposedWithTriggerKey(String projectId, String triggerKey) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM ai_suggestions WHERE project_id = ? AND status = ? AND trigger_key = ?",
            Integer.class, projectId, SuggestionStatus.PROPOSED.getValue(), triggerKey);
        return count != null && count > 0;
    }

    private void bind(PreparedStatement ps, Suggestion s) throws SQLException {
        ps.setString(1, s.id());
        ps.setString(2, s.projectId());
        ps.setString(3, s.sourceEventId());
        ps.setString(4, s.targetArtifactId());
        ps.setString(5, s.targetArtifactType());
        ps.setString(6, s.suggestionType().getValue());
        ps.setString(7, JdbcValues.writeJson(objectMapper, s.patch()));
        ps.setString(8, s.rationale());
        ps.setDouble(9, s.confidence());
        ps.setString(10, s.status().getValue());
        ps.setString(11, s.ruleId());
        ps.setString(12, s.ruleVersion());
        ps.setString(13, s.triggerKey());
        JdbcValues.setTimestamp(ps, 14, s.createdAt());
    }
}
