package com.govsignal.decision;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.govsignal.store.JdbcValues;
import com.govsignal.store.StoreException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.time.LocalDate;
import java.util.List;

@Repository
@ConditionalOnProperty(prefix = "governance.store", name = "type", havingValue = "jdbc")
public class JdbcDecisionStore implements DecisionStore {

    private static final TypeReference<List<DecisionOption>> OPTIONS_TYPE = new TypeReference<>() {};

    private static final String COLUMNS =
        "id, project_id, ref, title, context, rationale, decision_text, category, status, impact, "
            + "impact_description, owner, approver, options_considered, date_raised, needed_by_date, "
            + "approved_date, implementation_date, review_date, reversible, last_updated";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<Decision> rowMapper;

    public JdbcDecisionStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = (rs, rowNum) -> new Decision(
            rs.getString("id"),
            rs.getString("ref"),
            rs.getString("title"),
            rs.getString("context"),
            rs.getString("rationale"),
            rs.getString("decision_text"),
            rs.getString("category"),
            DecisionStatus.fromValue(rs.getString("status")),
            DecisionImpact.fromValue(rs.getString("impact")),
            rs.getString("impact_description"),
            rs.getString("owner"),
            rs.getString("approver"),
            JdbcValues.readJsonList(objectMapper, rs.getString("options_considered"), OPTIONS_TYPE),
            JdbcValues.getLocalDate(rs, "date_raised"),
            JdbcValues.getLocalDate(rs, "needed_by_date"),
            JdbcValues.getLocalDate(rs, "approved_date"),
            JdbcValues.getLocalDate(rs, "implementation_date"),
            JdbcValues.getLocalDate(rs, "review_date"),
            rs.getBoolean("reversible"),
            JdbcValues.getInstant(rs, "last_updated"));
    }

    @Override
    public List<Decision> findByProject(String projectId) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM decisions WHERE project_id = ? "
                + "ORDER BY date_raised ASC NULLS LAST, ref ASC, id ASC",
            rowMapper, projectId);
    }

    @Override
    @Transactional
    public void save(String projectId, Decision d) {
        try {
            jdbcTemplate.update("DELETE FROM decisions WHERE id = ?", d.id());
            jdbcTemplate.update(
                "INSERT INTO decisions (" + COLUMNS + ") "
                    + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                ps -> {
                    ps.setString(1, d.id());
                    ps.setString(2, projectId);
                    ps.setString(3, d.ref());
                    ps.setString(4, d.title());
                    ps.setString(5, d.context());
                    ps.setString(6, d.rationale());
                    ps.setString(7, d.decision());
                    ps.setString(8, d.category());
                    ps.setString(9, d.status().getValue());
                    ps.setString(10, d.impact().getValue());
                    ps.setString(11, d.impactDescription());
                    ps.setString(12, d.owner());
                    ps.setString(13, d.approver());
                    ps.setString(14, JdbcValues.writeJson(objectMapper, d.optionsConsidered()));
                    setDate(ps, 15, d.dateRaised());
                    setDate(ps, 16, d.neededByDate());
                    setDate(ps, 17, d.approvedDate());
                    setDate(ps, 18, d.implementationDate());
                    setDate(ps, 19, d.reviewDate());
                    ps.setBoolean(20, d.reversible());
                    JdbcValues.setTimestamp(ps, 21, d.lastUpdated());
                });
        } catch (DataAccessException ex) {
            throw new StoreException("save decision " + d.id() + " failed: " + ex.getMessage(), ex);
        }
    }

    private static void setDate(PreparedStatement ps, int index, LocalDate date) throws SQLException {
        if (date == null) {
            ps.setNull(index, Types.DATE);
        } else {
            ps.setObject(index, date);
        }
    }
}
