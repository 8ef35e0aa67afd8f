package com.govsignal.event;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.govsignal.contract.ArtifactEvent;
import com.govsignal.store.JdbcValues;
import com.govsignal.store.StoreException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

@Repository
@ConditionalOnProperty(prefix = "governance.store", name = "type", havingValue = "jdbc")
public class JdbcArtifactEventStore implements ArtifactEventStore {

    private static final String COLUMNS =
        "id, project_id, artifact_id, artifact_type, action, payload, created_at, "
            + "processed_at, process_error, attempts, claimed_by, claim_expires_at, quarantined_at";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<ArtifactEvent> rowMapper;

    public JdbcArtifactEventStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = (rs, rowNum) -> {
            ArtifactEvent event = new ArtifactEvent(
                rs.getString("id"),
                rs.getString("project_id"),
                rs.getString("artifact_id"),
                rs.getString("artifact_type"),
                rs.getString("action"),
                JdbcValues.readJsonObject(objectMapper, rs.getString("payload")),
                JdbcValues.getInstant(rs, "created_at"));
            event.setProcessedAt(JdbcValues.getInstant(rs, "processed_at"));
            event.setProcessError(rs.getString("process_error"));
            event.setAttempts(rs.getInt("attempts"));
            event.setClaimedBy(rs.getString("claimed_by"));
            event.setClaimExpiresAt(JdbcValues.getInstant(rs, "claim_expires_at"));
            event.setQuarantinedAt(JdbcValues.getInstant(rs, "quarantined_at"));
            return event;
        };
    }

    @Override
    public ArtifactEvent append(ArtifactEvent event) {
        try {
            jdbcTemplate.update(
                "INSERT INTO artifact_events (id, project_id, artifact_id, artifact_type, action, payload, created_at, attempts) "
                    + "VALUES (?, ?, ?, ?, ?, ?, ?, 0)",
                event.getId(),
                event.getProjectId(),
                event.getArtifactId(),
                event.getArtifactType(),
                event.getAction(),
                JdbcValues.writeJson(objectMapper, event.getPayload()),
                JdbcValues.timestamp(event.getCreatedAt()));
            return event;
        } catch (DataAccessException ex) {
            throw new StoreException("append artifact event failed: " + ex.getMessage(), ex);
        }
    }

    @Override
    public boolean existsById(String eventId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM artifact_events WHERE id = ?", Integer.class, eventId);
        return count != null && count > 0;
    }

    @Override
    public Optional<ArtifactEvent> findById(String eventId) {
        List<ArtifactEvent> rows = jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM artifact_events WHERE id = ?", rowMapper, eventId);
        return rows.stream().findFirst();
    }

    @Override
    public List<ArtifactEvent> findUnprocessed(int limit, Instant now) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        try {
            return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM artifact_events "
                    + "WHERE processed_at IS NULL AND quarantined_at IS NULL "
                    + "AND (claim_expires_at IS NULL OR claim_expires_at < ?) "
                    + "ORDER BY created_at ASC, id ASC LIMIT ?",
                rowMapper, JdbcValues.timestamp(now), limit);
        } catch (DataAccessException ex) {
            throw new StoreException("fetch unprocessed events failed: " + ex.getMessage(), ex);
        }
    }

    @Override
    public boolean claim(String eventId, String workerId, Instant now, Instant leaseUntil) {
        try {
            int updated = jdbcTemplate.update(
                "UPDATE artifact_events SET claimed_by = ?, claim_expires_at = ?, attempts = attempts + 1 "
                    + "WHERE id = ? AND processed_at IS NULL AND quarantined_at IS NULL "
                    + "AND (claim_expires_at IS NULL OR claim_expires_at < ?)",
                workerId, JdbcValues.timestamp(leaseUntil), eventId, JdbcValues.timestamp(now));
            return updated == 1;
        } catch (DataAccessException ex) {
            throw new StoreException("claim event " + eventId + " failed: " + ex.getMessage(), ex);
        }
    }

    @Override
    public boolean markProcessed(String eventId, String workerId, Instant processedAt) {
        try {
            int updated = jdbcTemplate.update(
                "UPDATE artifact_events SET processed_at = ?, process_error = NULL, "
                    + "claimed_by = NULL, claim_expires_at = NULL "
                    + "WHERE id = ? AND claimed_by = ? AND processed_at IS NULL",
                JdbcValues.timestamp(processedAt), eventId, workerId);
            return updated == 1;
        } catch (DataAccessException ex) {
            throw new StoreException("mark processed failed: " + ex.getMessage(), ex);
        }
    }

    @Override
    public boolean markFailed(String eventId, String workerId, String error, boolean quarantine, Instant now) {
        try {
            int updated;
            if (quarantine) {
                updated = jdbcTemplate.update(
                    "UPDATE artifact_events SET process_error = ?, claimed_by = NULL, claim_expires_at = NULL, "
                        + "quarantined_at = ? WHERE id = ? AND claimed_by = ?",
                    error, JdbcValues.timestamp(now), eventId, workerId);
            } else {
                updated = jdbcTemplate.update(
                    "UPDATE artifact_events SET process_error = ?, claimed_by = NULL, claim_expires_at = NULL "
                        + "WHERE id = ? AND claimed_by = ?",
                    error, eventId, workerId);
            }
            return updated == 1;
        } catch (DataAccessException ex) {
            throw new StoreException("record failure failed: " + ex.getMessage(), ex);
        }
    }
}
