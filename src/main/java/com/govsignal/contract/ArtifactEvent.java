package com.govsignal.contract;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable fact that an artifact was created, updated or otherwise mutated.
 *
 * Appended by the owning feature; the orchestrator only writes back the
 * processing bookkeeping (processed_at, process_error, attempts, claim and
 * quarantine columns). Once processed_at is set the event is never routed again.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ArtifactEvent {

    private String id;
    private String projectId;
    private String artifactId;
    private String artifactType;
    private String action;
    private Map<String, Object> payload;
    private Instant createdAt;

    private Instant processedAt;
    private String processError;
    private int attempts;
    private String claimedBy;
    private Instant claimExpiresAt;
    private Instant quarantinedAt;

    public ArtifactEvent() {
    }

    public ArtifactEvent(String id, String projectId, String artifactId,
                         String artifactType, String action,
                         Map<String, Object> payload, Instant createdAt) {
        this.id = id;
        this.projectId = projectId;
        this.artifactId = artifactId;
        this.artifactType = artifactType;
        this.action = action;
        this.payload = payload;
        this.createdAt = createdAt;
    }

    /** Detached copy, so stores never hand out their own mutable instances. */
    public ArtifactEvent copy() {
        ArtifactEvent copy = new ArtifactEvent(id, projectId, artifactId, artifactType, action,
            payload != null ? new LinkedHashMap<>(payload) : null, createdAt);
        copy.processedAt = processedAt;
        copy.processError = processError;
        copy.attempts = attempts;
        copy.claimedBy = claimedBy;
        copy.claimExpiresAt = claimExpiresAt;
        copy.quarantinedAt = quarantinedAt;
        return copy;
    }

    public boolean isProcessed() {
        return processedAt != null;
    }

    public boolean isQuarantined() {
        return quarantinedAt != null;
    }

    public boolean isClaimedAt(Instant now) {
        return claimExpiresAt != null && !claimExpiresAt.isBefore(now);
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getProjectId() {
        return projectId;
    }

    public void setProjectId(String projectId) {
        this.projectId = projectId;
    }

    public String getArtifactId() {
        return artifactId;
    }

    public void setArtifactId(String artifactId) {
        this.artifactId = artifactId;
    }

    public String getArtifactType() {
        return artifactType;
    }

    public void setArtifactType(String artifactType) {
        this.artifactType = artifactType;
    }

    public String getAction() {
        return action;
    }

    public void setAction(String action) {
        this.action = action;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    public void setPayload(Map<String, Object> payload) {
        this.payload = payload;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getProcessedAt() {
        return processedAt;
    }

    public void setProcessedAt(Instant processedAt) {
        this.processedAt = processedAt;
    }

    public String getProcessError() {
        return processError;
    }

    public void setProcessError(String processError) {
        this.processError = processError;
    }

    public int getAttempts() {
        return attempts;
    }

    public void setAttempts(int attempts) {
        this.attempts = attempts;
    }

    public String getClaimedBy() {
        return claimedBy;
    }

    public void setClaimedBy(String claimedBy) {
        this.claimedBy = claimedBy;
    }

    public Instant getClaimExpiresAt() {
        return claimExpiresAt;
    }

    public void setClaimExpiresAt(Instant claimExpiresAt) {
        this.claimExpiresAt = claimExpiresAt;
    }

    public Instant getQuarantinedAt() {
        return quarantinedAt;
    }

    public void setQuarantinedAt(Instant quarantinedAt) {
        this.quarantinedAt = quarantinedAt;
    }
}
