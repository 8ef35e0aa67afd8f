package com.govsignal.contract;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;

@Component
public class EventContractValidator {

    private static final int MAX_TOKEN_LENGTH = 64;

    public void validate(ArtifactEvent event) {
        requireNonNull(event, "event cannot be null");
        if (event.getId() != null) {
            requireUuid(event.getId(), "id must be a valid UUID when provided");
        }
        requireString(event.getProjectId(), "project_id is required");
        requireString(event.getArtifactId(), "artifact_id is required");
        requireToken(event.getArtifactType(), "artifact_type");
        requireToken(event.getAction(), "action");

        if (event.getProcessedAt() != null || event.getProcessError() != null) {
            throw new InvalidEventException("processed_at and process_error are owned by the orchestrator");
        }

        Map<String, Object> payload = event.getPayload();
        if (payload != null && payload.containsKey("stakeholders")
                && payload.get("stakeholders") != null
                && !(payload.get("stakeholders") instanceof Iterable<?>)) {
            throw new InvalidEventException("payload.stakeholders must be a list");
        }
    }

    private void requireToken(String value, String field) {
        requireString(value, field + " is required");
        if (value.length() > MAX_TOKEN_LENGTH) {
            throw new InvalidEventException(field + " must be at most " + MAX_TOKEN_LENGTH + " characters");
        }
    }

    private void requireString(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new InvalidEventException(message);
        }
    }

    private void requireNonNull(Object value, String message) {
        if (value == null) {
            throw new InvalidEventException(message);
        }
    }

    private void requireUuid(String value, String message) {
        requireString(value, message);
        try {
            UUID.fromString(value);
        } catch (IllegalArgumentException ex) {
            throw new InvalidEventException(message);
        }
    }
}
