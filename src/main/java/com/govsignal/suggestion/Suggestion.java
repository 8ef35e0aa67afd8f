package com.govsignal.suggestion;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Advisory, non-binding proposal to seed or modify another artifact.
 *
 * @param sourceEventId the single event that produced it; null only for SLA escalations
 * @param patch opaque structured payload, null for advisory-only suggestions
 * @param triggerKey idempotency key for suggestions raised by periodic checks
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Suggestion(
    String id,
    String projectId,
    String sourceEventId,
    String targetArtifactId,
    String targetArtifactType,
    SuggestionType suggestionType,
    Map<String, Object> patch,
    String rationale,
    double confidence,
    SuggestionStatus status,
    String ruleId,
    String ruleVersion,
    String triggerKey,
    Instant createdAt
) {

    public Suggestion {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0,1]: " + confidence);
        }
        patch = patch == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(patch));
    }
}
