package com.govsignal.routing;

import com.govsignal.suggestion.Suggestion;
import com.govsignal.suggestion.SuggestionStatus;
import com.govsignal.suggestion.SuggestionType;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Router output: a suggestion without identity or timestamps, so that routing
 * the same event twice yields equal drafts.
 */
public record SuggestionDraft(
    String projectId,
    String sourceEventId,
    String targetArtifactId,
    String targetArtifactType,
    SuggestionType suggestionType,
    Map<String, Object> patch,
    String rationale,
    double confidence,
    String ruleId,
    String ruleVersion
) {

    public SuggestionDraft {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0,1]: " + confidence);
        }
        patch = patch == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(patch));
    }

    public Suggestion toSuggestion(String id, Instant createdAt) {
        return new Suggestion(id, projectId, sourceEventId, targetArtifactId, targetArtifactType,
            suggestionType, patch, rationale, confidence, SuggestionStatus.PROPOSED,
            ruleId, ruleVersion, null, createdAt);
    }
}
