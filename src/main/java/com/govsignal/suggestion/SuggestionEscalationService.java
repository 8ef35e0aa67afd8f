package com.govsignal.suggestion;

import com.govsignal.config.GovernanceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Raises an {@code sla_escalation} suggestion for every proposed suggestion that
 * nobody has acted on for N days. Each escalation carries the trigger key
 * {@code sla.escalation.{suggestionId}.{N}d}, so repeated runs raise it once.
 */
@Service
public class SuggestionEscalationService {

    private static final Logger log = LoggerFactory.getLogger(SuggestionEscalationService.class);

    static final int MIN_DAYS = 1;
    static final int MAX_DAYS = 60;
    static final double ESCALATION_CONFIDENCE = 0.9;
    static final String RULE_ID = "stale-suggestion-escalation";
    static final String RULE_VERSION = "v1";

    private final SuggestionStore suggestionStore;
    private final GovernanceProperties.Suggestions settings;
    private final Clock clock;

    public SuggestionEscalationService(SuggestionStore suggestionStore,
                                       GovernanceProperties properties,
                                       Clock clock) {
        this.suggestionStore = suggestionStore;
        this.settings = properties.getSuggestions();
        this.clock = clock;
    }

    public EscalationResult escalateStale(String projectId, Integer days) {
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("projectId is required");
        }
        int effectiveDays = clampDays(days);
        Instant now = clock.instant();
        Instant cutoff = now.minus(Duration.ofDays(effectiveDays));

        List<Suggestion> stale = suggestionStore
            .findProposedCreatedBefore(projectId, cutoff, settings.getEscalationScanLimit());

        List<Suggestion> escalations = new ArrayList<>();
        for (Suggestion s : stale) {
            String triggerKey = triggerKey(s.id(), effectiveDays);
            if (suggestionStore.existsProposedWithTriggerKey(projectId, triggerKey)) {
                continue;
            }
            escalations.add(new Suggestion(
                UUID.randomUUID().toString(),
                projectId,
                null,
                s.targetArtifactId(),
                s.targetArtifactType(),
                SuggestionType.SLA_ESCALATION,
                null,
                "SLA: Suggestion has been proposed for more than " + effectiveDays + " days. "
                    + "Consider applying, rejecting, or escalating to an approver.",
                ESCALATION_CONFIDENCE,
                SuggestionStatus.PROPOSED,
                RULE_ID,
                RULE_VERSION,
                triggerKey,
                now));
        }

        suggestionStore.insertAll(escalations);
        log.info("Suggestion escalation for project {}: days={} scanned={} created={}",
            projectId, effectiveDays, stale.size(), escalations.size());
        return new EscalationResult(stale.size(), escalations.size(), effectiveDays, escalations);
    }

    int clampDays(Integer requested) {
        int value = requested == null ? settings.getEscalationDefaultDays() : requested;
        return Math.max(MIN_DAYS, Math.min(MAX_DAYS, value));
    }

    static String triggerKey(String suggestionId, int days) {
        return "sla.escalation." + suggestionId + "." + days + "d";
    }
}
