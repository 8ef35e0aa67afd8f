package com.govsignal.decision;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Structured briefing over a decision log.
 *
 * @param fallback true when produced by the rule-based analyzer instead of a reasoner
 */
public record DecisionIntelligence(
    String headline,
    Rag rag,
    String narrative,
    List<KeyDecision> keyDecisions,
    List<PendingRisk> pendingRisks,
    List<PmAction> pmActions,
    List<String> earlyWarnings,
    boolean fallback
) {

    public DecisionIntelligence {
        keyDecisions = keyDecisions == null ? List.of() : List.copyOf(keyDecisions);
        pendingRisks = pendingRisks == null ? List.of() : List.copyOf(pendingRisks);
        pmActions = pmActions == null ? List.of() : List.copyOf(pmActions);
        earlyWarnings = earlyWarnings == null ? List.of() : List.copyOf(earlyWarnings);
    }

    public record KeyDecision(
        String ref,
        String title,
        int rationaleScore,
        String rationaleAssessment,
        String impactAssessment,
        Urgency urgency
    ) {}

    public record PendingRisk(String ref, String risk, String recommendation) {}

    public record PmAction(String action, Priority priority, String timeframe) {}

    public enum Rag {
        GREEN, AMBER, RED;

        @JsonValue
        public String getValue() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Rag fromValue(String raw) {
            return raw == null ? null : valueOf(raw.trim().toUpperCase(Locale.ROOT));
        }
    }

    public enum Urgency {
        IMMEDIATE, THIS_WEEK, THIS_SPRINT, MONITOR;

        @JsonValue
        public String getValue() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Urgency fromValue(String raw) {
            if (raw == null) {
                return null;
            }
            return Arrays.stream(values())
                .filter(v -> v.getValue().equalsIgnoreCase(raw))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown urgency: " + raw));
        }
    }

    public enum Priority {
        HIGH, MEDIUM, LOW;

        @JsonValue
        public String getValue() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Priority fromValue(String raw) {
            return raw == null ? null : valueOf(raw.trim().toUpperCase(Locale.ROOT));
        }
    }
}
