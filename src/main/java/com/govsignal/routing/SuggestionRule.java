package com.govsignal.routing;

import com.govsignal.contract.ArtifactEvent;

import java.util.List;

/**
 * A deterministic rule that turns one artifact event into suggestion drafts.
 * Rules are versioned and must be pure functions (no I/O, no clock, no randomness).
 */
public interface SuggestionRule {

    /** Unique identifier for this rule, e.g. "charter-seeds-downstream". */
    String ruleId();

    /** Semantic version, e.g. "v1". */
    String ruleVersion();

    /**
     * Drafts the suggestions for an event the router already classified for this rule.
     *
     * @return zero or more drafts, never null
     */
    List<SuggestionDraft> draft(ArtifactEvent event);
}
