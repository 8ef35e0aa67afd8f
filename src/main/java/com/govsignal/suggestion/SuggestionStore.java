package com.govsignal.suggestion;

import java.time.Instant;
import java.util.List;

public interface SuggestionStore {

    /** Inserts all rows or none of them. */
    void insertAll(List<Suggestion> suggestions);

    List<Suggestion> findByProject(String projectId);

    List<Suggestion> findBySourceEvent(String sourceEventId);

    /**
     * Oldest-first proposed suggestions of a project created strictly before {@code cutoff},
     * excluding SLA escalations. The limit applies after that exclusion.
     */
    List<Suggestion> findProposedCreatedBefore(String projectId, Instant cutoff, int limit);

    boolean existsProposedWithTriggerKey(String projectId, String triggerKey);
}
