package com.govsignal.orchestrator;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Outcome of one orchestrator batch.
 *
 * @param processed events routed and marked processed (in a dry run: routed without error)
 * @param failed events whose routing or persistence failed; they keep processed_at null
 * @param skipped events another worker claimed first
 * @param quarantined failed events that reached the attempt ceiling in this batch
 * @param suggestionsCreated suggestions persisted (in a dry run: drafted)
 * @param lastEventId id of the last event this batch attempted, null when none
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BatchResult(
    int processed,
    int failed,
    int skipped,
    int quarantined,
    int suggestionsCreated,
    String lastEventId,
    int limit,
    boolean dryRun
) {}
