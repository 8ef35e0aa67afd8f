package com.govsignal.orchestrator;

import com.govsignal.config.GovernanceProperties;
import com.govsignal.contract.ArtifactEvent;
import com.govsignal.event.ArtifactEventStore;
import com.govsignal.routing.RuleRouter;
import com.govsignal.routing.SuggestionDraft;
import com.govsignal.suggestion.Suggestion;
import com.govsignal.suggestion.SuggestionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Drains unprocessed artifact events oldest-first, one at a time.
 *
 * Per event: claim (compare-and-set), route, then insert the drafted
 * suggestions and mark the event processed as one unit of work. Any failure is
 * written to process_error and leaves processed_at null, so the event is retried
 * by a later batch until it reaches the attempt ceiling and is quarantined.
 * A failing event never stops the rest of the batch. Completion writes only
 * land while this worker still holds the claim; an event whose lease ran out
 * and was taken over is skipped and left to the new holder.
 */
@Service
public class OrchestratorWorker {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorWorker.class);

    private static final int MAX_ERROR_LENGTH = 1000;

    private final ArtifactEventStore eventStore;
    private final SuggestionStore suggestionStore;
    private final RuleRouter router;
    private final TransactionOperations transactions;
    private final GovernanceProperties.Orchestrator settings;
    private final Clock clock;

    public OrchestratorWorker(ArtifactEventStore eventStore,
                              SuggestionStore suggestionStore,
                              RuleRouter router,
                              TransactionOperations transactions,
                              GovernanceProperties properties,
                              Clock clock) {
        this.eventStore = eventStore;
        this.suggestionStore = suggestionStore;
        this.router = router;
        this.transactions = transactions;
        this.settings = properties.getOrchestrator();
        this.clock = clock;
    }

    /**
     * @param limit requested batch size, clamped to [1, max-limit]; null means the configured default
     * @param dryRun route only, claim and write nothing
     */
    public BatchResult runBatch(Integer limit, boolean dryRun) {
        int effectiveLimit = clampLimit(limit);
        Instant startedAt = clock.instant();
        Instant deadline = startedAt.plus(settings.getMaxBatchDuration());

        List<ArtifactEvent> events = eventStore.findUnprocessed(effectiveLimit, startedAt);

        int processed = 0;
        int failed = 0;
        int skipped = 0;
        int quarantined = 0;
        int suggestionsCreated = 0;
        String lastEventId = null;

        for (ArtifactEvent event : events) {
            if (clock.instant().isAfter(deadline)) {
                log.warn("Batch time budget {} exhausted; leaving {} event(s) for the next batch",
                    settings.getMaxBatchDuration(), events.size() - processed - failed - skipped);
                break;
            }

            if (dryRun) {
                lastEventId = event.getId();
                try {
                    suggestionsCreated += router.route(event).size();
                    processed++;
                } catch (RuntimeException ex) {
                    failed++;
                    log.warn("Dry run: routing failed for event_id={}: {}", event.getId(), errorMessage(ex));
                }
                continue;
            }

            Instant leaseUntil;
            try {
                leaseUntil = claim(event);
            } catch (RuntimeException ex) {
                failed++;
                log.warn("Could not claim event_id={}: {}", event.getId(), errorMessage(ex));
                continue;
            }
            if (leaseUntil == null) {
                skipped++;
                continue;
            }
            lastEventId = event.getId();

            try {
                suggestionsCreated += process(event, leaseUntil);
                processed++;
            } catch (ClaimLostException ex) {
                skipped++;
                log.warn("{}; leaving the event to its new holder", ex.getMessage());
            } catch (RuntimeException ex) {
                failed++;
                if (recordFailure(event, ex)) {
                    quarantined++;
                }
            }
        }

        BatchResult result = new BatchResult(processed, failed, skipped, quarantined,
            suggestionsCreated, lastEventId, effectiveLimit, dryRun);
        log.info("Orchestrator batch done: fetched={} processed={} failed={} skipped={} quarantined={} "
                + "suggestions={} dry_run={}",
            events.size(), processed, failed, skipped, quarantined, suggestionsCreated, dryRun);
        return result;
    }

    /**
     * @return the lease expiry, or null when another worker holds or has completed the event
     */
    private Instant claim(ArtifactEvent event) {
        Instant now = clock.instant();
        Instant leaseUntil = now.plus(settings.getClaimLease());
        if (!eventStore.claim(event.getId(), settings.getWorkerId(), now, leaseUntil)) {
            log.debug("Event {} already claimed or completed elsewhere; skipping", event.getId());
            return null;
        }
        return leaseUntil;
    }

    private int process(ArtifactEvent event, Instant leaseUntil) {
        List<SuggestionDraft> drafts = router.route(event);
        Instant createdAt = clock.instant();
        List<Suggestion> suggestions = drafts.stream()
            .map(d -> d.toSuggestion(UUID.randomUUID().toString(), createdAt))
            .toList();

        transactions.executeWithoutResult(status -> {
            Instant now = clock.instant();
            if (now.isAfter(leaseUntil)) {
                throw new ClaimLostException(event.getId(), leaseUntil);
            }
            if (!suggestions.isEmpty()) {
                suggestionStore.insertAll(suggestions);
            }
            // rolls the insert back when a rival took the event over
            if (!eventStore.markProcessed(event.getId(), settings.getWorkerId(), now)) {
                throw new ClaimLostException(event.getId(), leaseUntil);
            }
        });
        return suggestions.size();
    }

    /**
     * @return true when the event was quarantined
     */
    private boolean recordFailure(ArtifactEvent event, RuntimeException cause) {
        int attempts = event.getAttempts() + 1;
        boolean quarantine = attempts >= settings.getMaxAttempts();
        String error = errorMessage(cause);
        try {
            if (!eventStore.markFailed(event.getId(), settings.getWorkerId(), error, quarantine, clock.instant())) {
                log.warn("Event {} failed after its claim moved to another worker; not recording: {}",
                    event.getId(), error);
                return false;
            }
        } catch (RuntimeException ex) {
            log.error("Could not record failure for event_id={} (original error: {})", event.getId(), error, ex);
            return false;
        }
        if (quarantine) {
            log.warn("Event {} quarantined after {} attempt(s): {}", event.getId(), attempts, error);
        } else {
            log.warn("Event {} failed on attempt {}/{}: {}", event.getId(), attempts,
                settings.getMaxAttempts(), error);
        }
        return quarantine;
    }

    int clampLimit(Integer requested) {
        int value = requested == null ? settings.getDefaultLimit() : requested;
        return Math.max(1, Math.min(settings.getMaxLimit(), value));
    }

    private static String errorMessage(RuntimeException ex) {
        String message = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
        return message.length() > MAX_ERROR_LENGTH ? message.substring(0, MAX_ERROR_LENGTH) : message;
    }
}
