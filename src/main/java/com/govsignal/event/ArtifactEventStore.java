package com.govsignal.event;

import com.govsignal.contract.ArtifactEvent;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only log of artifact lifecycle events plus the orchestrator's
 * processing bookkeeping. Events are never deleted.
 */
public interface ArtifactEventStore {

    ArtifactEvent append(ArtifactEvent event);

    boolean existsById(String eventId);

    Optional<ArtifactEvent> findById(String eventId);

    /**
     * Oldest-first unprocessed events that are neither quarantined nor held by a
     * live claim at {@code now}.
     */
    List<ArtifactEvent> findUnprocessed(int limit, Instant now);

    /**
     * Atomically claims the event for one worker. Succeeds only while the event is
     * unprocessed, not quarantined and not held by an unexpired claim; a successful
     * claim increments the attempt counter.
     *
     * @return true when this caller now owns the event until {@code leaseUntil}
     */
    boolean claim(String eventId, String workerId, Instant now, Instant leaseUntil);

    /**
     * Sets processed_at, clears process_error and the claim, provided the event is
     * still unprocessed and claimed by {@code workerId}.
     *
     * @return false when the claim has passed to another worker or the event is already processed
     */
    boolean markProcessed(String eventId, String workerId, Instant processedAt);

    /**
     * Records the failure, releases the claim and leaves processed_at null.
     * When {@code quarantine} is true the event is also parked for good.
     * Only applies while {@code workerId} still holds the claim.
     *
     * @return false when the claim has passed to another worker
     */
    boolean markFailed(String eventId, String workerId, String error, boolean quarantine, Instant now);
}
