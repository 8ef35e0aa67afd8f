package com.govsignal.orchestrator;

import java.time.Instant;

/**
 * Thrown when a worker's claim on an event expired or passed to another worker
 * before its results were committed.
 */
class ClaimLostException extends RuntimeException {

    ClaimLostException(String eventId, Instant leaseUntil) {
        super("Claim on event " + eventId + " lost (lease until " + leaseUntil + ")");
    }
}
