package com.govsignal.api;

/**
 * Thrown when a producer appends an event whose id already exists in the
 * event log (idempotency protection).
 */
public class DuplicateEventException extends RuntimeException {

    public DuplicateEventException(String eventId) {
        super("event id already exists: " + eventId);
    }
}
