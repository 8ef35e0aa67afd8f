package com.govsignal.contract;

/**
 * Raised when an artifact event does not have the shape the engine relies on.
 * A programming-contract violation, not an expected absence of data.
 */
public class InvalidEventException extends RuntimeException {

    public InvalidEventException(String message) {
        super(message);
    }
}
