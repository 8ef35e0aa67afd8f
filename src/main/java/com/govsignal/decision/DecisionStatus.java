package com.govsignal.decision;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum DecisionStatus {
    OPEN("open"),
    PENDING("pending"),
    APPROVED("approved"),
    IMPLEMENTED("implemented"),
    DEFERRED("deferred"),
    REJECTED("rejected"),
    SUPERSEDED("superseded");

    private final String value;

    DecisionStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** Implemented, rejected and superseded decisions need no further attention. */
    public boolean isTerminal() {
        return this == IMPLEMENTED || this == REJECTED || this == SUPERSEDED;
    }

    @JsonCreator
    public static DecisionStatus fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown decision status: " + raw));
    }
}
