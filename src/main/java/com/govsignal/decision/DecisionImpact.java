package com.govsignal.decision;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum DecisionImpact {
    LOW("low", 0),
    MEDIUM("medium", 1),
    HIGH("high", 2),
    CRITICAL("critical", 3);

    private final String value;
    private final int rank;

    DecisionImpact(String value, int rank) {
        this.value = value;
        this.rank = rank;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int rank() {
        return rank;
    }

    public boolean isHighOrCritical() {
        return this == HIGH || this == CRITICAL;
    }

    @JsonCreator
    public static DecisionImpact fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown decision impact: " + raw));
    }
}
