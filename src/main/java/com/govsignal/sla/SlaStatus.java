package com.govsignal.sla;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Breach classification of a pending approval step. For a fixed due date the
 * classification only moves forward in time: ok, at_risk, breached, overdue_undecided.
 */
public enum SlaStatus {
    OK("ok", 0),
    AT_RISK("at_risk", 1),
    BREACHED("breached", 2),
    OVERDUE_UNDECIDED("overdue_undecided", 3),
    UNKNOWN("unknown", -1);

    private final String value;
    private final int progression;

    SlaStatus(String value, int progression) {
        this.value = value;
        this.progression = progression;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** Position on the ok → overdue_undecided path; -1 for unknown. */
    public int progression() {
        return progression;
    }

    /** Counted as breached in the bottleneck aggregate. */
    public boolean isBreached() {
        return this == BREACHED || this == OVERDUE_UNDECIDED;
    }

    @JsonCreator
    public static SlaStatus fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown SLA status: " + raw));
    }
}
