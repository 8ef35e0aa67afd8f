package com.govsignal.suggestion;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * The engine only ever creates {@link #PROPOSED}; acceptance and rejection are
 * recorded by the suggestion review feature.
 */
public enum SuggestionStatus {
    PROPOSED("proposed"),
    ACCEPTED("accepted"),
    REJECTED("rejected");

    private final String value;

    SuggestionStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static SuggestionStatus fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown suggestion status: " + raw));
    }
}
