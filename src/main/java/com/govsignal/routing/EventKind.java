package com.govsignal.routing;

import java.util.Locale;

/**
 * Closed set of event kinds the router has rules for. Anything else is
 * {@link #UNRECOGNIZED} and routes to no suggestions.
 */
public enum EventKind {
    PROJECT_CHARTER_CHANGED,
    STAKEHOLDER_REGISTER_CHANGED,
    UNRECOGNIZED;

    public static EventKind classify(String artifactType, String action) {
        String type = normalize(artifactType);
        String act = normalize(action);
        boolean changed = "created".equals(act) || "updated".equals(act);
        if (!changed) {
            return UNRECOGNIZED;
        }
        return switch (type) {
            case "project_charter" -> PROJECT_CHARTER_CHANGED;
            case "stakeholder_register" -> STAKEHOLDER_REGISTER_CHANGED;
            default -> UNRECOGNIZED;
        };
    }

    private static String normalize(String raw) {
        return raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
    }
}
