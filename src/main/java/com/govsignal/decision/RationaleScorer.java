package com.govsignal.decision;

/**
 * Deterministic 0-5 proxy for how well a decision is documented.
 */
public final class RationaleScorer {

    public static final int MAX_SCORE = 5;

    private RationaleScorer() {}

    public static int score(Decision d) {
        int score = 0;
        int rationaleLength = trimmedLength(d.rationale());
        if (rationaleLength > 30) {
            score += 2;
        } else if (rationaleLength > 0) {
            score += 1;
        }
        if (trimmedLength(d.context()) > 20) {
            score += 1;
        }
        if (d.optionsConsidered().size() >= 2) {
            score += 1;
        }
        if (trimmedLength(d.impactDescription()) > 10) {
            score += 1;
        }
        return Math.min(MAX_SCORE, score);
    }

    public static String assessment(int score) {
        if (score >= 4) {
            return "Well documented with context and options";
        }
        if (score >= 3) {
            return "Adequate rationale, could be strengthened";
        }
        if (score >= 2) {
            return "Rationale present but thin";
        }
        return "Rationale missing or insufficient";
    }

    private static int trimmedLength(String text) {
        return text == null ? 0 : text.trim().length();
    }
}
