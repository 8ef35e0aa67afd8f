package com.govsignal.decision;

/** One alternative weighed before a decision was made. */
public record DecisionOption(String id, String title, String pros, String cons, boolean selected) {}
