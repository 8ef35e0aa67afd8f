package com.govsignal.decision;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Whole-day distances, rounded to the nearest day. Calendar dates are taken at
 * UTC midnight.
 */
public final class DecisionDates {

    private static final double MILLIS_PER_DAY = 86_400_000d;

    private DecisionDates() {}

    /** Negative when the date is in the past. */
    public static long daysUntil(LocalDate date, Instant now) {
        return Math.round((startOfDay(date).toEpochMilli() - now.toEpochMilli()) / MILLIS_PER_DAY);
    }

    public static long daysSince(LocalDate date, Instant now) {
        return daysSince(startOfDay(date), now);
    }

    public static long daysSince(Instant then, Instant now) {
        return Math.round((now.toEpochMilli() - then.toEpochMilli()) / MILLIS_PER_DAY);
    }

    private static Instant startOfDay(LocalDate date) {
        return date.atStartOfDay(ZoneOffset.UTC).toInstant();
    }
}
