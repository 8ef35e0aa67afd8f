package com.govsignal.sla;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Resolves the SLA policy, due date and breach classification of a pending step.
 * Pure: no I/O, and {@code now} is always supplied by the caller.
 */
public class SlaResolver {

    private static final double MILLIS_PER_HOUR = 3_600_000d;

    private final SlaPolicy defaults;
    private final Duration riskWindow;

    public SlaResolver(SlaPolicy defaults, Duration riskWindow) {
        this.defaults = defaults;
        this.riskWindow = riskWindow;
    }

    /**
     * Picks the matching policy with the highest specificity. Equal specificity
     * keeps the first match in list order.
     */
    public Optional<SlaPolicy> selectPolicy(PendingStep step, List<SlaPolicy> policies) {
        SlaPolicy best = null;
        int bestScore = -1;
        for (SlaPolicy policy : policies) {
            if (!policy.active() || !policy.matches(step)) {
                continue;
            }
            int score = policy.specificity();
            if (score > bestScore) {
                best = policy;
                bestScore = score;
            }
        }
        return Optional.ofNullable(best);
    }

    public SlaResolution resolve(PendingStep step, List<SlaPolicy> policies, Instant now) {
        SlaPolicy policy = selectPolicy(step, policies).orElse(defaults);

        Instant dueAt = step.dueAt();
        if (dueAt == null && step.submittedAt() != null) {
            dueAt = step.submittedAt().plus(Duration.ofHours(policy.slaHours()));
        }
        if (dueAt == null) {
            return new SlaResolution(null, SlaStatus.UNKNOWN, null, null, policy);
        }

        Long hoursOverdue = now.isAfter(dueAt) ? hoursBetween(dueAt, now) : null;
        return new SlaResolution(dueAt, classify(dueAt, policy, now), hoursBetween(now, dueAt), hoursOverdue, policy);
    }

    /**
     * overdue_undecided needs a grace period that has also run out; without
     * grace a step past due stays breached.
     */
    SlaStatus classify(Instant dueAt, SlaPolicy policy, Instant now) {
        Instant breachAt = dueAt.plus(Duration.ofHours(policy.breachGraceHours()));
        Instant warnAt = dueAt.minus(Duration.ofHours(policy.warnHours()));

        if (policy.breachGraceHours() > 0 && now.isAfter(breachAt)) {
            return SlaStatus.OVERDUE_UNDECIDED;
        }
        if (!now.isBefore(dueAt)) {
            return SlaStatus.BREACHED;
        }
        if (!now.isBefore(warnAt) || !dueAt.isAfter(now.plus(riskWindow))) {
            return SlaStatus.AT_RISK;
        }
        return SlaStatus.OK;
    }

    static long hoursBetween(Instant from, Instant to) {
        return Math.round(Duration.between(from, to).toMillis() / MILLIS_PER_HOUR);
    }
}
