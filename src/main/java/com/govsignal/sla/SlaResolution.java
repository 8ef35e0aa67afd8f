package com.govsignal.sla;

import java.time.Instant;

/**
 * @param dueAt explicit or derived due date; null when neither due nor submitted time is known
 * @param hoursToDue whole hours from now to due, negative once overdue; null without a due date
 * @param hoursOverdue whole hours past due; null unless now is after due
 * @param policy the policy that was applied (the defaults when none matched)
 */
public record SlaResolution(
    Instant dueAt,
    SlaStatus status,
    Long hoursToDue,
    Long hoursOverdue,
    SlaPolicy policy
) {}
