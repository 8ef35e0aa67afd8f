package com.govsignal.sla;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * Per-approver workload aggregate; {@code blockerScore = breached*5 + atRisk*2 + open}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BottleneckRow(
    String approverUserId,
    String approverGroupId,
    String approverLabel,
    int openSteps,
    int breachedSteps,
    int atRiskSteps,
    long maxHoursOverdue,
    int blockerScore,
    Instant computedAt
) {

    public static int scoreOf(int breached, int atRisk, int open) {
        return breached * 5 + atRisk * 2 + open;
    }
}
