package com.govsignal.sla;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * Materialized SLA state of one pending step, rebuilt wholesale on every run.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SlaCacheRow(
    String stepId,
    ApprovalSource source,
    String projectId,
    String artifactType,
    String stageKey,
    String approverUserId,
    String approverGroupId,
    String approverLabel,
    Instant submittedAt,
    Instant dueAt,
    SlaStatus slaStatus,
    Long hoursToDue,
    Long hoursOverdue,
    int slaHours,
    Instant computedAt
) {}
