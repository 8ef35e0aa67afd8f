package com.govsignal.sla;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * A unit of approval work that has not been decided yet. Read-only to the engine.
 *
 * @param approverGroupName display name of the approver group, when known
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PendingStep(
    String id,
    ApprovalSource source,
    String projectId,
    String artifactType,
    String stageKey,
    Instant submittedAt,
    Instant dueAt,
    String approverUserId,
    String approverGroupId,
    String approverGroupName
) {}
