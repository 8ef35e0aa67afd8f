package com.govsignal.sla;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Objects;

/**
 * SLA configuration row. A null scope field matches any value.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SlaPolicy(
    String projectId,
    String artifactType,
    String stageKey,
    int slaHours,
    int warnHours,
    int breachGraceHours,
    boolean active
) {

    public SlaPolicy {
        if (slaHours < 0 || warnHours < 0 || breachGraceHours < 0) {
            throw new IllegalArgumentException("SLA hours must not be negative");
        }
    }

    public static SlaPolicy defaults(int slaHours, int warnHours, int breachGraceHours) {
        return new SlaPolicy(null, null, null, slaHours, warnHours, breachGraceHours, true);
    }

    /** True when every non-null scope field equals the step's value. */
    public boolean matches(PendingStep step) {
        return (projectId == null || projectId.equals(step.projectId()))
            && (artifactType == null || artifactType.equals(step.artifactType()))
            && (stageKey == null || stageKey.equals(step.stageKey()));
    }

    /** Project scope outweighs artifact type, which outweighs stage. */
    public int specificity() {
        return (projectId != null ? 4 : 0)
            + (artifactType != null ? 2 : 0)
            + (stageKey != null ? 1 : 0);
    }

    @Override
    public String toString() {
        return "SlaPolicy[" + Objects.toString(projectId, "*") + "/" + Objects.toString(artifactType, "*")
            + "/" + Objects.toString(stageKey, "*") + " sla=" + slaHours + "h]";
    }
}
