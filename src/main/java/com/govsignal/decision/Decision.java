package com.govsignal.decision;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Entry of a project decision log. Owned by the decision log feature; the
 * engine only reads it.
 *
 * @param ref          human reference such as {@code D-001}
 * @param decision     the decision statement itself
 * @param neededByDate deadline for making the decision
 * @param reviewDate   scheduled review of a reversible decision
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Decision(
    String id,
    String ref,
    String title,
    String context,
    String rationale,
    String decision,
    String category,
    DecisionStatus status,
    DecisionImpact impact,
    String impactDescription,
    String owner,
    String approver,
    List<DecisionOption> optionsConsidered,
    LocalDate dateRaised,
    LocalDate neededByDate,
    LocalDate approvedDate,
    LocalDate implementationDate,
    LocalDate reviewDate,
    boolean reversible,
    Instant lastUpdated
) {

    public Decision {
        Objects.requireNonNull(id, "decision id is required");
        Objects.requireNonNull(status, "decision status is required");
        Objects.requireNonNull(impact, "decision impact is required");
        optionsConsidered = optionsConsidered == null ? List.of() : List.copyOf(optionsConsidered);
    }

    public boolean isOpen() {
        return !status.isTerminal();
    }

    public boolean hasOwner() {
        return owner != null && !owner.isBlank();
    }
}
