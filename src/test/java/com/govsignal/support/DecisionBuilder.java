package com.govsignal.support;

import com.govsignal.decision.Decision;
import com.govsignal.decision.DecisionImpact;
import com.govsignal.decision.DecisionOption;
import com.govsignal.decision.DecisionStatus;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Fluent test fixture for decisions. Defaults describe a well-kept, recently
 * updated, owned, low-impact open decision that triggers no signal.
 */
public class DecisionBuilder {

    private final String id;
    private String ref;
    private String title = "Adopt managed database";
    private String context = "Current self-hosted cluster needs a major upgrade before Q3.";
    private String rationale = "Managed service removes upgrade toil and meets the availability target.";
    private String category = "Technical";
    private DecisionStatus status = DecisionStatus.OPEN;
    private DecisionImpact impact = DecisionImpact.LOW;
    private String impactDescription = "Moves hosting cost into opex";
    private String owner = "Dana";
    private String approver;
    private List<DecisionOption> options = new ArrayList<>(List.of(
        new DecisionOption("o1", "Managed", "less toil", "cost", true),
        new DecisionOption("o2", "Self-hosted", "control", "toil", false)));
    private LocalDate dateRaised;
    private LocalDate neededByDate;
    private LocalDate implementationDate;
    private LocalDate reviewDate;
    private boolean reversible;
    private Instant lastUpdated;

    private DecisionBuilder(String id, Instant now) {
        this.id = id;
        this.ref = "D-" + id;
        this.dateRaised = LocalDate.ofInstant(now, ZoneOffset.UTC);
        this.lastUpdated = now;
    }

    public static DecisionBuilder decision(String id, Instant now) {
        return new DecisionBuilder(id, now);
    }

    public DecisionBuilder ref(String value) { this.ref = value; return this; }
    public DecisionBuilder title(String value) { this.title = value; return this; }
    public DecisionBuilder context(String value) { this.context = value; return this; }
    public DecisionBuilder rationale(String value) { this.rationale = value; return this; }
    public DecisionBuilder category(String value) { this.category = value; return this; }
    public DecisionBuilder status(DecisionStatus value) { this.status = value; return this; }
    public DecisionBuilder impact(DecisionImpact value) { this.impact = value; return this; }
    public DecisionBuilder impactDescription(String value) { this.impactDescription = value; return this; }
    public DecisionBuilder owner(String value) { this.owner = value; return this; }
    public DecisionBuilder approver(String value) { this.approver = value; return this; }
    public DecisionBuilder options(List<DecisionOption> value) { this.options = value; return this; }
    public DecisionBuilder dateRaised(LocalDate value) { this.dateRaised = value; return this; }
    public DecisionBuilder neededBy(LocalDate value) { this.neededByDate = value; return this; }
    public DecisionBuilder implementationDate(LocalDate value) { this.implementationDate = value; return this; }
    public DecisionBuilder reviewDate(LocalDate value) { this.reviewDate = value; return this; }
    public DecisionBuilder reversible(boolean value) { this.reversible = value; return this; }
    public DecisionBuilder lastUpdated(Instant value) { this.lastUpdated = value; return this; }

    public Decision build() {
        return new Decision(id, ref, title, context, rationale, "Go with option one", category, status, impact,
            impactDescription, owner, approver, options, dateRaised, neededByDate, null, implementationDate,
            reviewDate, reversible, lastUpdated);
    }
}
