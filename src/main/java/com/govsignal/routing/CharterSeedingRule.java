package com.govsignal.routing;

import com.govsignal.contract.ArtifactEvent;
import com.govsignal.suggestion.SuggestionType;

import java.util.List;

/**
 * A created or updated project charter seeds the stakeholder register, the
 * schedule and the RAID log. Advisory only: the drafts carry no patch.
 */
public class CharterSeedingRule implements SuggestionRule {

    static final double STAKEHOLDER_CONFIDENCE = 0.75;
    static final double SCHEDULE_CONFIDENCE = 0.72;
    static final double RAID_CONFIDENCE = 0.70;

    @Override
    public String ruleId() {
        return "charter-seeds-downstream";
    }

    @Override
    public String ruleVersion() {
        return "v1";
    }

    @Override
    public List<SuggestionDraft> draft(ArtifactEvent event) {
        return List.of(
            narrative(event, "stakeholder_register", STAKEHOLDER_CONFIDENCE,
                "Charter changed. Suggest seeding stakeholder register with sponsor, PM, customer reps, "
                    + "delivery leads, and key approvers."),
            narrative(event, "schedule", SCHEDULE_CONFIDENCE,
                "Charter changed. Suggest drafting initial milestones (kickoff, design complete, build complete, "
                    + "UAT, go-live) aligned to start/end dates."),
            narrative(event, "raid", RAID_CONFIDENCE,
                "Charter changed. Suggest seeding RAID with typical startup risks (resource availability, "
                    + "approvals, scope creep, environment access, vendor lead times).")
        );
    }

    private SuggestionDraft narrative(ArtifactEvent event, String target, double confidence, String rationale) {
        return new SuggestionDraft(
            event.getProjectId(),
            event.getId(),
            null,
            target,
            SuggestionType.NARRATIVE,
            null,
            rationale,
            confidence,
            ruleId(),
            ruleVersion());
    }
}
