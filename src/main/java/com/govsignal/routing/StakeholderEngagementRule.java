package com.govsignal.routing;

import com.govsignal.contract.ArtifactEvent;
import com.govsignal.contract.InvalidEventException;
import com.govsignal.suggestion.SuggestionType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Stakeholders with high influence but less than high interest are an
 * engagement risk. Each one yields a RAID risk patch; if any exist, one
 * dashboard narrative flags the aggregate.
 */
public class StakeholderEngagementRule implements SuggestionRule {

    static final double RAID_PATCH_CONFIDENCE = 0.82;
    static final double DASHBOARD_CONFIDENCE = 0.75;

    private static final String UNNAMED = "Unnamed stakeholder";

    @Override
    public String ruleId() {
        return "stakeholder-engagement-risk";
    }

    @Override
    public String ruleVersion() {
        return "v1";
    }

    @Override
    public List<SuggestionDraft> draft(ArtifactEvent event) {
        List<SuggestionDraft> drafts = new ArrayList<>();
        List<String> namedRisks = new ArrayList<>();
        int imbalanced = 0;

        for (Map<?, ?> stakeholder : stakeholders(event)) {
            if (!isImbalanced(stakeholder)) {
                continue;
            }
            imbalanced++;
            String name = text(stakeholder.get("name"));
            if (!name.isEmpty()) {
                namedRisks.add(name);
            }
            drafts.add(raidRiskPatch(event, name.isEmpty() ? UNNAMED : name, stakeholder.get("owner")));
        }

        if (imbalanced > 0) {
            drafts.add(dashboardNarrative(event, namedRisks, imbalanced));
        }
        return drafts;
    }

    static boolean isImbalanced(Map<?, ?> stakeholder) {
        String influence = text(stakeholder.get("influence")).toLowerCase(Locale.ROOT);
        String interest = text(stakeholder.get("interest")).toLowerCase(Locale.ROOT);
        return "high".equals(influence) && !"high".equals(interest);
    }

    private SuggestionDraft raidRiskPatch(ArtifactEvent event, String name, Object owner) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("category", "Stakeholder");
        data.put("description", name + " may block or delay progress due to low engagement.");
        data.put("impact", "High");
        data.put("probability", "Medium");
        data.put("mitigation", "Increase engagement cadence and clarify expectations.");
        data.put("owner", owner instanceof String s && !s.isBlank() ? s : null);

        Map<String, Object> patch = new LinkedHashMap<>();
        patch.put("type", "raid.add");
        patch.put("data", data);

        return new SuggestionDraft(
            event.getProjectId(),
            event.getId(),
            null,
            "raid",
            SuggestionType.PATCH,
            patch,
            "High-influence stakeholder (" + name + ") shows low engagement. "
                + "Risk of late escalation or delivery blockage.",
            RAID_PATCH_CONFIDENCE,
            ruleId(),
            ruleVersion());
    }

    private SuggestionDraft dashboardNarrative(ArtifactEvent event, List<String> names, int count) {
        String who = names.isEmpty()
            ? count + " stakeholder" + (count > 1 ? "s" : "")
            : String.join(", ", names);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("message", "Stakeholder risk increasing: " + who
            + " have high influence but insufficient engagement.");
        data.put("severity", "amber");

        Map<String, Object> patch = new LinkedHashMap<>();
        patch.put("type", "dashboard.narrative");
        patch.put("data", data);

        return new SuggestionDraft(
            event.getProjectId(),
            event.getId(),
            null,
            "dashboard",
            SuggestionType.NARRATIVE,
            patch,
            "Stakeholder engagement imbalance detected",
            DASHBOARD_CONFIDENCE,
            ruleId(),
            ruleVersion());
    }

    private static List<Map<?, ?>> stakeholders(ArtifactEvent event) {
        Map<String, Object> payload = event.getPayload();
        Object raw = payload == null ? null : payload.get("stakeholders");
        if (raw == null) {
            return List.of();
        }
        if (!(raw instanceof List<?> list)) {
            throw new InvalidEventException("payload.stakeholders must be a list, got "
                + raw.getClass().getSimpleName());
        }
        List<Map<?, ?>> entries = new ArrayList<>();
        for (Object item : list) {
            if (item instanceof Map<?, ?> entry) {
                entries.add(entry);
            }
        }
        return entries;
    }

    private static String text(Object value) {
        return value == null ? "" : String.valueOf(value).trim();
    }
}
