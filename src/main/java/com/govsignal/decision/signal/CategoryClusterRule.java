package com.govsignal.decision.signal;

import com.govsignal.decision.Decision;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Three or more open decisions in one category point at a systemic issue
 * rather than a single bad decision. Raises one signal per such category.
 */
public class CategoryClusterRule implements DecisionSignalRule {

    static final int CLUSTER_THRESHOLD = 3;
    static final String UNCATEGORISED = "Other";

    @Override
    public SignalCode code() {
        return SignalCode.CLUSTER_CONCENTRATION;
    }

    @Override
    public List<DecisionSignal> evaluate(List<Decision> openDecisions, Instant now) {
        Map<String, List<String>> byCategory = new LinkedHashMap<>();
        for (Decision d : openDecisions) {
            String category = d.category() == null || d.category().isBlank() ? UNCATEGORISED : d.category();
            byCategory.computeIfAbsent(category, k -> new ArrayList<>()).add(d.id());
        }

        List<DecisionSignal> signals = new ArrayList<>();
        byCategory.forEach((category, ids) -> {
            if (ids.size() >= CLUSTER_THRESHOLD) {
                signals.add(new DecisionSignal(
                    SignalCode.CLUSTER_CONCENTRATION,
                    SignalSeverity.WARNING,
                    category + " Decision Cluster",
                    ids.size() + " open decisions concentrated in \"" + category + "\", systemic issue likely",
                    ids));
            }
        });
        return signals;
    }
}
