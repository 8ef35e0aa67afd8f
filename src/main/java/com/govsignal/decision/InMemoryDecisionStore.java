package com.govsignal.decision;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
@ConditionalOnProperty(prefix = "governance.store", name = "type", havingValue = "memory", matchIfMissing = true)
public class InMemoryDecisionStore implements DecisionStore {

    private final Map<String, Map<String, Decision>> byProject = new ConcurrentHashMap<>();

    @Override
    public List<Decision> findByProject(String projectId) {
        Map<String, Decision> decisions = byProject.get(projectId);
        if (decisions == null) {
            return List.of();
        }
        synchronized (decisions) {
            return new ArrayList<>(decisions.values());
        }
    }

    /** Replaces a decision with the same id, keeping its position. */
    @Override
    public void save(String projectId, Decision decision) {
        Map<String, Decision> decisions = byProject.computeIfAbsent(projectId, k -> new LinkedHashMap<>());
        synchronized (decisions) {
            decisions.put(decision.id(), decision);
        }
    }

    public void clear() {
        byProject.clear();
    }
}
