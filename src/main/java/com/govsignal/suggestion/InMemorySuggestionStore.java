package com.govsignal.suggestion;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

@Component
@ConditionalOnProperty(prefix = "governance.store", name = "type", havingValue = "memory", matchIfMissing = true)
public class InMemorySuggestionStore implements SuggestionStore {

    private final CopyOnWriteArrayList<Suggestion> suggestions = new CopyOnWriteArrayList<>();

    @Override
    public void insertAll(List<Suggestion> batch) {
        suggestions.addAll(List.copyOf(batch));
    }

    @Override
    public List<Suggestion> findByProject(String projectId) {
        return suggestions.stream()
            .filter(s -> projectId.equals(s.projectId()))
            .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public List<Suggestion> findBySourceEvent(String sourceEventId) {
        return suggestions.stream()
            .filter(s -> sourceEventId.equals(s.sourceEventId()))
            .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public List<Suggestion> findProposedCreatedBefore(String projectId, Instant cutoff, int limit) {
        return suggestions.stream()
            .filter(s -> projectId.equals(s.projectId()))
            .filter(s -> s.status() == SuggestionStatus.PROPOSED)
            .filter(s -> s.suggestionType() != SuggestionType.SLA_ESCALATION)
            .filter(s -> s.createdAt() != null && s.createdAt().isBefore(cutoff))
            .sorted(Comparator.comparing(Suggestion::createdAt))
            .limit(Math.max(0, limit))
            .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public boolean existsProposedWithTriggerKey(String projectId, String triggerKey) {
        return suggestions.stream()
            .anyMatch(s -> projectId.equals(s.projectId())
                && s.status() == SuggestionStatus.PROPOSED
                && triggerKey.equals(s.triggerKey()));
    }
}
