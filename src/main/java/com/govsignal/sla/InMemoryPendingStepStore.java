package com.govsignal.sla;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory pending approvals, fed by {@link #add(PendingStep)} and drained by
 * {@link #resolve(String)} when a decision is recorded.
 */
@Component
@ConditionalOnProperty(prefix = "governance.store", name = "type", havingValue = "memory", matchIfMissing = true)
public class InMemoryPendingStepStore implements PendingStepStore {

    private final CopyOnWriteArrayList<PendingStep> steps = new CopyOnWriteArrayList<>();

    @Override
    public List<PendingStep> findPendingArtifactSteps() {
        return steps.stream().filter(s -> s.source() == ApprovalSource.ARTIFACT_STEP).toList();
    }

    @Override
    public List<PendingStep> findPendingAdHocApprovals() {
        return steps.stream().filter(s -> s.source() == ApprovalSource.AD_HOC).toList();
    }

    public void add(PendingStep step) {
        steps.add(step);
    }

    public void resolve(String stepId) {
        steps.removeIf(s -> s.id().equals(stepId));
    }

    public void clear() {
        steps.clear();
    }
}
