package com.govsignal.sla;

import java.util.List;

/**
 * Undecided approval work. Both sources exclude anything that already has a decision.
 */
public interface PendingStepStore {

    List<PendingStep> findPendingArtifactSteps();

    List<PendingStep> findPendingAdHocApprovals();
}
