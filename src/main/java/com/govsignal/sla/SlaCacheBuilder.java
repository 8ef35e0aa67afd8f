package com.govsignal.sla;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Batch job that classifies every pending approval and rewrites the SLA cache
 * and the bottleneck table in one commit.
 */
@Service
public class SlaCacheBuilder {

    private static final Logger log = LoggerFactory.getLogger(SlaCacheBuilder.class);

    private final PendingStepStore pendingStepStore;
    private final SlaPolicyStore policyStore;
    private final SlaCacheStore cacheStore;
    private final SlaResolver resolver;
    private final Clock clock;

    public SlaCacheBuilder(PendingStepStore pendingStepStore,
                           SlaPolicyStore policyStore,
                           SlaCacheStore cacheStore,
                           SlaResolver resolver,
                           Clock clock) {
        this.pendingStepStore = pendingStepStore;
        this.policyStore = policyStore;
        this.cacheStore = cacheStore;
        this.resolver = resolver;
        this.clock = clock;
    }

    public RebuildResult rebuild() {
        return rebuild(clock.instant());
    }

    public RebuildResult rebuild(Instant now) {
        List<SlaPolicy> policies = policyStore.findActive();

        List<PendingStep> steps = new ArrayList<>(pendingStepStore.findPendingArtifactSteps());
        steps.addAll(pendingStepStore.findPendingAdHocApprovals());

        List<SlaCacheRow> rows = new ArrayList<>(steps.size());
        int skipped = 0;
        for (PendingStep step : steps) {
            if (step.projectId() == null) {
                skipped++;
                continue;
            }
            rows.add(toRow(step, resolver.resolve(step, policies, now), now));
        }

        List<BottleneckRow> bottlenecks = BottleneckAggregator.aggregate(rows, now);
        cacheStore.replaceAll(rows, bottlenecks);

        log.info("SLA cache rebuilt: rows={} bottlenecks={} skippedWithoutProject={} policies={}",
            rows.size(), bottlenecks.size(), skipped, policies.size());
        return new RebuildResult(rows.size(), bottlenecks.size(), now);
    }

    private static SlaCacheRow toRow(PendingStep step, SlaResolution resolution, Instant now) {
        return new SlaCacheRow(
            step.id(),
            step.source(),
            step.projectId(),
            step.artifactType(),
            step.stageKey(),
            step.approverUserId(),
            step.approverGroupId(),
            approverLabel(step),
            step.submittedAt(),
            resolution.dueAt(),
            resolution.status(),
            resolution.hoursToDue(),
            resolution.hoursOverdue(),
            resolution.policy().slaHours(),
            now);
    }

    static String approverLabel(PendingStep step) {
        if (step.approverUserId() != null) {
            return "User:" + step.approverUserId();
        }
        if (step.approverGroupName() != null && !step.approverGroupName().isBlank()) {
            return step.approverGroupName();
        }
        if (step.approverGroupId() != null) {
            return "Group:" + step.approverGroupId();
        }
        return "Unassigned";
    }
}
