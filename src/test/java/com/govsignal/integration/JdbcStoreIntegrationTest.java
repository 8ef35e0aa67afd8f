package com.govsignal.integration;

import com.govsignal.contract.ArtifactEvent;
import com.govsignal.decision.Decision;
import com.govsignal.decision.DecisionImpact;
import com.govsignal.decision.DecisionOption;
import com.govsignal.decision.DecisionStatus;
import com.govsignal.decision.DecisionStore;
import com.govsignal.decision.JdbcDecisionStore;
import com.govsignal.event.ArtifactEventStore;
import com.govsignal.event.JdbcArtifactEventStore;
import com.govsignal.orchestrator.OrchestratorWorker;
import com.govsignal.sla.ApprovalSource;
import com.govsignal.sla.PendingStep;
import com.govsignal.sla.PendingStepStore;
import com.govsignal.sla.SlaCacheBuilder;
import com.govsignal.sla.SlaCacheRow;
import com.govsignal.sla.SlaCacheStore;
import com.govsignal.sla.SlaPolicy;
import com.govsignal.sla.SlaPolicyStore;
import com.govsignal.sla.SlaStatus;
import com.govsignal.suggestion.Suggestion;
import com.govsignal.suggestion.SuggestionStatus;
import com.govsignal.suggestion.SuggestionStore;
import com.govsignal.suggestion.SuggestionType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static com.govsignal.support.DecisionBuilder.decision;
import static org.junit.jupiter.api.Assertions.*;

/**
 * The jdbc profile against an in-memory H2 database in PostgreSQL mode,
 * initialised from schema.sql.
 */
@SpringBootTest
@ActiveProfiles("jdbc")
@TestPropertySource(properties = {
    "spring.datasource.url=jdbc:h2:mem:governance;MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1",
    "spring.datasource.driver-class-name=org.h2.Driver",
    "spring.datasource.username=sa",
    "spring.datasource.password="
})
class JdbcStoreIntegrationTest {

    private static final Duration LEASE = Duration.ofMinutes(5);

    @Autowired JdbcTemplate jdbcTemplate;
    @Autowired ArtifactEventStore eventStore;
    @Autowired SuggestionStore suggestionStore;
    @Autowired PendingStepStore pendingStepStore;
    @Autowired SlaPolicyStore policyStore;
    @Autowired SlaCacheStore cacheStore;
    @Autowired SlaCacheBuilder cacheBuilder;
    @Autowired DecisionStore decisionStore;
    @Autowired OrchestratorWorker worker;

    private String projectId;

    @BeforeEach
    void setUp() {
        projectId = "proj-" + UUID.randomUUID().toString().substring(0, 8);
    }

    @Test
    void jdbcProfile_wiresJdbcStores() {
        assertInstanceOf(JdbcArtifactEventStore.class, eventStore);
        assertInstanceOf(JdbcDecisionStore.class, decisionStore);
    }

    @Test
    @DisplayName("Claim is a compare-and-set with a lease")
    void claim_isExclusiveUntilLeaseExpires() {
        Instant t0 = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        ArtifactEvent event = eventStore.append(event(t0.minus(Duration.ofDays(1))));

        assertTrue(eventStore.claim(event.getId(), "w1", t0, t0.plus(LEASE)));
        assertFalse(eventStore.claim(event.getId(), "w2", t0.plusSeconds(1), t0.plusSeconds(1).plus(LEASE)));

        Instant afterLease = t0.plus(LEASE).plusSeconds(1);
        assertTrue(eventStore.claim(event.getId(), "w2", afterLease, afterLease.plus(LEASE)));

        ArtifactEvent stored = eventStore.findById(event.getId()).orElseThrow();
        assertEquals("w2", stored.getClaimedBy());
        assertEquals(2, stored.getAttempts());
        assertEquals("Apollo", stored.getPayload().get("name"));
    }

    @Test
    @DisplayName("Completion writes only land for the current claim holder")
    void reclaimedEvent_rejectsStaleHolderCompletion() {
        Instant t0 = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        ArtifactEvent event = eventStore.append(event(t0.minus(Duration.ofDays(1))));
        eventStore.claim(event.getId(), "w1", t0, t0.plus(LEASE));
        Instant later = t0.plus(LEASE).plusSeconds(60);
        assertTrue(eventStore.claim(event.getId(), "w2", later, later.plus(LEASE)));

        assertFalse(eventStore.markProcessed(event.getId(), "w1", later));
        assertFalse(eventStore.markFailed(event.getId(), "w1", "late failure", false, later));
        assertTrue(eventStore.markProcessed(event.getId(), "w2", later));
        assertFalse(eventStore.markProcessed(event.getId(), "w2", later.plusSeconds(1)));

        ArtifactEvent stored = eventStore.findById(event.getId()).orElseThrow();
        assertEquals(later, stored.getProcessedAt());
        assertNull(stored.getProcessError());
    }

    @Test
    void quarantinedEvent_isNeverFetchedAgain() {
        Instant t0 = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        ArtifactEvent event = eventStore.append(event(t0.minus(Duration.ofDays(1))));
        eventStore.claim(event.getId(), "w1", t0, t0.plus(LEASE));
        assertTrue(eventStore.markFailed(event.getId(), "w1", "payload.stakeholders must be a list", true, t0));

        ArtifactEvent stored = eventStore.findById(event.getId()).orElseThrow();
        assertNotNull(stored.getQuarantinedAt());
        assertNull(stored.getClaimedBy());
        assertTrue(eventStore.findUnprocessed(1000, t0.plus(Duration.ofDays(1))).stream()
            .noneMatch(e -> e.getId().equals(event.getId())));
    }

    @Test
    @DisplayName("Orchestrator batch commits suggestions and processed_at together")
    void orchestratorBatch_onJdbc() {
        ArtifactEvent event = eventStore.append(event(Instant.now().minus(Duration.ofDays(30))));

        worker.runBatch(50, false);

        ArtifactEvent stored = eventStore.findById(event.getId()).orElseThrow();
        assertNotNull(stored.getProcessedAt());
        assertNull(stored.getProcessError());
        List<Suggestion> suggestions = suggestionStore.findBySourceEvent(event.getId());
        assertEquals(3, suggestions.size());
        assertTrue(suggestions.stream().allMatch(s -> s.status() == SuggestionStatus.PROPOSED));
    }

    @Test
    void suggestions_roundTripPatchAndTriggerKey() {
        Instant createdAt = Instant.now().minus(Duration.ofDays(10)).truncatedTo(ChronoUnit.MILLIS);
        Suggestion patch = new Suggestion(UUID.randomUUID().toString(), projectId, null, null, "raid",
            SuggestionType.PATCH, Map.of("type", "raid.add", "data", Map.of("impact", "High")),
            "High-influence stakeholder", 0.82, SuggestionStatus.PROPOSED, "stakeholder-engagement-risk", "v1",
            "sla.escalation.abc.7d", createdAt);
        suggestionStore.insertAll(List.of(patch));

        Suggestion read = suggestionStore.findByProject(projectId).get(0);
        assertEquals(patch.id(), read.id());
        assertEquals("raid.add", read.patch().get("type"));
        assertEquals(SuggestionType.PATCH, read.suggestionType());
        assertEquals(createdAt, read.createdAt());

        Suggestion escalation = new Suggestion(UUID.randomUUID().toString(), projectId, null, null, "raid",
            SuggestionType.SLA_ESCALATION, null, "SLA: stale", 0.9, SuggestionStatus.PROPOSED, "stale-suggestion-escalation",
            "v1", "sla.escalation.other.7d", createdAt.minus(Duration.ofDays(5)));
        suggestionStore.insertAll(List.of(escalation));

        assertEquals(List.of(patch.id()), suggestionStore.findProposedCreatedBefore(projectId, Instant.now(), 1)
            .stream().map(Suggestion::id).toList());
        assertTrue(suggestionStore.existsProposedWithTriggerKey(projectId, "sla.escalation.abc.7d"));
        assertFalse(suggestionStore.existsProposedWithTriggerKey(projectId, "sla.escalation.abc.3d"));
    }

    @Test
    @DisplayName("Pending steps exclude decided ones and carry the group name")
    void pendingSteps_andCacheRebuild() {
        jdbcTemplate.update("DELETE FROM artifact_approval_decisions");
        jdbcTemplate.update("DELETE FROM artifact_approval_steps");
        jdbcTemplate.update("DELETE FROM adhoc_approvals");
        jdbcTemplate.update("DELETE FROM approval_sla_config");

        Instant now = Instant.now();
        String groupId = "grp-" + projectId;
        jdbcTemplate.update("INSERT INTO approval_groups (id, name) VALUES (?, ?)", groupId, "Change Board");
        jdbcTemplate.update("INSERT INTO artifact_approval_steps "
                + "(id, project_id, artifact_type, stage_key, status, submitted_at, approver_group_id) "
                + "VALUES (?, ?, 'project_charter', 'sponsor', 'pending', ?, ?)",
            "step-open", projectId, now.minus(Duration.ofHours(80)).atOffset(ZoneOffset.UTC), groupId);
        jdbcTemplate.update("INSERT INTO artifact_approval_steps "
                + "(id, project_id, artifact_type, stage_key, status, submitted_at, approver_user_id) "
                + "VALUES (?, ?, 'project_charter', 'sponsor', 'pending', ?, 'u1')",
            "step-decided", projectId, now.minus(Duration.ofHours(80)).atOffset(ZoneOffset.UTC));
        jdbcTemplate.update("INSERT INTO artifact_approval_decisions (id, step_id, decided_at) VALUES (?, ?, ?)",
            "dec-1", "step-decided", now.atOffset(ZoneOffset.UTC));
        jdbcTemplate.update("INSERT INTO adhoc_approvals "
                + "(id, project_id, artifact_type, status, requested_at, approver_user_id) "
                + "VALUES (?, ?, 'raid', 'pending', ?, 'u2')",
            "adhoc-1", projectId, now.minus(Duration.ofHours(1)).atOffset(ZoneOffset.UTC));
        policyStore.save(new SlaPolicy(projectId, "raid", null, 48, 12, 0, true));

        List<PendingStep> steps = pendingStepStore.findPendingArtifactSteps();
        assertEquals(List.of("step-open"), steps.stream().map(PendingStep::id).toList());
        assertEquals("Change Board", steps.get(0).approverGroupName());
        PendingStep adHoc = pendingStepStore.findPendingAdHocApprovals().get(0);
        assertEquals(ApprovalSource.AD_HOC, adHoc.source());
        assertNull(adHoc.stageKey());

        assertEquals(2, cacheBuilder.rebuild().cache());
        assertEquals(2, cacheBuilder.rebuild().cache());

        List<SlaCacheRow> rows = cacheStore.findCacheRows();
        assertEquals(2, rows.size());
        SlaCacheRow charter = rows.stream().filter(r -> r.stepId().equals("step-open")).findFirst().orElseThrow();
        assertEquals(SlaStatus.BREACHED, charter.slaStatus());
        assertEquals("Change Board", charter.approverLabel());
        SlaCacheRow raid = rows.stream().filter(r -> r.stepId().equals("adhoc-1")).findFirst().orElseThrow();
        assertEquals(48, raid.slaHours());
        assertEquals(ApprovalSource.AD_HOC, raid.source());
        assertEquals(2, cacheStore.findBottlenecks().size());
    }

    @Test
    void decisions_roundTripAndUpdateInPlace() {
        Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        Decision first = decision("dec-" + projectId, now)
            .ref("D-002")
            .impact(DecisionImpact.HIGH)
            .neededBy(LocalDate.of(2026, 5, 1))
            .options(List.of(new DecisionOption("o1", "Buy", "fast", "cost", true)))
            .build();
        Decision earlier = decision("dec-early-" + projectId, now)
            .ref("D-001")
            .dateRaised(LocalDate.of(2026, 1, 1))
            .build();
        decisionStore.save(projectId, first);
        decisionStore.save(projectId, earlier);

        List<Decision> log = decisionStore.findByProject(projectId);
        assertEquals(List.of("D-001", "D-002"), log.stream().map(Decision::ref).toList());
        Decision read = log.get(1);
        assertEquals(DecisionImpact.HIGH, read.impact());
        assertEquals(LocalDate.of(2026, 5, 1), read.neededByDate());
        assertEquals("Buy", read.optionsConsidered().get(0).title());
        assertEquals(now, read.lastUpdated());

        decisionStore.save(projectId, decision("dec-" + projectId, now)
            .ref("D-002").status(DecisionStatus.APPROVED).build());

        List<Decision> updated = decisionStore.findByProject(projectId);
        assertEquals(2, updated.size());
        assertEquals(DecisionStatus.APPROVED, updated.get(1).status());
    }

    private ArtifactEvent event(Instant createdAt) {
        return new ArtifactEvent(UUID.randomUUID().toString(), projectId, "charter-1", "project_charter",
            "updated", Map.of("name", "Apollo"), createdAt);
    }
}
