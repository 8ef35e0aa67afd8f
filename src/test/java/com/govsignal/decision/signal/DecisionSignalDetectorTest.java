package com.govsignal.decision.signal;

import com.govsignal.decision.Decision;
import com.govsignal.decision.DecisionImpact;
import com.govsignal.decision.DecisionStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static com.govsignal.support.DecisionBuilder.decision;
import static org.junit.jupiter.api.Assertions.*;

class DecisionSignalDetectorTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");
    private static final LocalDate TODAY = LocalDate.of(2026, 3, 10);

    private final DecisionSignalDetector detector = new DecisionSignalConfiguration().decisionSignalDetector();

    @Test
    void wellKeptLog_raisesNothing() {
        assertTrue(detector.detect(List.of(decision("d1", NOW).build(), decision("d2", NOW).build()), NOW).isEmpty());
    }

    @Test
    void emptyLog_raisesNothing() {
        assertTrue(detector.detect(List.of(), NOW).isEmpty());
    }

    @Nested
    @DisplayName("Individual detectors")
    class Detectors {

        @Test
        void neededByFiveDaysAgo_isOverdueAndCritical() {
            Decision d = decision("d1", NOW).neededBy(TODAY.minusDays(5)).build();

            DecisionSignal signal = only(detector.detect(List.of(d), NOW), SignalCode.DECISION_OVERDUE);

            assertEquals(SignalSeverity.CRITICAL, signal.severity());
            assertEquals(List.of("d1"), signal.affectedIds());
            assertEquals("1 decision past needed-by date", signal.detail());
        }

        @Test
        void neededByToday_isNotOverdue() {
            Decision d = decision("d1", NOW).neededBy(TODAY).build();
            assertTrue(detector.detect(List.of(d), NOW).isEmpty());
        }

        @Test
        void notUpdatedForMoreThan21Days_isStale() {
            Decision stale = decision("d1", NOW).lastUpdated(NOW.minus(Duration.ofDays(22))).build();
            Decision borderline = decision("d2", NOW).lastUpdated(NOW.minus(Duration.ofDays(21))).build();

            DecisionSignal signal = only(detector.detect(List.of(stale, borderline), NOW), SignalCode.DECISION_STALE);

            assertEquals(SignalSeverity.WARNING, signal.severity());
            assertEquals(List.of("d1"), signal.affectedIds());
        }

        @Test
        void highImpactWithoutOwner_isCritical() {
            Decision noOwner = decision("d1", NOW).category("Commercial").impact(DecisionImpact.CRITICAL).owner(null).build();
            Decision blankOwner = decision("d2", NOW).category("Technical").impact(DecisionImpact.HIGH).owner("  ").build();
            Decision lowNoOwner = decision("d3", NOW).category("Resourcing").impact(DecisionImpact.LOW).owner(null).build();

            DecisionSignal signal = only(detector.detect(List.of(noOwner, blankOwner, lowNoOwner), NOW),
                SignalCode.HIGH_IMPACT_UNOWNED);

            assertEquals(SignalSeverity.CRITICAL, signal.severity());
            assertEquals(List.of("d1", "d2"), signal.affectedIds());
            assertEquals("2 high/critical impact decisions have no owner", signal.detail());
        }

        @Test
        void scoreOfTwoOrLess_isWeakRationale() {
            Decision weak = decision("d1", NOW).rationale("x".repeat(40)).context(null).options(null)
                .impactDescription(null).build();

            DecisionSignal signal = only(detector.detect(List.of(weak), NOW), SignalCode.RATIONALE_WEAK);
            assertEquals(List.of("d1"), signal.affectedIds());
        }

        @Test
        void approvedPastImplementationDate_isCritical() {
            Decision d = decision("d1", NOW).status(DecisionStatus.APPROVED)
                .implementationDate(TODAY.minusDays(3)).reviewDate(TODAY.plusDays(30)).build();

            DecisionSignal signal = only(detector.detect(List.of(d), NOW), SignalCode.IMPLEMENTATION_OVERDUE);
            assertEquals(SignalSeverity.CRITICAL, signal.severity());
        }

        @Test
        void reversibleApprovedWithoutReview_isReversalRisk() {
            Decision d = decision("d1", NOW).status(DecisionStatus.APPROVED).reversible(true).build();
            Decision reviewed = decision("d2", NOW).status(DecisionStatus.APPROVED).reversible(true)
                .reviewDate(TODAY.plusDays(10)).build();

            DecisionSignal signal = only(detector.detect(List.of(d, reviewed), NOW), SignalCode.REVERSAL_RISK);
            assertEquals(List.of("d1"), signal.affectedIds());
        }

        @Test
        void highImpactPendingForMoreThan14Days_needsEscalation() {
            Decision old = decision("d1", NOW).category("Commercial").status(DecisionStatus.PENDING).impact(DecisionImpact.HIGH)
                .dateRaised(TODAY.minusDays(15)).build();
            Decision recent = decision("d2", NOW).category("Technical").status(DecisionStatus.OPEN).impact(DecisionImpact.HIGH)
                .dateRaised(TODAY.minusDays(13)).build();
            Decision oldButLow = decision("d3", NOW).category("Resourcing").status(DecisionStatus.OPEN).impact(DecisionImpact.MEDIUM)
                .dateRaised(TODAY.minusDays(40)).build();

            DecisionSignal signal = only(detector.detect(List.of(old, recent, oldButLow), NOW),
                SignalCode.PENDING_ESCALATION);
            assertEquals(List.of("d1"), signal.affectedIds());
        }
    }

    @Nested
    @DisplayName("Category clustering")
    class Clustering {

        @Test
        void threeOpenInOneCategory_raisesCluster() {
            List<Decision> log = List.of(
                decision("d1", NOW).category("Commercial").build(),
                decision("d2", NOW).category("Commercial").build(),
                decision("d3", NOW).category("Commercial").build(),
                decision("d4", NOW).category("Technical").build());

            DecisionSignal signal = only(detector.detect(log, NOW), SignalCode.CLUSTER_CONCENTRATION);

            assertEquals("Commercial Decision Cluster", signal.label());
            assertEquals(SignalSeverity.WARNING, signal.severity());
            assertEquals(List.of("d1", "d2", "d3"), signal.affectedIds());
        }

        @Test
        void terminalDecisions_doNotCount() {
            List<Decision> log = List.of(
                decision("d1", NOW).category("Commercial").build(),
                decision("d2", NOW).category("Commercial").build(),
                decision("d3", NOW).category("Commercial").status(DecisionStatus.IMPLEMENTED).build(),
                decision("d4", NOW).category("Commercial").status(DecisionStatus.SUPERSEDED).build());

            assertTrue(detector.detect(log, NOW).isEmpty());
        }

        @Test
        void oneSignalPerClusteredCategory() {
            List<Decision> log = List.of(
                decision("a1", NOW).category("Scope").build(),
                decision("a2", NOW).category("Scope").build(),
                decision("a3", NOW).category("Scope").build(),
                decision("b1", NOW).category("Resource").build(),
                decision("b2", NOW).category("Resource").build(),
                decision("b3", NOW).category("Resource").build());

            List<DecisionSignal> clusters = detector.detect(log, NOW).stream()
                .filter(s -> s.code() == SignalCode.CLUSTER_CONCENTRATION).toList();
            assertEquals(List.of("Scope Decision Cluster", "Resource Decision Cluster"),
                clusters.stream().map(DecisionSignal::label).toList());
        }
    }

    @Test
    @DisplayName("Decisions in a terminal status never raise a signal")
    void terminalDecisions_areIgnoredByEveryDetector() {
        for (DecisionStatus terminal : List.of(DecisionStatus.IMPLEMENTED, DecisionStatus.REJECTED,
                DecisionStatus.SUPERSEDED)) {
            Decision neglected = decision("d1", NOW)
                .status(terminal)
                .impact(DecisionImpact.CRITICAL)
                .owner(null)
                .rationale(null).context(null).options(null).impactDescription(null)
                .neededBy(TODAY.minusDays(30))
                .implementationDate(TODAY.minusDays(30))
                .dateRaised(TODAY.minusDays(90))
                .lastUpdated(NOW.minus(Duration.ofDays(90)))
                .reversible(true)
                .build();
            assertTrue(detector.detect(List.of(neglected), NOW).isEmpty(), "signal raised for " + terminal);
        }
    }

    @Test
    void signalsFollowRuleOrder() {
        Decision d = decision("d1", NOW)
            .impact(DecisionImpact.HIGH)
            .owner(null)
            .neededBy(TODAY.minusDays(2))
            .lastUpdated(NOW.minus(Duration.ofDays(30)))
            .build();

        assertEquals(List.of(SignalCode.DECISION_OVERDUE, SignalCode.DECISION_STALE, SignalCode.HIGH_IMPACT_UNOWNED),
            detector.detect(List.of(d), NOW).stream().map(DecisionSignal::code).toList());
    }

    private static DecisionSignal only(List<DecisionSignal> signals, SignalCode code) {
        assertEquals(1, signals.size(), "expected exactly one signal but got " + signals);
        assertEquals(code, signals.get(0).code());
        return signals.get(0);
    }
}
