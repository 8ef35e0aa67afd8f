package com.govsignal.decision;

import com.govsignal.decision.DecisionIntelligence.KeyDecision;
import com.govsignal.decision.DecisionIntelligence.PendingRisk;
import com.govsignal.decision.DecisionIntelligence.PmAction;
import com.govsignal.decision.DecisionIntelligence.Priority;
import com.govsignal.decision.DecisionIntelligence.Rag;
import com.govsignal.decision.DecisionIntelligence.Urgency;
import com.govsignal.decision.signal.DecisionSignal;
import com.govsignal.decision.signal.SignalSeverity;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Deterministic briefing over a decision log and its signals. Needs no external
 * service and always returns a complete result, so it backs every request
 * that a reasoner cannot answer.
 */
public class DecisionRuleBasedAnalyzer {

    static final int KEY_DECISION_LIMIT = 3;
    static final int PENDING_RISK_LIMIT = 2;
    static final int EARLY_WARNING_LIMIT = 3;

    public DecisionIntelligence analyze(List<Decision> decisions, List<DecisionSignal> signals, Instant now) {
        List<Decision> open = decisions.stream().filter(Decision::isOpen).toList();
        long critical = signals.stream().filter(s -> s.severity() == SignalSeverity.CRITICAL).count();
        long warnings = signals.stream().filter(s -> s.severity() == SignalSeverity.WARNING).count();

        List<Decision> overdue = open.stream()
            .filter(d -> d.neededByDate() != null && DecisionDates.daysUntil(d.neededByDate(), now) < 0)
            .toList();
        List<Decision> unowned = open.stream().filter(d -> !d.hasOwner()).toList();

        return new DecisionIntelligence(
            headline(critical, warnings),
            rag(critical, warnings),
            narrative(open, overdue.size(), unowned.size()),
            keyDecisions(open, now),
            pendingRisks(open),
            pmActions(overdue.size(), unowned.size()),
            signals.stream().limit(EARLY_WARNING_LIMIT).map(DecisionSignal::detail).toList(),
            true);
    }

    static Rag rag(long critical, long warnings) {
        if (critical > 0) {
            return Rag.RED;
        }
        return warnings >= 2 ? Rag.AMBER : Rag.GREEN;
    }

    static Urgency urgency(Decision d, Instant now) {
        if (d.neededByDate() == null) {
            return Urgency.MONITOR;
        }
        long daysUntil = DecisionDates.daysUntil(d.neededByDate(), now);
        if (daysUntil < 0) {
            return Urgency.IMMEDIATE;
        }
        if (daysUntil <= 7) {
            return Urgency.THIS_WEEK;
        }
        if (daysUntil <= 14) {
            return Urgency.THIS_SPRINT;
        }
        return Urgency.MONITOR;
    }

    private static String headline(long critical, long warnings) {
        if (critical > 0) {
            return critical + " critical decision signal" + plural(critical) + " require immediate action";
        }
        if (warnings > 0) {
            return warnings + " decision warning" + plural(warnings) + ": log needs attention";
        }
        return "Decision log is in good order";
    }

    private static String narrative(List<Decision> open, int overdue, int unowned) {
        Set<String> categories = new LinkedHashSet<>();
        open.forEach(d -> categories.add(d.category() == null ? "" : d.category()));

        StringBuilder text = new StringBuilder()
            .append(open.size()).append(" open decision").append(plural(open.size()))
            .append(" across ").append(categories.size())
            .append(categories.size() == 1 ? " category. " : " categories. ");
        if (overdue > 0) {
            text.append(overdue).append(overdue == 1 ? " decision is" : " decisions are")
                .append(" past needed-by date. ");
        }
        if (unowned > 0) {
            text.append(unowned).append(unowned == 1 ? " decision is" : " decisions are").append(" unowned.");
        } else {
            text.append("All decisions have owners.");
        }
        return text.toString();
    }

    private static List<KeyDecision> keyDecisions(List<Decision> open, Instant now) {
        return open.stream()
            .filter(d -> d.impact().isHighOrCritical())
            .sorted(Comparator.comparingInt((Decision d) -> d.impact().rank()).reversed())
            .limit(KEY_DECISION_LIMIT)
            .map(d -> {
                int score = RationaleScorer.score(d);
                return new KeyDecision(
                    d.ref(),
                    d.title(),
                    score,
                    RationaleScorer.assessment(score),
                    impactAssessment(d),
                    urgency(d, now));
            })
            .toList();
    }

    private static String impactAssessment(Decision d) {
        String impact = d.impact().getValue();
        String detail = d.impactDescription() == null || d.impactDescription().isBlank()
            ? "no impact detail provided"
            : d.impactDescription();
        return Character.toUpperCase(impact.charAt(0)) + impact.substring(1) + " impact: " + detail;
    }

    private static List<PendingRisk> pendingRisks(List<Decision> open) {
        return open.stream()
            .filter(d -> d.status() == DecisionStatus.PENDING && d.impact().isHighOrCritical())
            .limit(PENDING_RISK_LIMIT)
            .map(d -> new PendingRisk(
                d.ref(),
                "Pending " + d.impact().getValue() + " impact decision on " + d.title(),
                d.approver() != null && !d.approver().isBlank()
                    ? "Chase " + d.approver() + " for approval"
                    : "Assign approver and set deadline"))
            .toList();
    }

    private static List<PmAction> pmActions(int overdue, int unowned) {
        List<PmAction> actions = new ArrayList<>();
        if (overdue > 0) {
            actions.add(new PmAction("Resolve " + overdue + " overdue decision" + plural(overdue),
                Priority.HIGH, "Today"));
        }
        if (unowned > 0) {
            actions.add(new PmAction("Assign owners to unowned decisions", Priority.HIGH, "This week"));
        }
        actions.add(new PmAction("Strengthen rationale on weak decision records", Priority.MEDIUM, "This sprint"));
        return actions;
    }

    private static String plural(long count) {
        return count == 1 ? "" : "s";
    }
}
