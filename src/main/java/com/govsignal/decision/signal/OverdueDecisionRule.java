package com.govsignal.decision.signal;

import com.govsignal.decision.Decision;
import com.govsignal.decision.DecisionDates;

import java.time.Instant;

/** Needed-by date has passed and the decision is still open. */
public class OverdueDecisionRule extends CountingSignalRule {

    public OverdueDecisionRule() {
        super(SignalCode.DECISION_OVERDUE, SignalSeverity.CRITICAL, "Decisions Overdue");
    }

    @Override
    protected boolean matches(Decision d, Instant now) {
        return d.neededByDate() != null && DecisionDates.daysUntil(d.neededByDate(), now) < 0;
    }

    @Override
    protected String detail(int count) {
        return decisions(count) + " past needed-by date";
    }
}
