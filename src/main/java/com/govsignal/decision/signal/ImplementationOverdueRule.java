package com.govsignal.decision.signal;

import com.govsignal.decision.Decision;
import com.govsignal.decision.DecisionDates;
import com.govsignal.decision.DecisionStatus;

import java.time.Instant;

/** Approved, but the implementation date has already gone by. */
public class ImplementationOverdueRule extends CountingSignalRule {

    public ImplementationOverdueRule() {
        super(SignalCode.IMPLEMENTATION_OVERDUE, SignalSeverity.CRITICAL, "Implementation Overdue");
    }

    @Override
    protected boolean matches(Decision d, Instant now) {
        return d.status() == DecisionStatus.APPROVED
            && d.implementationDate() != null
            && DecisionDates.daysUntil(d.implementationDate(), now) < 0;
    }

    @Override
    protected String detail(int count) {
        return count + " approved decision" + (count > 1 ? "s" : "") + " past implementation date";
    }
}
