package com.govsignal.decision.signal;

import com.govsignal.decision.Decision;
import com.govsignal.decision.DecisionDates;
import com.govsignal.decision.DecisionStatus;

import java.time.Instant;

public class PendingEscalationRule extends CountingSignalRule {

    static final int ESCALATION_DAYS = 14;

    public PendingEscalationRule() {
        super(SignalCode.PENDING_ESCALATION, SignalSeverity.WARNING, "Pending Escalation");
    }

    @Override
    protected boolean matches(Decision d, Instant now) {
        return (d.status() == DecisionStatus.OPEN || d.status() == DecisionStatus.PENDING)
            && d.impact().isHighOrCritical()
            && d.dateRaised() != null
            && DecisionDates.daysSince(d.dateRaised(), now) > ESCALATION_DAYS;
    }

    @Override
    protected String detail(int count) {
        return count + " high-impact decision" + (count > 1 ? "s" : "") + " open for "
            + ESCALATION_DAYS + "+ days without resolution";
    }
}
