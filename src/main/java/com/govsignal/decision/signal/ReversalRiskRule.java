package com.govsignal.decision.signal;

import com.govsignal.decision.Decision;
import com.govsignal.decision.DecisionStatus;

import java.time.Instant;

public class ReversalRiskRule extends CountingSignalRule {

    public ReversalRiskRule() {
        super(SignalCode.REVERSAL_RISK, SignalSeverity.WARNING, "Reversal Risk");
    }

    @Override
    protected boolean matches(Decision d, Instant now) {
        return d.reversible() && d.status() == DecisionStatus.APPROVED && d.reviewDate() == null;
    }

    @Override
    protected String detail(int count) {
        return count + " reversible decision" + (count > 1 ? "s" : "") + " approved with no review date scheduled";
    }
}
