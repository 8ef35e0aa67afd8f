package com.govsignal.decision.signal;

import com.govsignal.decision.Decision;
import com.govsignal.decision.DecisionDates;

import java.time.Instant;

public class StaleDecisionRule extends CountingSignalRule {

    static final int STALE_DAYS = 21;

    public StaleDecisionRule() {
        super(SignalCode.DECISION_STALE, SignalSeverity.WARNING, "Stale Decisions");
    }

    @Override
    protected boolean matches(Decision d, Instant now) {
        return d.lastUpdated() != null && DecisionDates.daysSince(d.lastUpdated(), now) > STALE_DAYS;
    }

    @Override
    protected String detail(int count) {
        return decisions(count) + " not updated in " + STALE_DAYS + "+ days";
    }
}
