package com.govsignal.decision.signal;

import com.govsignal.decision.Decision;
import com.govsignal.decision.RationaleScorer;

import java.time.Instant;

public class WeakRationaleRule extends CountingSignalRule {

    static final int WEAK_SCORE = 2;

    public WeakRationaleRule() {
        super(SignalCode.RATIONALE_WEAK, SignalSeverity.WARNING, "Weak Rationale");
    }

    @Override
    protected boolean matches(Decision d, Instant now) {
        return RationaleScorer.score(d) <= WEAK_SCORE;
    }

    @Override
    protected String detail(int count) {
        return decisions(count) + " have insufficient rationale or context";
    }
}
