package com.govsignal.decision.signal;

import com.govsignal.decision.Decision;

import java.time.Instant;

public class HighImpactUnownedRule extends CountingSignalRule {

    public HighImpactUnownedRule() {
        super(SignalCode.HIGH_IMPACT_UNOWNED, SignalSeverity.CRITICAL, "High Impact Unowned");
    }

    @Override
    protected boolean matches(Decision d, Instant now) {
        return d.impact().isHighOrCritical() && !d.hasOwner();
    }

    @Override
    protected String detail(int count) {
        return count + " high/critical impact decision" + (count > 1 ? "s" : "") + " have no owner";
    }
}
