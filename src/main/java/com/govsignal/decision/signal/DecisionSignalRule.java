package com.govsignal.decision.signal;

import com.govsignal.decision.Decision;

import java.time.Instant;
import java.util.List;

/**
 * A single detector over the open part of a decision log.
 * Detectors are deterministic: same decisions and same {@code now}, same signals.
 */
public interface DecisionSignalRule {

    /** Code of the signals this rule raises. */
    SignalCode code();

    /**
     * @param openDecisions decisions not in a terminal status, in log order
     * @return zero or more signals; most rules raise at most one
     */
    List<DecisionSignal> evaluate(List<Decision> openDecisions, Instant now);
}
