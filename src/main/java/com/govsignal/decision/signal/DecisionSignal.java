package com.govsignal.decision.signal;

import java.util.List;

/**
 * Derived finding over a decision log. Computed per request and never stored.
 *
 * @param affectedIds every decision that triggered the signal, in log order
 */
public record DecisionSignal(
    SignalCode code,
    SignalSeverity severity,
    String label,
    String detail,
    List<String> affectedIds
) {

    public DecisionSignal {
        affectedIds = List.copyOf(affectedIds);
    }
}
