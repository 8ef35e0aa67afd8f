package com.govsignal.decision.signal;

import com.govsignal.decision.Decision;

import java.time.Instant;
import java.util.List;

/**
 * Base for detectors that raise one signal listing every matching decision.
 */
abstract class CountingSignalRule implements DecisionSignalRule {

    private final SignalCode code;
    private final SignalSeverity severity;
    private final String label;

    protected CountingSignalRule(SignalCode code, SignalSeverity severity, String label) {
        this.code = code;
        this.severity = severity;
        this.label = label;
    }

    @Override
    public SignalCode code() {
        return code;
    }

    @Override
    public List<DecisionSignal> evaluate(List<Decision> openDecisions, Instant now) {
        List<String> affected = openDecisions.stream()
            .filter(d -> matches(d, now))
            .map(Decision::id)
            .toList();
        if (affected.isEmpty()) {
            return List.of();
        }
        return List.of(new DecisionSignal(code, severity, label, detail(affected.size()), affected));
    }

    protected abstract boolean matches(Decision decision, Instant now);

    protected abstract String detail(int count);

    static String decisions(int count) {
        return count + " decision" + (count > 1 ? "s" : "");
    }
}
