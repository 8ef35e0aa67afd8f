package com.govsignal.decision.signal;

import com.govsignal.decision.Decision;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs a fixed list of detectors over the open decisions of a log.
 * Signal order follows rule order. Pure and safe to share between threads.
 */
public class DecisionSignalDetector {

    private final List<DecisionSignalRule> rules;

    public DecisionSignalDetector(List<DecisionSignalRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public List<DecisionSignal> detect(List<Decision> decisions, Instant now) {
        List<Decision> open = decisions.stream().filter(Decision::isOpen).toList();
        List<DecisionSignal> signals = new ArrayList<>();
        for (DecisionSignalRule rule : rules) {
            signals.addAll(rule.evaluate(open, now));
        }
        return signals;
    }

    public List<DecisionSignalRule> getRules() {
        return rules;
    }
}
