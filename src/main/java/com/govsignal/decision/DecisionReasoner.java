package com.govsignal.decision;

import com.govsignal.decision.signal.DecisionSignal;

import java.util.List;
import java.util.Optional;

/**
 * Optional higher-quality analysis path, typically backed by a generative model.
 * No implementation ships with the engine. When none is registered, when it
 * returns empty or when it throws, the rule-based analyzer answers instead.
 */
public interface DecisionReasoner {

    Optional<DecisionIntelligence> reason(String projectId, List<Decision> decisions, List<DecisionSignal> signals);
}
