package com.govsignal.decision;

import com.govsignal.decision.signal.DecisionSignal;

import java.time.Instant;
import java.util.List;

public record DecisionIntelligenceReport(
    String projectId,
    DecisionIntelligence result,
    List<DecisionSignal> signals,
    Instant generatedAt
) {}
