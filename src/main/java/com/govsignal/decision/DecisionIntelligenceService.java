package com.govsignal.decision;

import com.govsignal.decision.signal.DecisionSignal;
import com.govsignal.decision.signal.DecisionSignalDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Signals plus briefing for a project's decision log. Performs no writes.
 */
@Service
public class DecisionIntelligenceService {

    private static final Logger log = LoggerFactory.getLogger(DecisionIntelligenceService.class);

    private final DecisionSignalDetector detector;
    private final DecisionRuleBasedAnalyzer analyzer;
    private final ObjectProvider<DecisionReasoner> reasoner;
    private final DecisionStore decisionStore;
    private final Clock clock;

    public DecisionIntelligenceService(DecisionSignalDetector detector,
                                       DecisionRuleBasedAnalyzer analyzer,
                                       ObjectProvider<DecisionReasoner> reasoner,
                                       DecisionStore decisionStore,
                                       Clock clock) {
        this.detector = detector;
        this.analyzer = analyzer;
        this.reasoner = reasoner;
        this.decisionStore = decisionStore;
        this.clock = clock;
    }

    public DecisionIntelligenceReport analyzeStored(String projectId) {
        return analyze(projectId, decisionStore.findByProject(projectId));
    }

    public DecisionIntelligenceReport analyze(String projectId, List<Decision> decisions) {
        Instant now = clock.instant();
        List<DecisionSignal> signals = detector.detect(decisions, now);
        DecisionIntelligence result = reason(projectId, decisions, signals)
            .orElseGet(() -> analyzer.analyze(decisions, signals, now));
        log.debug("Decision intelligence for project {}: decisions={} signals={} rag={} fallback={}",
            projectId, decisions.size(), signals.size(), result.rag(), result.fallback());
        return new DecisionIntelligenceReport(projectId, result, signals, now);
    }

    private Optional<DecisionIntelligence> reason(String projectId, List<Decision> decisions,
                                                  List<DecisionSignal> signals) {
        DecisionReasoner available = reasoner.getIfAvailable();
        if (available == null) {
            return Optional.empty();
        }
        try {
            return available.reason(projectId, decisions, signals);
        } catch (RuntimeException ex) {
            log.warn("Decision reasoner failed for project {}, using rule-based analysis: {}",
                projectId, ex.getMessage());
            return Optional.empty();
        }
    }
}
