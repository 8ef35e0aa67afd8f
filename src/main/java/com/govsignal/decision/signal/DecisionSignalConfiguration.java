package com.govsignal.decision.signal;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class DecisionSignalConfiguration {

    /**
     * The eight decision-log detectors, in reporting order. New detectors are
     * added to this list.
     */
    @Bean
    public DecisionSignalDetector decisionSignalDetector() {
        return new DecisionSignalDetector(List.of(
            new OverdueDecisionRule(),
            new StaleDecisionRule(),
            new HighImpactUnownedRule(),
            new WeakRationaleRule(),
            new ImplementationOverdueRule(),
            new CategoryClusterRule(),
            new ReversalRiskRule(),
            new PendingEscalationRule()
        ));
    }
}
