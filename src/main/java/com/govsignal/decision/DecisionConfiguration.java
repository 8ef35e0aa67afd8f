package com.govsignal.decision;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DecisionConfiguration {

    @Bean
    public DecisionRuleBasedAnalyzer decisionRuleBasedAnalyzer() {
        return new DecisionRuleBasedAnalyzer();
    }
}
