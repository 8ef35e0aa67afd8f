package com.govsignal.routing;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RoutingConfiguration {

    @Bean
    public RuleRouter ruleRouter() {
        return new RuleRouter(new CharterSeedingRule(), new StakeholderEngagementRule());
    }
}
