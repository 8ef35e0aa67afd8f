package com.govsignal.sla;

import com.govsignal.config.GovernanceProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SlaConfiguration {

    @Bean
    public SlaResolver slaResolver(GovernanceProperties properties) {
        GovernanceProperties.Sla sla = properties.getSla();
        SlaPolicy defaults = SlaPolicy.defaults(
            sla.getDefaultSlaHours(), sla.getDefaultWarnHours(), sla.getDefaultBreachGraceHours());
        return new SlaResolver(defaults, sla.getRiskWindow());
    }
}
