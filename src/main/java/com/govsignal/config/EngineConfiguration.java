package com.govsignal.config;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionOperations;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(GovernanceProperties.class)
public class EngineConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Unit of work for the orchestrator's "insert suggestions + mark processed"
     * step. Transactional when a DataSource is configured, a plain call otherwise.
     */
    @Bean
    public TransactionOperations governanceTransactions(ObjectProvider<PlatformTransactionManager> transactionManager) {
        PlatformTransactionManager manager = transactionManager.getIfAvailable();
        return manager != null ? new TransactionTemplate(manager) : TransactionOperations.withoutTransaction();
    }
}
