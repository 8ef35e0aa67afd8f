package com.govsignal.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.UUID;

@ConfigurationProperties(prefix = "governance")
public class GovernanceProperties {

    private final Store store = new Store();
    private final Orchestrator orchestrator = new Orchestrator();
    private final Sla sla = new Sla();
    private final Suggestions suggestions = new Suggestions();

    public Store getStore() {
        return store;
    }

    public Orchestrator getOrchestrator() {
        return orchestrator;
    }

    public Sla getSla() {
        return sla;
    }

    public Suggestions getSuggestions() {
        return suggestions;
    }

    public static class Store {
        /** memory or jdbc */
        private String type = "memory";

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }
    }

    public static class Orchestrator {
        private int defaultLimit = 10;
        private int maxLimit = 50;
        private int maxAttempts = 5;
        private Duration claimLease = Duration.ofMinutes(5);
        private Duration maxBatchDuration = Duration.ofSeconds(55);
        private String workerId = "worker-" + UUID.randomUUID().toString().substring(0, 8);

        public int getDefaultLimit() {
            return defaultLimit;
        }

        public void setDefaultLimit(int defaultLimit) {
            this.defaultLimit = defaultLimit;
        }

        public int getMaxLimit() {
            return maxLimit;
        }

        public void setMaxLimit(int maxLimit) {
            this.maxLimit = maxLimit;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getClaimLease() {
            return claimLease;
        }

        public void setClaimLease(Duration claimLease) {
            this.claimLease = claimLease;
        }

        public Duration getMaxBatchDuration() {
            return maxBatchDuration;
        }

        public void setMaxBatchDuration(Duration maxBatchDuration) {
            this.maxBatchDuration = maxBatchDuration;
        }

        public String getWorkerId() {
            return workerId;
        }

        public void setWorkerId(String workerId) {
            this.workerId = workerId;
        }
    }

    public static class Sla {
        private int defaultSlaHours = 72;
        private int defaultWarnHours = 24;
        private int defaultBreachGraceHours = 0;
        private Duration riskWindow = Duration.ofDays(7);
        private int insertChunkSize = 500;

        public int getDefaultSlaHours() {
            return defaultSlaHours;
        }

        public void setDefaultSlaHours(int defaultSlaHours) {
            this.defaultSlaHours = defaultSlaHours;
        }

        public int getDefaultWarnHours() {
            return defaultWarnHours;
        }

        public void setDefaultWarnHours(int defaultWarnHours) {
            this.defaultWarnHours = defaultWarnHours;
        }

        public int getDefaultBreachGraceHours() {
            return defaultBreachGraceHours;
        }

        public void setDefaultBreachGraceHours(int defaultBreachGraceHours) {
            this.defaultBreachGraceHours = defaultBreachGraceHours;
        }

        public Duration getRiskWindow() {
            return riskWindow;
        }

        public void setRiskWindow(Duration riskWindow) {
            this.riskWindow = riskWindow;
        }

        public int getInsertChunkSize() {
            return insertChunkSize;
        }

        public void setInsertChunkSize(int insertChunkSize) {
            this.insertChunkSize = insertChunkSize;
        }
    }

    public static class Suggestions {
        private int escalationDefaultDays = 7;
        private int escalationScanLimit = 200;

        public int getEscalationDefaultDays() {
            return escalationDefaultDays;
        }

        public void setEscalationDefaultDays(int escalationDefaultDays) {
            this.escalationDefaultDays = escalationDefaultDays;
        }

        public int getEscalationScanLimit() {
            return escalationScanLimit;
        }

        public void setEscalationScanLimit(int escalationScanLimit) {
            this.escalationScanLimit = escalationScanLimit;
        }
    }
}
