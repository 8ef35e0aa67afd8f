package com.govsignal.decision.signal;

public enum SignalCode {
    DECISION_OVERDUE,
    DECISION_STALE,
    HIGH_IMPACT_UNOWNED,
    RATIONALE_WEAK,
    IMPLEMENTATION_OVERDUE,
    CLUSTER_CONCENTRATION,
    REVERSAL_RISK,
    PENDING_ESCALATION
}
