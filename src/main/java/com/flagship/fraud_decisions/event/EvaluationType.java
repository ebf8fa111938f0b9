package com.flagship.fraud_decisions.event;

/**
 * Evaluation stage of a decision event.
 *
 * AUTH is the real-time authorization evaluation and always carries a decision.
 * MONITORING is the later analytics pass over the same transaction and may not.
 */
public enum EvaluationType {
    AUTH,
    MONITORING;

    public boolean requiresDecision() {
        return this == AUTH;
    }
}
