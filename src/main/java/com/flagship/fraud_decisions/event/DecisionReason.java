package com.flagship.fraud_decisions.event;

public enum DecisionReason {
    RULE_MATCH,
    VELOCITY_MATCH,
    SYSTEM_DECLINE,
    DEFAULT_ALLOW,
    MANUAL_REVIEW
}
