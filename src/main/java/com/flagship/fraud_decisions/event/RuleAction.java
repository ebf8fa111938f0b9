package com.flagship.fraud_decisions.event;

public enum RuleAction {
    APPROVE,
    DECLINE,
    REVIEW
}
