package com.flagship.fraud_decisions.event;

public enum Decision {
    APPROVE,
    DECLINE
}
