package com.flagship.fraud_decisions.event;

public enum CardNetwork {
    VISA,
    MASTERCARD,
    AMEX,
    DISCOVER,
    OTHER
}
