package com.flagship.fraud_decisions.validation;

/**
 * Which card identifiers may be stored alongside the card token.
 */
public enum CardIdentifierMode {
    /** Token only. Last-4 digits are stripped even when present. */
    TOKEN_ONLY,
    /** Token plus last-4 digits, which then become mandatory. */
    TOKEN_PLUS_LAST4
}
