package com.flagship.fraud_decisions.validation;

/**
 * Terminal classifications of an event that must not be retried.
 */
public enum RejectionCode {
    /** Contract violation: missing, mistyped or out-of-range field. */
    SCHEMA_INVALID,
    /** Something that looks like a card number was found in the event. */
    PAN_DETECTED,
    /** Last-4 digits required by the card-identifier mode are absent or malformed. */
    MISSING_OR_INVALID_LAST4,
    /** Unexpected failure while processing; never retried. */
    UNHANDLED
}
