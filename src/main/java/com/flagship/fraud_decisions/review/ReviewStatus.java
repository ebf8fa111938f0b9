package com.flagship.fraud_decisions.review;

/**
 * Review workflow states, in workflow order.
 * Ingestion only ever creates PENDING; later transitions belong to the review API.
 */
public enum ReviewStatus {
    PENDING,
    IN_REVIEW,
    ESCALATED,
    RESOLVED,
    CLOSED;

    public boolean isTerminal() {
        return this == RESOLVED || this == CLOSED;
    }
}
