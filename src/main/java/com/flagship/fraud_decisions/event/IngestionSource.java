package com.flagship.fraud_decisions.event;

/**
 * Delivery path an event arrived through. Stored as provenance.
 */
public enum IngestionSource {
    KAFKA,
    HTTP
}
