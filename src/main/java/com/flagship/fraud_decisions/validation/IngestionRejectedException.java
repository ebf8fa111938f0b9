package com.flagship.fraud_decisions.validation;

import lombok.Getter;

/**
 * Thrown when an event is rejected before it reaches storage.
 *
 * The message names the field path and the violated constraint only. It never carries
 * the offending value, so it is safe to log, return to clients and put on the dead-letter topic.
 */
@Getter
public class IngestionRejectedException extends RuntimeException {

    private final RejectionCode code;
    private final String field;

    public IngestionRejectedException(RejectionCode code, String field, String message) {
        super(message);
        this.code = code;
        this.field = field;
    }

    public static IngestionRejectedException schemaInvalid(String field, String constraint) {
        return new IngestionRejectedException(RejectionCode.SCHEMA_INVALID, field,
                field + ": " + constraint);
    }

    public static IngestionRejectedException panDetected(String field) {
        return new IngestionRejectedException(RejectionCode.PAN_DETECTED, field,
                "card number pattern detected in " + field);
    }
}
