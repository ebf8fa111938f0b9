package com.flagship.fraud_decisions.validation;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Best-effort business id and trace id of a message body, used to label rejections
 * and dead letters even when the body itself failed validation.
 * Values that look like card numbers are dropped.
 */
public record EventIdentity(String businessId, String traceId) {

    private static final int MAX_LENGTH = 128;

    public static final EventIdentity UNKNOWN = new EventIdentity(null, null);

    public static EventIdentity from(JsonNode body) {
        if (body == null || !body.isObject()) {
            return UNKNOWN;
        }
        return new EventIdentity(safeText(body.get("transaction_id")), safeText(body.get("trace_id")));
    }

    private static String safeText(JsonNode node) {
        if (node == null || !node.isTextual()) {
            return null;
        }
        String value = node.asText();
        if (value.length() > MAX_LENGTH || PanScanner.containsPan(value)) {
            return null;
        }
        return value;
    }
}
