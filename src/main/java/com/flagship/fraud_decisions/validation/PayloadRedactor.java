package com.flagship.fraud_decisions.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.Map;
import java.util.Set;

/**
 * Reduces the free-form raw payload to its allow-listed top-level keys.
 *
 * If the kept subset still serializes to more than {@code maxBytes} of UTF-8 JSON, the payload is
 * dropped entirely. Nothing is ever truncated mid-structure.
 */
public class PayloadRedactor {

    private final Set<String> allowedKeys;
    private final int maxBytes;
    private final ObjectMapper objectMapper;

    public PayloadRedactor(Set<String> allowedKeys, int maxBytes, ObjectMapper objectMapper) {
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be positive");
        }
        this.allowedKeys = Set.copyOf(allowedKeys);
        this.maxBytes = maxBytes;
        this.objectMapper = objectMapper;
    }

    /**
     * @return the redacted payload, or {@code null} when nothing allow-listed remains
     *         or the subset is over budget
     */
    public JsonNode redact(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            return null;
        }

        ObjectNode kept = objectMapper.createObjectNode();
        Iterator<Map.Entry<String, JsonNode>> fields = payload.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (allowedKeys.contains(field.getKey())) {
                kept.set(field.getKey(), field.getValue().deepCopy());
            }
        }

        if (kept.isEmpty() || serializedSize(kept) > maxBytes) {
            return null;
        }
        return kept;
    }

    private int serializedSize(JsonNode node) {
        try {
            return objectMapper.writeValueAsBytes(node).length;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize raw payload", e);
        }
    }
}
