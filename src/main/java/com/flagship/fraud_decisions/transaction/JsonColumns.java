package com.flagship.fraud_decisions.transaction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Converts between JSON trees and the text held by jsonb columns,
 * using the application's ObjectMapper so numbers read back exactly as they were written.
 */
@Component
@RequiredArgsConstructor
public class JsonColumns {

    private final ObjectMapper objectMapper;

    public String write(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize jsonb column", e);
        }
    }

    public JsonNode read(String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored jsonb column is not valid JSON", e);
        }
    }
}
