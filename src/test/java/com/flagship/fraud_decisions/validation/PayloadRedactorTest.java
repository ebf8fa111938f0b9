package com.flagship.fraud_decisions.validation;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static com.flagship.fraud_decisions.support.DecisionEventFixtures.MAPPER;
import static org.junit.jupiter.api.Assertions.*;

class PayloadRedactorTest {

    private static final Set<String> ALLOWED = Set.of("source", "channel", "entry_mode");

    private final PayloadRedactor redactor = new PayloadRedactor(ALLOWED, 8192, MAPPER);

    @Test
    @DisplayName("Keeps only allow-listed top-level keys")
    void keepsAllowListed() throws Exception {
        JsonNode payload = MAPPER.readTree("""
            {"channel": "ECOM", "entry_mode": {"type": "CHIP", "fallback": false}, "device_fingerprint": "abc"}
            """);

        JsonNode redacted = redactor.redact(payload);

        assertEquals(MAPPER.readTree("""
            {"channel": "ECOM", "entry_mode": {"type": "CHIP", "fallback": false}}
            """), redacted);
        assertTrue(payload.has("device_fingerprint"), "input is left untouched");
    }

    @Test
    @DisplayName("Nothing allow-listed means no payload")
    void nothingKept() throws Exception {
        assertNull(redactor.redact(MAPPER.readTree("{\"device_fingerprint\": \"abc\"}")));
        assertNull(redactor.redact(MAPPER.createObjectNode()));
    }

    @Test
    @DisplayName("Absent or non-object payloads yield nothing")
    void notAnObject() throws Exception {
        assertNull(redactor.redact(null));
        assertNull(redactor.redact(MAPPER.readTree("[\"channel\"]")));
    }

    @Test
    @DisplayName("An oversized subset is dropped entirely, never truncated")
    void oversizedDropped() {
        PayloadRedactor small = new PayloadRedactor(ALLOWED, 32, MAPPER);
        JsonNode payload = MAPPER.createObjectNode()
                .put("channel", "ECOM")
                .put("source", "x".repeat(64));

        assertNull(small.redact(payload));
    }

    @Test
    @DisplayName("A subset exactly at the limit is kept")
    void atLimitKept() {
        JsonNode payload = MAPPER.createObjectNode().put("channel", "ECOM");
        // {"channel":"ECOM"}
        PayloadRedactor exact = new PayloadRedactor(ALLOWED, 18, MAPPER);

        assertNotNull(exact.redact(payload));
    }

    @Test
    @DisplayName("Byte budget must be positive")
    void rejectsNonPositiveBudget() {
        assertThrows(IllegalArgumentException.class, () -> new PayloadRedactor(ALLOWED, 0, MAPPER));
    }
}
