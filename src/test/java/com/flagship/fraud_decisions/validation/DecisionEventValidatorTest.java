package com.flagship.fraud_decisions.validation;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flagship.fraud_decisions.event.CardNetwork;
import com.flagship.fraud_decisions.event.Decision;
import com.flagship.fraud_decisions.event.DecisionEvent;
import com.flagship.fraud_decisions.event.EvaluationType;
import com.flagship.fraud_decisions.event.RuleAction;
import com.flagship.fraud_decisions.event.RuleMatch;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.time.Instant;

import static com.flagship.fraud_decisions.support.DecisionEventFixtures.MAPPER;
import static com.flagship.fraud_decisions.support.DecisionEventFixtures.authEvent;
import static com.flagship.fraud_decisions.support.DecisionEventFixtures.monitoringEvent;
import static com.flagship.fraud_decisions.support.DecisionEventFixtures.transaction;
import static com.flagship.fraud_decisions.support.DecisionEventFixtures.validator;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the decision-event contract validator.
 */
class DecisionEventValidatorTest {

    private final DecisionEventValidator validator = validator();

    private IngestionRejectedException rejected(ObjectNode body) {
        IngestionRejectedException e = assertThrows(IngestionRejectedException.class,
                () -> validator.validate(body, null));
        assertEquals(RejectionCode.SCHEMA_INVALID, e.getCode());
        return e;
    }

    @Nested
    @DisplayName("Valid events")
    class ValidEvents {

        @Test
        @DisplayName("AUTH event maps every contract field")
        void authEventIsMapped() {
            DecisionEvent event = validator.validate(authEvent("txn-one"), "1.0");

            assertEquals("1.0", event.getEventVersion());
            assertEquals(EvaluationType.AUTH, event.getEvaluationType());
            assertEquals("txn-one", event.getTransactionId());
            assertEquals("trace-txn-one", event.getTraceId());
            assertEquals(Decision.DECLINE, event.getDecision());
            assertEquals(Instant.parse("2026-01-15T10:00:00Z"), event.getTransaction().getOccurredAt());
            assertEquals(Instant.parse("2026-01-15T10:00:01.250Z"), event.getProducedAt());
            assertEquals(0, new BigDecimal("100").compareTo(event.getTransaction().getAmount()));
            assertEquals(CardNetwork.VISA, event.getTransaction().getCardNetwork());
            assertEquals("5411", event.getTransaction().getMerchantCategoryCode());
            assertEquals(7, event.getRulesetVersion());
            assertTrue(event.getVelocitySnapshot().isObject());

            assertEquals(1, event.getMatchedRules().size());
            RuleMatch rule = event.getMatchedRules().get(0);
            assertEquals("velocity-high", rule.getRuleId());
            assertEquals(3, rule.getRuleVersion());
            assertEquals(RuleAction.DECLINE, rule.getRuleAction());
            assertTrue(rule.isMatched(), "matched defaults to true");
            assertTrue(rule.isContributed(), "a rule agreeing with the decision contributed");
        }

        @Test
        @DisplayName("MONITORING event may omit decision and reason")
        void monitoringWithoutDecision() {
            DecisionEvent event = validator.validate(monitoringEvent("txn-two"), null);

            assertEquals(EvaluationType.MONITORING, event.getEvaluationType());
            assertNull(event.getDecision());
            assertNull(event.getDecisionReason());
            assertTrue(event.getMatchedRules().isEmpty());
        }

        @Test
        @DisplayName("Unknown fields are ignored")
        void unknownFieldsIgnored() {
            ObjectNode body = authEvent("txn-three");
            body.put("future_field", "whatever");
            transaction(body).put("another_new_field", 12);

            assertDoesNotThrow(() -> validator.validate(body, null));
        }

        @Test
        @DisplayName("Explicit offsets are normalized to the same instant")
        void offsetTimestamp() {
            ObjectNode body = authEvent("txn-four");
            transaction(body).put("occurred_at", "2026-01-15T12:00:00.000+02:00");

            DecisionEvent event = validator.validate(body, null);

            assertEquals(Instant.parse("2026-01-15T10:00:00Z"), event.getTransaction().getOccurredAt());
        }

        @Test
        @DisplayName("Top-level occurred_at is accepted when the transaction object has none")
        void topLevelOccurredAt() {
            ObjectNode body = authEvent("txn-five");
            transaction(body).remove("occurred_at");
            body.put("occurred_at", "2026-01-15T09:30:00.000Z");

            DecisionEvent event = validator.validate(body, null);

            assertEquals(Instant.parse("2026-01-15T09:30:00Z"), event.getTransaction().getOccurredAt());
        }

        @Test
        @DisplayName("Engine context sections are carried through")
        void engineContext() {
            ObjectNode body = authEvent("txn-seven");
            body.putObject("transaction_context").put("channel", "ECOM");
            body.putObject("velocity_results").putObject("velocity-high").put("count", 7);
            body.putObject("engine_metadata").put("engine_mode", "SHADOW_OFF");

            DecisionEvent event = validator.validate(body, null);

            assertEquals("ECOM", event.getTransactionContext().get("channel").asText());
            assertEquals(7, event.getVelocityResults().get("velocity-high").get("count").asInt());
            assertEquals("SHADOW_OFF", event.getEngineMetadata().get("engine_mode").asText());
        }

        @Test
        @DisplayName("Identical input yields identical output")
        void deterministic() {
            ObjectNode body = authEvent("txn-six");
            assertEquals(validator.validate(body, null), validator.validate(body.deepCopy(), null));
        }
    }

    @Nested
    @DisplayName("Rejected events")
    class RejectedEvents {

        @Test
        @DisplayName("Body must be an object")
        void notAnObject() {
            IngestionRejectedException e = assertThrows(IngestionRejectedException.class,
                    () -> validator.validate(MAPPER.createArrayNode(), null));
            assertEquals("$", e.getField());
        }

        @Test
        @DisplayName("Missing required field names the field")
        void missingTransactionId() {
            ObjectNode body = authEvent("txn-x");
            body.remove("transaction_id");

            assertEquals("transaction_id", rejected(body).getField());
        }

        @Test
        @DisplayName("Missing nested field is reported with its path")
        void missingCurrency() {
            ObjectNode body = authEvent("txn-x");
            transaction(body).remove("currency");

            assertEquals("transaction.currency", rejected(body).getField());
        }

        @Test
        @DisplayName("Unsupported event_version is rejected")
        void unsupportedVersion() {
            ObjectNode body = authEvent("txn-x");
            body.put("event_version", "2.0");

            assertEquals("event_version", rejected(body).getField());
        }

        @Test
        @DisplayName("Declared header version must match the body")
        void declaredVersionMismatch() {
            IngestionRejectedException e = assertThrows(IngestionRejectedException.class,
                    () -> validator.validate(authEvent("txn-x"), "1.1"));
            assertEquals("event_version", e.getField());
        }

        @Test
        @DisplayName("Enum outside its value set is rejected")
        void unknownEnum() {
            ObjectNode body = authEvent("txn-x");
            body.put("evaluation_type", "SHADOW");

            assertEquals("evaluation_type", rejected(body).getField());
        }

        @ParameterizedTest
        @ValueSource(strings = {
            "2026-01-15T10:00:00Z",
            "2026-01-15T10:00:00.000",
            "2026-01-15T10:00:00.000000Z",
            "2026-01-15 10:00:00.000Z",
            "2026-13-15T10:00:00.000Z"
        })
        @DisplayName("Timestamps need millisecond precision and an explicit offset")
        void badTimestamps(String timestamp) {
            ObjectNode body = authEvent("txn-x");
            transaction(body).put("occurred_at", timestamp);

            assertEquals("transaction.occurred_at", rejected(body).getField());
        }

        @ParameterizedTest
        @ValueSource(strings = {"usd", "US", "USDX", "U1D"})
        @DisplayName("Currency must be three uppercase letters")
        void badCurrency(String currency) {
            ObjectNode body = authEvent("txn-x");
            transaction(body).put("currency", currency);

            assertEquals("transaction.currency", rejected(body).getField());
        }

        @Test
        @DisplayName("Country must be two uppercase letters")
        void badCountry() {
            ObjectNode body = authEvent("txn-x");
            transaction(body).put("country", "USA");

            assertEquals("transaction.country", rejected(body).getField());
        }

        @Test
        @DisplayName("AUTH requires a decision")
        void authWithoutDecision() {
            ObjectNode body = authEvent("txn-x");
            body.putNull("decision");

            assertEquals("decision", rejected(body).getField());
        }

        @Test
        @DisplayName("AUTH requires a decision reason")
        void authWithoutReason() {
            ObjectNode body = authEvent("txn-x");
            body.remove("decision_reason");

            assertEquals("decision_reason", rejected(body).getField());
        }

        @Test
        @DisplayName("MONITORING may not carry a decision without a reason")
        void monitoringHalfDecision() {
            ObjectNode body = monitoringEvent("txn-x");
            body.put("decision", "APPROVE");

            assertEquals("decision_reason", rejected(body).getField());
        }

        @Test
        @DisplayName("Amount must be a positive number")
        void nonPositiveAmount() {
            ObjectNode body = authEvent("txn-x");
            transaction(body).put("amount", 0);
            assertEquals("transaction.amount", rejected(body).getField());

            transaction(body).put("amount", "100.00");
            assertEquals("transaction.amount", rejected(body).getField());
        }

        @Test
        @DisplayName("Card id must be a token")
        void cardIdNotToken() {
            ObjectNode body = authEvent("txn-x");
            transaction(body).put("card_id", "card_abc");

            assertEquals("transaction.card_id", rejected(body).getField());
        }

        @Test
        @DisplayName("matched_rules entries need a rule_id")
        void ruleWithoutId() {
            ObjectNode body = authEvent("txn-x");
            ((ObjectNode) body.get("matched_rules").get(0)).remove("rule_id");

            assertEquals("matched_rules[0].rule_id", rejected(body).getField());
        }

        @Test
        @DisplayName("A null rule entry is reported by index")
        void nullRuleEntry() {
            ObjectNode body = authEvent("txn-x");
            ((ArrayNode) body.get("matched_rules")).insertNull(0);

            assertEquals("matched_rules[0]", rejected(body).getField());
        }

        @Test
        @DisplayName("When several fields fail, the lowest path is reported")
        void lowestPathReported() {
            ObjectNode body = authEvent("txn-x");
            body.remove("trace_id");
            transaction(body).put("country", "usa");

            assertEquals("trace_id", rejected(body).getField());
        }

        @Test
        @DisplayName("Rejection message never contains the offending value")
        void messageHasNoValue() {
            ObjectNode body = authEvent("txn-x");
            transaction(body).put("currency", "secret-value");

            IngestionRejectedException e = rejected(body);
            assertFalse(e.getMessage().contains("secret-value"));
            assertTrue(e.getMessage().startsWith("transaction.currency"));
        }
    }

    @Nested
    @DisplayName("Strict typing")
    class StrictTyping {

        @Test
        @DisplayName("A number is not accepted for a string field")
        void numberForString() {
            ObjectNode body = authEvent("txn-x");
            body.put("trace_id", 12345);

            IngestionRejectedException e = rejected(body);
            assertEquals("trace_id", e.getField());
            assertEquals("trace_id: must be a string", e.getMessage());
        }

        @Test
        @DisplayName("A string is not accepted for an integer field")
        void stringForInteger() {
            ObjectNode body = authEvent("txn-x");
            ((ObjectNode) body.get("matched_rules").get(0)).put("rule_version", "3");

            assertEquals("matched_rules[0].rule_version", rejected(body).getField());
        }

        @Test
        @DisplayName("A fractional number is not accepted for an integer field")
        void fractionForInteger() {
            ObjectNode body = authEvent("txn-x");
            body.put("ruleset_version", 7.5);

            assertEquals("ruleset_version", rejected(body).getField());
        }

        @Test
        @DisplayName("Enums are matched by name only")
        void numberForEnum() {
            ObjectNode body = authEvent("txn-x");
            body.put("decision", 1);

            IngestionRejectedException e = rejected(body);
            assertEquals("decision", e.getField());
            assertTrue(e.getMessage().startsWith("decision: must be one of"));
        }

        @Test
        @DisplayName("Object sections must be JSON objects")
        void arrayForObject() {
            ObjectNode body = authEvent("txn-x");
            body.putArray("velocity_results").add(1);

            assertEquals("velocity_results", rejected(body).getField());
        }
    }
}
