package com.flagship.fraud_decisions.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.type.LogicalType;
import com.flagship.fraud_decisions.event.Decision;
import com.flagship.fraud_decisions.event.DecisionEvent;
import com.flagship.fraud_decisions.event.RuleMatch;
import com.flagship.fraud_decisions.event.TransactionDetails;
import com.flagship.fraud_decisions.validation.dto.DecisionEventPayload;
import com.flagship.fraud_decisions.validation.dto.RuleMatchPayload;
import com.flagship.fraud_decisions.validation.dto.TransactionPayload;
import jakarta.validation.ElementKind;
import jakarta.validation.Path;
import jakarta.validation.Validator;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import static com.flagship.fraud_decisions.validation.IngestionRejectedException.schemaInvalid;

/**
 * Validates an untyped message body against the versioned decision-event contract.
 *
 * The body is bound to {@link DecisionEventPayload} with strict scalar typing (no string to
 * number coercion, no numbers for enums) and then checked with Bean Validation. Unknown fields
 * are ignored so producers can add fields ahead of consumers. A rejection names the JSON path
 * and the violated constraint, never the value. When several constraints fail, the one with the
 * lowest path is reported so the outcome is deterministic.
 */
public class DecisionEventValidator {

    private static final PropertyNamingStrategies.NamingBase JSON_NAMES =
            new PropertyNamingStrategies.SnakeCaseStrategy();

    private final JsonMapper contractMapper;
    private final Validator validator;

    public DecisionEventValidator(Validator validator) {
        this.validator = validator;
        this.contractMapper = JsonMapper.builder()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_NUMBERS_FOR_ENUMS)
                .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .disable(MapperFeature.ALLOW_COERCION_OF_SCALARS)
                .build();
        this.contractMapper.coercionConfigFor(LogicalType.Textual)
                .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);
    }

    /**
     * @param body            parsed message body
     * @param declaredVersion schema version declared out of band (message header), or null
     * @throws IngestionRejectedException with {@code SCHEMA_INVALID}
     */
    public DecisionEvent validate(JsonNode body, String declaredVersion) {
        if (body == null || !body.isObject()) {
            throw schemaInvalid("$", "must be a JSON object");
        }

        DecisionEventPayload payload = bind(body);

        Optional<IngestionRejectedException> violation = validator.validate(payload).stream()
                .map(v -> schemaInvalid(jsonPath(v.getPropertyPath()), v.getMessage()))
                .min(Comparator.comparing(IngestionRejectedException::getField)
                        .thenComparing(IngestionRejectedException::getMessage));
        if (violation.isPresent()) {
            throw violation.get();
        }

        if (declaredVersion != null && !declaredVersion.equals(payload.getEventVersion())) {
            throw schemaInvalid("event_version", "does not match the declared schema version");
        }

        return toEvent(payload);
    }

    private DecisionEventPayload bind(JsonNode body) {
        try {
            return contractMapper.treeToValue(body, DecisionEventPayload.class);
        } catch (MismatchedInputException e) {
            throw schemaInvalid(jsonPath(e), describe(e.getTargetType()));
        } catch (JsonMappingException e) {
            throw schemaInvalid(jsonPath(e), "could not be read");
        } catch (JsonProcessingException e) {
            throw schemaInvalid("$", "could not be read");
        }
    }

    private DecisionEvent toEvent(DecisionEventPayload payload) {
        return DecisionEvent.builder()
                .eventVersion(payload.getEventVersion())
                .evaluationType(payload.getEvaluationType())
                .producedAt(instant(payload.getProducedAt()))
                .traceId(payload.getTraceId())
                .transactionId(payload.getTransactionId())
                .decision(payload.getDecision())
                .decisionReason(payload.getDecisionReason())
                .matchedRules(payload.getMatchedRules().stream()
                        .map(rule -> toRuleMatch(rule, payload.getDecision()))
                        .toList())
                .transaction(toTransaction(payload))
                .riskLevel(payload.getRiskLevel())
                .riskScore(payload.getRiskScore())
                .rulesetKey(payload.getRulesetKey())
                .rulesetId(payload.getRulesetId())
                .rulesetVersion(payload.getRulesetVersion())
                .transactionContext(payload.getTransactionContext())
                .velocitySnapshot(payload.getVelocitySnapshot())
                .velocityResults(payload.getVelocityResults())
                .engineMetadata(payload.getEngineMetadata())
                .rawPayload(payload.getRawPayload())
                .build();
    }

    private TransactionDetails toTransaction(DecisionEventPayload payload) {
        TransactionPayload transaction = payload.getTransaction();
        String occurredAt = transaction.getOccurredAt() != null
                ? transaction.getOccurredAt()
                : payload.getOccurredAt();
        if (occurredAt == null) {
            throw schemaInvalid("transaction.occurred_at", "is required");
        }

        return TransactionDetails.builder()
                .occurredAt(instant(occurredAt))
                .cardId(transaction.getCardId())
                .cardLast4(transaction.getCardLast4())
                .cardNetwork(transaction.getCardNetwork())
                .amount(transaction.getAmount())
                .currency(transaction.getCurrency())
                .country(transaction.getCountry())
                .merchantId(transaction.getMerchantId())
                .merchantCategoryCode(transaction.getMcc())
                .ipAddress(transaction.getIpAddress())
                .build();
    }

    private RuleMatch toRuleMatch(RuleMatchPayload rule, Decision decision) {
        return RuleMatch.builder()
                .ruleId(rule.getRuleId())
                .ruleVersion(rule.getRuleVersion())
                .ruleVersionId(rule.getRuleVersionId())
                .ruleName(rule.getRuleName())
                .ruleAction(rule.getRuleAction())
                .priority(rule.getPriority())
                .score(rule.getScore())
                .matchReason(rule.getMatchReasonText())
                .conditionsMet(rule.getConditionsMet())
                .conditionValues(rule.getConditionValues())
                .matched(rule.getMatched() == null || rule.getMatched())
                .contributed(contributed(rule, decision))
                .build();
    }

    /**
     * A rule contributed when the producer says so, or by default when its action agrees with
     * the final decision.
     */
    private static boolean contributed(RuleMatchPayload rule, Decision decision) {
        if (rule.getContributed() != null) {
            return rule.getContributed();
        }
        return rule.getRuleAction() != null && decision != null
                && rule.getRuleAction().name().equals(decision.name());
    }

    private static Instant instant(String timestamp) {
        return OffsetDateTime.parse(timestamp).toInstant();
    }

    /**
     * {@code matchedRules[0].ruleId} becomes {@code matched_rules[0].rule_id}.
     */
    private static String jsonPath(Path propertyPath) {
        StringBuilder path = new StringBuilder();
        for (Path.Node node : propertyPath) {
            if (node.isInIterable() && node.getIndex() != null) {
                path.append('[').append(node.getIndex()).append(']');
            }
            if (node.getKind() == ElementKind.PROPERTY && node.getName() != null) {
                if (path.length() > 0) {
                    path.append('.');
                }
                path.append(JSON_NAMES.translate(node.getName()));
            }
        }
        return path.length() == 0 ? "$" : path.toString();
    }

    private static String jsonPath(JsonMappingException e) {
        StringBuilder path = new StringBuilder();
        for (JsonMappingException.Reference reference : e.getPath()) {
            if (reference.getFieldName() != null) {
                if (path.length() > 0) {
                    path.append('.');
                }
                path.append(reference.getFieldName());
            } else if (reference.getIndex() >= 0) {
                path.append('[').append(reference.getIndex()).append(']');
            }
        }
        return path.length() == 0 ? "$" : path.toString();
    }

    private static String describe(Class<?> type) {
        if (type == null) {
            return "has the wrong type";
        }
        if (type.isEnum()) {
            return "must be one of " + Arrays.toString(type.getEnumConstants());
        }
        if (type == BigDecimal.class) {
            return "must be a number";
        }
        if (type == Integer.class) {
            return "must be an integer";
        }
        if (type == Boolean.class) {
            return "must be a boolean";
        }
        if (type == String.class) {
            return "must be a string";
        }
        if (List.class.isAssignableFrom(type) || ArrayNode.class.isAssignableFrom(type)) {
            return "must be an array";
        }
        return "must be an object";
    }
}
