package com.flagship.fraud_decisions.event;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * A structurally valid fraud-decision event.
 *
 * Instances are produced by the validator only; every field has already been checked
 * against the versioned contract. Whether the event is safe to store is decided later
 * by the card-data guard.
 */
@Value
@Builder(toBuilder = true)
public class DecisionEvent {
    String eventVersion;
    EvaluationType evaluationType;
    Instant producedAt;
    String traceId;
    String transactionId;
    Decision decision;
    DecisionReason decisionReason;
    List<RuleMatch> matchedRules;
    TransactionDetails transaction;
    RiskLevel riskLevel;
    BigDecimal riskScore;
    String rulesetKey;
    String rulesetId;
    Integer rulesetVersion;
    JsonNode transactionContext;
    JsonNode velocitySnapshot;
    JsonNode velocityResults;
    JsonNode engineMetadata;
    JsonNode rawPayload;
}
