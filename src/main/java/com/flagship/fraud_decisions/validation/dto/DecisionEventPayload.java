package com.flagship.fraud_decisions.validation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flagship.fraud_decisions.event.Decision;
import com.flagship.fraud_decisions.event.DecisionReason;
import com.flagship.fraud_decisions.event.EvaluationType;
import com.flagship.fraud_decisions.event.RiskLevel;
import com.flagship.fraud_decisions.validation.constraint.DecisionMatchesStage;
import com.flagship.fraud_decisions.validation.constraint.MillisTimestamp;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.List;

/**
 * Wire contract of a decision event, version 1.0.
 *
 * Bound from the message body and checked with Bean Validation before it is turned into a
 * {@link com.flagship.fraud_decisions.event.DecisionEvent}. Unknown fields are ignored.
 */
@Value
@Builder
@Jacksonized
@DecisionMatchesStage
public class DecisionEventPayload {

    @NotBlank(message = "is required")
    @Pattern(regexp = "^1\\.0$", message = "unsupported version, expected one of [1.0]")
    @JsonProperty("event_version")
    String eventVersion;

    @NotNull(message = "is required")
    @JsonProperty("evaluation_type")
    EvaluationType evaluationType;

    @NotNull(message = "is required")
    @MillisTimestamp
    @JsonProperty("produced_at")
    String producedAt;

    @NotBlank(message = "is required")
    @Size(max = 128, message = "must be at most 128 characters")
    @JsonProperty("trace_id")
    String traceId;

    @NotBlank(message = "is required")
    @Size(max = 128, message = "must be at most 128 characters")
    @JsonProperty("transaction_id")
    String transactionId;

    @JsonProperty("decision")
    Decision decision;

    @JsonProperty("decision_reason")
    DecisionReason decisionReason;

    @NotNull(message = "is required")
    @Valid
    @JsonProperty("matched_rules")
    List<@NotNull(message = "must be an object") RuleMatchPayload> matchedRules;

    @NotNull(message = "is required")
    @Valid
    @JsonProperty("transaction")
    TransactionPayload transaction;

    // existing producers send occurred_at at the top level
    @MillisTimestamp
    @JsonProperty("occurred_at")
    String occurredAt;

    @JsonProperty("risk_level")
    RiskLevel riskLevel;

    @DecimalMin(value = "0", message = "must be between 0 and 99999")
    @DecimalMax(value = "99999", message = "must be between 0 and 99999")
    @Digits(integer = 5, fraction = 4, message = "at most 4 decimal places")
    @JsonProperty("risk_score")
    BigDecimal riskScore;

    @Size(max = 128, message = "must be at most 128 characters")
    @JsonProperty("ruleset_key")
    String rulesetKey;

    @Size(max = 64, message = "must be at most 64 characters")
    @JsonProperty("ruleset_id")
    String rulesetId;

    @Min(value = 1, message = "must be at least 1")
    @JsonProperty("ruleset_version")
    Integer rulesetVersion;

    @JsonProperty("transaction_context")
    ObjectNode transactionContext;

    @JsonProperty("velocity_snapshot")
    ObjectNode velocitySnapshot;

    @JsonProperty("velocity_results")
    ObjectNode velocityResults;

    @JsonProperty("engine_metadata")
    ObjectNode engineMetadata;

    @JsonProperty("raw_payload")
    ObjectNode rawPayload;
}
