package com.flagship.fraud_decisions.validation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flagship.fraud_decisions.event.RuleAction;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * One entry of {@code matched_rules}.
 */
@Value
@Builder
@Jacksonized
public class RuleMatchPayload {

    @NotBlank(message = "is required")
    @Size(max = 128, message = "must be at most 128 characters")
    @JsonProperty("rule_id")
    String ruleId;

    @Min(value = 1, message = "must be at least 1")
    @JsonProperty("rule_version")
    Integer ruleVersion;

    @Size(max = 64, message = "must be at most 64 characters")
    @JsonProperty("rule_version_id")
    String ruleVersionId;

    @Size(max = 255, message = "must be at most 255 characters")
    @JsonProperty("rule_name")
    String ruleName;

    @JsonProperty("rule_action")
    RuleAction ruleAction;

    @Min(value = 0, message = "must be at least 0")
    @JsonProperty("priority")
    Integer priority;

    @DecimalMin(value = "0", message = "must be between 0 and 99999")
    @DecimalMax(value = "99999", message = "must be between 0 and 99999")
    @Digits(integer = 5, fraction = 4, message = "at most 4 decimal places")
    @JsonProperty("score")
    BigDecimal score;

    @JsonProperty("match_reason_text")
    String matchReasonText;

    @JsonProperty("conditions_met")
    ArrayNode conditionsMet;

    @JsonProperty("condition_values")
    ObjectNode conditionValues;

    @JsonProperty("matched")
    Boolean matched;

    @JsonProperty("contributed")
    Boolean contributed;
}
