package com.flagship.fraud_decisions.event;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One rule that fired while the event was evaluated.
 */
@Value
@Builder(toBuilder = true)
public class RuleMatch {
    String ruleId;
    Integer ruleVersion;
    String ruleVersionId;
    String ruleName;
    RuleAction ruleAction;
    Integer priority;
    BigDecimal score;
    String matchReason;
    JsonNode conditionsMet;
    JsonNode conditionValues;
    boolean matched;
    boolean contributed;

    /**
     * Identity of a rule match within one event: rule id plus rule version.
     */
    public boolean sameRuleAs(RuleMatch other) {
        return ruleId.equals(other.ruleId) && Objects.equals(ruleVersion, other.ruleVersion);
    }
}
