package com.flagship.fraud_decisions.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.fraud_decisions.event.DecisionEvent;
import com.flagship.fraud_decisions.event.RuleMatch;
import com.flagship.fraud_decisions.event.TransactionDetails;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Security boundary between a validated event and storage.
 *
 * Every string, number and JSON subtree of the event is scanned for card numbers; a hit is a
 * terminal {@link RejectionCode#PAN_DETECTED}. The card-identifier mode then decides what
 * happens to the last-4 digits. Only field paths are ever logged.
 */
@Slf4j
public class CardDataGuard {

    private static final Pattern LAST4 = Pattern.compile("^[0-9]{4}$");
    private static final String LAST4_FIELD = "transaction.card_last4";

    @Getter
    private final CardIdentifierMode mode;

    public CardDataGuard(CardIdentifierMode mode) {
        if (mode == null) {
            throw new IllegalArgumentException("Card identifier mode is required");
        }
        this.mode = mode;
    }

    /**
     * Returns the event with the card-identifier policy applied.
     *
     * @throws IngestionRejectedException with {@code PAN_DETECTED} or {@code MISSING_OR_INVALID_LAST4}
     */
    public DecisionEvent inspect(DecisionEvent event) {
        scanForCardNumbers(event);
        return applyCardIdentifierPolicy(event);
    }

    private void scanForCardNumbers(DecisionEvent event) {
        check("trace_id", event.getTraceId());
        check("transaction_id", event.getTransactionId());
        check("ruleset_key", event.getRulesetKey());
        check("ruleset_id", event.getRulesetId());
        check("risk_score", event.getRiskScore());

        TransactionDetails transaction = event.getTransaction();
        check("transaction.card_id", transaction.getCardId());
        check(LAST4_FIELD, transaction.getCardLast4());
        check("transaction.amount", transaction.getAmount());
        check("transaction.merchant_id", transaction.getMerchantId());
        check("transaction.mcc", transaction.getMerchantCategoryCode());
        check("transaction.ip_address", transaction.getIpAddress());

        List<RuleMatch> rules = event.getMatchedRules();
        for (int i = 0; i < rules.size(); i++) {
            RuleMatch rule = rules.get(i);
            String prefix = "matched_rules[" + i + "].";
            check(prefix + "rule_id", rule.getRuleId());
            check(prefix + "rule_version_id", rule.getRuleVersionId());
            check(prefix + "rule_name", rule.getRuleName());
            check(prefix + "score", rule.getScore());
            check(prefix + "match_reason_text", rule.getMatchReason());
            check(prefix + "conditions_met", rule.getConditionsMet());
            check(prefix + "condition_values", rule.getConditionValues());
        }

        check("transaction_context", event.getTransactionContext());
        check("velocity_snapshot", event.getVelocitySnapshot());
        check("velocity_results", event.getVelocityResults());
        check("engine_metadata", event.getEngineMetadata());
        check("raw_payload", event.getRawPayload());
    }

    private DecisionEvent applyCardIdentifierPolicy(DecisionEvent event) {
        TransactionDetails transaction = event.getTransaction();
        if (mode == CardIdentifierMode.TOKEN_ONLY) {
            if (transaction.getCardLast4() == null) {
                return event;
            }
            return event.toBuilder()
                    .transaction(transaction.toBuilder().cardLast4(null).build())
                    .build();
        }

        String last4 = transaction.getCardLast4();
        if (last4 == null || !LAST4.matcher(last4).matches()) {
            throw new IngestionRejectedException(RejectionCode.MISSING_OR_INVALID_LAST4, LAST4_FIELD,
                    LAST4_FIELD + ": must be exactly 4 digits when card identifier mode is " + mode);
        }
        return event;
    }

    private void check(String field, String value) {
        if (value != null && PanScanner.containsPan(value)) {
            throw detected(field);
        }
    }

    private void check(String field, BigDecimal value) {
        if (value != null) {
            check(field, value.toPlainString());
        }
    }

    private void check(String field, JsonNode value) {
        PanScanner.findPan(value, field).ifPresent(path -> {
            throw detected(path);
        });
    }

    private IngestionRejectedException detected(String field) {
        log.warn("Card number pattern rejected: security_event=PAN_DETECTED field={}", field);
        return IngestionRejectedException.panDetected(field);
    }
}
