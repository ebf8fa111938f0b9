package com.flagship.fraud_decisions.transaction;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.fraud_decisions.event.CardNetwork;
import com.flagship.fraud_decisions.event.Decision;
import com.flagship.fraud_decisions.event.DecisionEvent;
import com.flagship.fraud_decisions.event.DecisionReason;
import com.flagship.fraud_decisions.event.EvaluationType;
import com.flagship.fraud_decisions.event.IngestionProvenance;
import com.flagship.fraud_decisions.event.IngestionSource;
import com.flagship.fraud_decisions.event.RiskLevel;
import com.flagship.fraud_decisions.event.TransactionDetails;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One stored observation of a decision event.
 *
 * Identity is the surrogate {@code id}; uniqueness is the business key
 * (transactionId, evaluationType, occurredAt). Fields fall into two groups:
 * business fields, which never change once stored, and delivery metadata, which is refreshed
 * on redelivery (see {@link TransactionMerge}).
 */
@Value
@Builder(toBuilder = true)
public class TransactionRecord {
    UUID id;

    // business key
    String transactionId;
    EvaluationType evaluationType;
    Instant occurredAt;

    // business fields
    String cardId;
    String cardLast4;
    CardNetwork cardNetwork;
    BigDecimal amount;
    String currency;
    String country;
    String merchantId;
    String merchantCategoryCode;
    Decision decision;
    DecisionReason decisionReason;
    RiskLevel riskLevel;
    BigDecimal riskScore;
    String rulesetKey;
    String rulesetId;
    Integer rulesetVersion;
    JsonNode transactionContext;
    JsonNode velocitySnapshot;
    JsonNode velocityResults;

    // delivery metadata
    Instant ingestedAt;
    Instant producedAt;
    String traceId;
    IngestionSource ingestionSource;
    Integer sourcePartition;
    Long sourceOffset;
    String requestId;
    JsonNode engineMetadata;
    JsonNode rawPayload;

    /**
     * Builds a candidate record for a normalized event. The id is only kept if the
     * record turns out to be new.
     */
    public static TransactionRecord from(DecisionEvent event, IngestionProvenance provenance,
                                         UUID id, Instant ingestedAt) {
        TransactionDetails transaction = event.getTransaction();
        return TransactionRecord.builder()
                .id(id)
                .transactionId(event.getTransactionId())
                .evaluationType(event.getEvaluationType())
                .occurredAt(transaction.getOccurredAt())
                .cardId(transaction.getCardId())
                .cardLast4(transaction.getCardLast4())
                .cardNetwork(transaction.getCardNetwork())
                .amount(transaction.getAmount())
                .currency(transaction.getCurrency())
                .country(transaction.getCountry())
                .merchantId(transaction.getMerchantId())
                .merchantCategoryCode(transaction.getMerchantCategoryCode())
                .decision(event.getDecision())
                .decisionReason(event.getDecisionReason())
                .riskLevel(event.getRiskLevel())
                .riskScore(event.getRiskScore())
                .rulesetKey(event.getRulesetKey())
                .rulesetId(event.getRulesetId())
                .rulesetVersion(event.getRulesetVersion())
                .transactionContext(event.getTransactionContext())
                .velocitySnapshot(event.getVelocitySnapshot())
                .velocityResults(event.getVelocityResults())
                .ingestedAt(ingestedAt)
                .producedAt(event.getProducedAt())
                .traceId(event.getTraceId())
                .ingestionSource(provenance.source())
                .sourcePartition(provenance.partition())
                .sourceOffset(provenance.offset())
                .requestId(provenance.requestId())
                .engineMetadata(event.getEngineMetadata())
                .rawPayload(event.getRawPayload())
                .build();
    }
}
