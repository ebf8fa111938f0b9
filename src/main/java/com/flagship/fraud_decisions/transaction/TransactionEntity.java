package com.flagship.fraud_decisions.transaction;

import com.flagship.fraud_decisions.event.CardNetwork;
import com.flagship.fraud_decisions.event.Decision;
import com.flagship.fraud_decisions.event.DecisionReason;
import com.flagship.fraud_decisions.event.EvaluationType;
import com.flagship.fraud_decisions.event.IngestionSource;
import com.flagship.fraud_decisions.event.RiskLevel;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.springframework.data.domain.Persistable;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for the transactions table.
 *
 * Business columns are {@code updatable = false}: once a business key is stored, only
 * delivery metadata can change, and only through {@link #refreshMetadata}.
 *
 * The id is assigned before the insert, so newness is tracked explicitly: a fresh instance is
 * persisted without a lookup by id, a loaded one is merged.
 */
@Entity
@Table(
    name = "transactions",
    uniqueConstraints = @UniqueConstraint(
        name = "uq_transactions_business_key",
        columnNames = {"transaction_id", "evaluation_type", "occurred_at"})
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TransactionEntity implements Persistable<UUID> {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "transaction_id", nullable = false, updatable = false, length = 128)
    private String transactionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "evaluation_type", nullable = false, updatable = false, length = 16)
    private EvaluationType evaluationType;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;

    @Column(name = "card_id", nullable = false, updatable = false, length = 128)
    private String cardId;

    @Column(name = "card_last4", updatable = false, length = 4)
    private String cardLast4;

    @Enumerated(EnumType.STRING)
    @Column(name = "card_network", updatable = false, length = 16)
    private CardNetwork cardNetwork;

    @Column(nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Column(nullable = false, updatable = false, length = 3)
    private String currency;

    @Column(nullable = false, updatable = false, length = 2)
    private String country;

    @Column(name = "merchant_id", updatable = false, length = 128)
    private String merchantId;

    @Column(name = "merchant_category_code", updatable = false, length = 4)
    private String merchantCategoryCode;

    @Enumerated(EnumType.STRING)
    @Column(updatable = false, length = 16)
    private Decision decision;

    @Enumerated(EnumType.STRING)
    @Column(name = "decision_reason", updatable = false, length = 32)
    private DecisionReason decisionReason;

    @Enumerated(EnumType.STRING)
    @Column(name = "risk_level", updatable = false, length = 16)
    private RiskLevel riskLevel;

    @Column(name = "risk_score", updatable = false, precision = 9, scale = 4)
    private BigDecimal riskScore;

    @Column(name = "ruleset_key", updatable = false, length = 128)
    private String rulesetKey;

    @Column(name = "ruleset_id", updatable = false, length = 64)
    private String rulesetId;

    @Column(name = "ruleset_version", updatable = false)
    private Integer rulesetVersion;

    @Column(name = "transaction_context", updatable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String transactionContext;

    @Column(name = "velocity_snapshot", updatable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String velocitySnapshot;

    @Column(name = "velocity_results", updatable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String velocityResults;

    @Column(name = "ingested_at", nullable = false)
    private Instant ingestedAt;

    @Column(name = "produced_at", nullable = false)
    private Instant producedAt;

    @Column(name = "trace_id", nullable = false, length = 128)
    private String traceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "ingestion_source", nullable = false, length = 16)
    private IngestionSource ingestionSource;

    @Column(name = "source_partition")
    private Integer sourcePartition;

    @Column(name = "source_offset")
    private Long sourceOffset;

    @Column(name = "request_id", length = 128)
    private String requestId;

    @Column(name = "engine_metadata", columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String engineMetadata;

    @Column(name = "raw_payload", columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String rawPayload;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Transient
    @Getter(AccessLevel.NONE)
    private boolean persisted;

    @Override
    public boolean isNew() {
        return !persisted;
    }

    @PostLoad
    @PostPersist
    void markPersisted() {
        this.persisted = true;
    }

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static TransactionEntity fromDomain(TransactionRecord record, JsonColumns json) {
        TransactionEntity entity = new TransactionEntity();
        entity.id = record.getId();
        entity.transactionId = record.getTransactionId();
        entity.evaluationType = record.getEvaluationType();
        entity.occurredAt = record.getOccurredAt();
        entity.cardId = record.getCardId();
        entity.cardLast4 = record.getCardLast4();
        entity.cardNetwork = record.getCardNetwork();
        entity.amount = record.getAmount();
        entity.currency = record.getCurrency();
        entity.country = record.getCountry();
        entity.merchantId = record.getMerchantId();
        entity.merchantCategoryCode = record.getMerchantCategoryCode();
        entity.decision = record.getDecision();
        entity.decisionReason = record.getDecisionReason();
        entity.riskLevel = record.getRiskLevel();
        entity.riskScore = record.getRiskScore();
        entity.rulesetKey = record.getRulesetKey();
        entity.rulesetId = record.getRulesetId();
        entity.rulesetVersion = record.getRulesetVersion();
        entity.transactionContext = json.write(record.getTransactionContext());
        entity.velocitySnapshot = json.write(record.getVelocitySnapshot());
        entity.velocityResults = json.write(record.getVelocityResults());
        entity.applyMetadata(record, json);
        return entity;
    }

    public TransactionRecord toDomain(JsonColumns json) {
        return TransactionRecord.builder()
                .id(id)
                .transactionId(transactionId)
                .evaluationType(evaluationType)
                .occurredAt(occurredAt)
                .cardId(cardId)
                .cardLast4(cardLast4)
                .cardNetwork(cardNetwork)
                .amount(amount)
                .currency(currency)
                .country(country)
                .merchantId(merchantId)
                .merchantCategoryCode(merchantCategoryCode)
                .decision(decision)
                .decisionReason(decisionReason)
                .riskLevel(riskLevel)
                .riskScore(riskScore)
                .rulesetKey(rulesetKey)
                .rulesetId(rulesetId)
                .rulesetVersion(rulesetVersion)
                .transactionContext(json.read(transactionContext))
                .velocitySnapshot(json.read(velocitySnapshot))
                .velocityResults(json.read(velocityResults))
                .ingestedAt(ingestedAt)
                .producedAt(producedAt)
                .traceId(traceId)
                .ingestionSource(ingestionSource)
                .sourcePartition(sourcePartition)
                .sourceOffset(sourceOffset)
                .requestId(requestId)
                .engineMetadata(json.read(engineMetadata))
                .rawPayload(json.read(rawPayload))
                .build();
    }

    /**
     * Copies delivery metadata from a merged record. Business columns are left alone.
     */
    void refreshMetadata(TransactionRecord merged, JsonColumns json) {
        if (!id.equals(merged.getId())) {
            throw new IllegalStateException("Merged record " + merged.getId() + " does not belong to " + id);
        }
        applyMetadata(merged, json);
    }

    private void applyMetadata(TransactionRecord record, JsonColumns json) {
        this.ingestedAt = record.getIngestedAt();
        this.producedAt = record.getProducedAt();
        this.traceId = record.getTraceId();
        this.ingestionSource = record.getIngestionSource();
        this.sourcePartition = record.getSourcePartition();
        this.sourceOffset = record.getSourceOffset();
        this.requestId = record.getRequestId();
        this.engineMetadata = json.write(record.getEngineMetadata());
        this.rawPayload = json.write(record.getRawPayload());
    }
}
