package com.flagship.fraud_decisions.transaction;

import com.flagship.fraud_decisions.event.RuleAction;
import com.flagship.fraud_decisions.event.RuleMatch;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.springframework.data.domain.Persistable;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A rule that fired for a stored event. Insert-only.
 */
@Entity
@Table(name = "transaction_rule_matches")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class RuleMatchEntity implements Persistable<UUID> {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "transaction_id", nullable = false)
    private UUID transactionId;

    @Column(name = "rule_id", nullable = false, length = 128)
    private String ruleId;

    @Column(name = "rule_version")
    private Integer ruleVersion;

    @Column(name = "rule_version_id", length = 64)
    private String ruleVersionId;

    @Column(name = "rule_name")
    private String ruleName;

    @Enumerated(EnumType.STRING)
    @Column(name = "rule_action", length = 16)
    private RuleAction ruleAction;

    @Column(nullable = false)
    private boolean matched;

    @Column(nullable = false)
    private boolean contributed;

    @Column(precision = 9, scale = 4)
    private BigDecimal score;

    private Integer priority;

    @Column(name = "match_reason", columnDefinition = "TEXT")
    private String matchReason;

    @Column(columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String evidence;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

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
    }

    static RuleMatchEntity of(UUID transactionId, RuleMatch match, String evidence) {
        RuleMatchEntity entity = new RuleMatchEntity();
        entity.id = SurrogateIds.newId();
        entity.transactionId = transactionId;
        entity.ruleId = match.getRuleId();
        entity.ruleVersion = match.getRuleVersion();
        entity.ruleVersionId = match.getRuleVersionId();
        entity.ruleName = match.getRuleName();
        entity.ruleAction = match.getRuleAction();
        entity.matched = match.isMatched();
        entity.contributed = match.isContributed();
        entity.score = match.getScore();
        entity.priority = match.getPriority();
        entity.matchReason = match.getMatchReason();
        entity.evidence = evidence;
        return entity;
    }

    boolean isSameRule(RuleMatch match) {
        return ruleId.equals(match.getRuleId()) && Objects.equals(ruleVersion, match.getRuleVersion());
    }
}
