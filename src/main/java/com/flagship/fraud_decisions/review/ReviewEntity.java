package com.flagship.fraud_decisions.review;

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
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.time.Instant;
import java.util.UUID;

/**
 * Mutable review workflow attached 1:1 to a stored event.
 *
 * Ingestion creates it once, as PENDING, in the same transaction as the event. Assignment,
 * case linkage and resolution are written by the review API and are mapped here read-only
 * for ingestion's purposes.
 */
@Entity
@Table(name = "transaction_reviews")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ReviewEntity implements Persistable<UUID> {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "transaction_id", nullable = false, updatable = false, unique = true)
    private UUID transactionId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ReviewStatus status;

    @Column(nullable = false)
    private int priority;

    @Column(name = "assigned_analyst_id", length = 128)
    private String assignedAnalystId;

    @Column(name = "assigned_at")
    private Instant assignedAt;

    @Column(name = "case_id")
    private UUID caseId;

    @Column(name = "resolution_code", length = 64)
    private String resolutionCode;

    @Column(name = "resolution_notes", columnDefinition = "TEXT")
    private String resolutionNotes;

    @Column(name = "resolved_by", length = 128)
    private String resolvedBy;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

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

    static ReviewEntity pending(UUID id, UUID transactionId, int priority) {
        if (priority < ReviewPriority.HIGHEST || priority > ReviewPriority.LOWEST) {
            throw new IllegalArgumentException("Review priority out of range: " + priority);
        }
        ReviewEntity review = new ReviewEntity();
        review.id = id;
        review.transactionId = transactionId;
        review.status = ReviewStatus.PENDING;
        review.priority = priority;
        return review;
    }
}
