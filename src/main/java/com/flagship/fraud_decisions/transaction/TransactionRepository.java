package com.flagship.fraud_decisions.transaction;

import com.flagship.fraud_decisions.event.EvaluationType;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface TransactionRepository extends JpaRepository<TransactionEntity, UUID> {

    /**
     * Loads the row for a business key and locks it until the surrounding transaction ends,
     * so concurrent redeliveries of the same key merge one after the other.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
        SELECT t FROM TransactionEntity t
        WHERE t.transactionId = :transactionId
          AND t.evaluationType = :evaluationType
          AND t.occurredAt = :occurredAt
        """)
    Optional<TransactionEntity> findByBusinessKeyForUpdate(@Param("transactionId") String transactionId,
                                                           @Param("evaluationType") EvaluationType evaluationType,
                                                           @Param("occurredAt") Instant occurredAt);

    List<TransactionEntity> findByTransactionIdOrderByOccurredAtAsc(String transactionId);

    long countByTransactionId(String transactionId);
}
