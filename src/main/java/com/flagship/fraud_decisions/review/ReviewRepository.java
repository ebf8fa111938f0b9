package com.flagship.fraud_decisions.review;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface ReviewRepository extends JpaRepository<ReviewEntity, UUID> {

    Optional<ReviewEntity> findByTransactionId(UUID transactionId);

    boolean existsByTransactionId(UUID transactionId);
}
