package com.flagship.fraud_decisions.transaction;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface RuleMatchRepository extends JpaRepository<RuleMatchEntity, UUID> {

    List<RuleMatchEntity> findByTransactionId(UUID transactionId);
}
