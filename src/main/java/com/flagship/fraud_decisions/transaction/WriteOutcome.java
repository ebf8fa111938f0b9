package com.flagship.fraud_decisions.transaction;

import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Result of one idempotent write, as committed.
 */
@Value
public class WriteOutcome {
    TransactionRecord record;
    WriteKind kind;
    UUID reviewId;
    List<String> conflictingFields;
    int ruleMatchesInserted;
}
