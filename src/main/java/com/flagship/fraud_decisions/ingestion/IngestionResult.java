package com.flagship.fraud_decisions.ingestion;

import com.flagship.fraud_decisions.event.EvaluationType;
import com.flagship.fraud_decisions.event.IngestionSource;
import com.flagship.fraud_decisions.transaction.WriteKind;
import com.flagship.fraud_decisions.transaction.WriteOutcome;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Acknowledgement of a stored event, returned to both ingestion paths.
 */
@Value
@Builder
public class IngestionResult {
    UUID id;
    String transactionId;
    EvaluationType evaluationType;
    WriteKind kind;
    IngestionSource ingestionSource;
    Instant ingestedAt;
    UUID reviewId;
    List<String> conflictingFields;

    static IngestionResult from(WriteOutcome outcome) {
        return IngestionResult.builder()
                .id(outcome.getRecord().getId())
                .transactionId(outcome.getRecord().getTransactionId())
                .evaluationType(outcome.getRecord().getEvaluationType())
                .kind(outcome.getKind())
                .ingestionSource(outcome.getRecord().getIngestionSource())
                .ingestedAt(outcome.getRecord().getIngestedAt())
                .reviewId(outcome.getReviewId())
                .conflictingFields(outcome.getConflictingFields())
                .build();
    }
}
