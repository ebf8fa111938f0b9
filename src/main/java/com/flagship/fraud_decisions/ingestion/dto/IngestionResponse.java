package com.flagship.fraud_decisions.ingestion.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fraud_decisions.event.EvaluationType;
import com.flagship.fraud_decisions.event.IngestionSource;
import com.flagship.fraud_decisions.ingestion.IngestionResult;
import com.flagship.fraud_decisions.transaction.WriteKind;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Response DTO of the ingestion endpoint.
 */
@Value
@Builder
public class IngestionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("transaction_id")
    String transactionId;

    @JsonProperty("evaluation_type")
    EvaluationType evaluationType;

    @JsonProperty("result")
    WriteKind result;

    @JsonProperty("ingestion_source")
    IngestionSource ingestionSource;

    @JsonProperty("ingested_at")
    Instant ingestedAt;

    @JsonProperty("review_id")
    UUID reviewId;

    @JsonProperty("conflicting_fields")
    List<String> conflictingFields;

    public static IngestionResponse from(IngestionResult result) {
        return IngestionResponse.builder()
            .id(result.getId())
            .transactionId(result.getTransactionId())
            .evaluationType(result.getEvaluationType())
            .result(result.getKind())
            .ingestionSource(result.getIngestionSource())
            .ingestedAt(result.getIngestedAt())
            .reviewId(result.getReviewId())
            .conflictingFields(result.getConflictingFields())
            .build();
    }
}
