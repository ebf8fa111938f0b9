package com.flagship.fraud_decisions.consumer;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Envelope published to the dead-letter topic.
 *
 * {@code originalMessage} is the record value as received. It is left out whenever the value
 * contains something that looks like a card number.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DeadLetterMessage {

    @JsonProperty("error_code")
    String errorCode;

    @JsonProperty("error_message")
    String errorMessage;

    @JsonProperty("original_topic")
    String originalTopic;

    @JsonProperty("original_partition")
    int originalPartition;

    @JsonProperty("original_offset")
    long originalOffset;

    @JsonProperty("ingested_at")
    Instant ingestedAt;

    @JsonProperty("trace_id")
    String traceId;

    @JsonProperty("business_id")
    String businessId;

    @JsonProperty("original_message")
    String originalMessage;
}
