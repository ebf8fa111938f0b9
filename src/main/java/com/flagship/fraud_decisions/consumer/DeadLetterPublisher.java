package com.flagship.fraud_decisions.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.fraud_decisions.config.IngestionProperties;
import com.flagship.fraud_decisions.observability.IngestionMetrics;
import com.flagship.fraud_decisions.validation.EventIdentity;
import com.flagship.fraud_decisions.validation.PanScanner;
import com.flagship.fraud_decisions.validation.RejectionCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Routes messages that can never be stored to the dead-letter topic.
 *
 * Sends are synchronous: the caller commits the source offset only after the broker has
 * acknowledged the dead letter.
 */
@Component
@Slf4j
public class DeadLetterPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final IngestionMetrics metrics;
    private final String topic;
    private final Duration sendTimeout;

    public DeadLetterPublisher(KafkaTemplate<String, String> kafkaTemplate,
                               ObjectMapper objectMapper,
                               IngestionMetrics metrics,
                               IngestionProperties properties) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.topic = properties.deadLetter().topic();
        this.sendTimeout = properties.deadLetter().sendTimeout();
    }

    /**
     * @throws DeadLetterPublishException if the broker did not acknowledge within the send timeout
     */
    public void publish(InboundMessage message, EventIdentity identity, String errorCode, String errorMessage) {
        DeadLetterMessage deadLetter = DeadLetterMessage.builder()
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .originalTopic(message.topic())
                .originalPartition(message.partition())
                .originalOffset(message.offset())
                .ingestedAt(Instant.now())
                .traceId(identity.traceId())
                .businessId(identity.businessId())
                .originalMessage(carriesOriginal(errorCode, message.value()) ? message.value() : null)
                .build();

        String payload;
        try {
            payload = objectMapper.writeValueAsString(deadLetter);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize dead letter", e);
        }

        try {
            kafkaTemplate.send(topic, identity.businessId(), payload)
                    .get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeadLetterPublishException("Interrupted while publishing dead letter", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new DeadLetterPublishException("Dead-letter topic " + topic + " did not acknowledge", e);
        }

        metrics.recordDeadLettered(errorCode);
        log.warn("Message dead-lettered: code={}, partition={}, offset={}, businessId={}",
                errorCode, message.partition(), message.offset(), identity.businessId());
    }

    static boolean carriesOriginal(String errorCode, String value) {
        return !RejectionCode.PAN_DETECTED.name().equals(errorCode) && !PanScanner.containsPan(value);
    }
}
