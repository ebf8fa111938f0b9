package com.flagship.fraud_decisions.consumer;

import com.flagship.fraud_decisions.config.IngestionProperties;
import com.flagship.fraud_decisions.observability.CorrelationContext;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

/**
 * Kafka listener for fraud-decision events.
 *
 * Each partition is owned by exactly one listener thread and records are handled one at a time,
 * so processing and offset commits follow partition order. Container concurrency bounds how many
 * partitions are processed in parallel.
 *
 * Offsets are acknowledged (ack-mode manual_immediate) only after the record was stored or
 * dead-lettered. Otherwise the record is nacked: the container seeks back to it and pauses the
 * partition for the requested time, then redelivers it.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class DecisionEventConsumer {

    private final DecisionMessageProcessor processor;
    private final String schemaVersionHeader;

    public DecisionEventConsumer(DecisionMessageProcessor processor, IngestionProperties properties) {
        this.processor = processor;
        this.schemaVersionHeader = properties.consumer().schemaVersionHeader();
    }

    @KafkaListener(
        topics = "${kafka.topic.decisions:fraud.card.decisions.v1}",
        groupId = "${spring.kafka.consumer.group-id:fraud-decision-ingestion}",
        concurrency = "${ingestion.consumer.concurrency:3}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}",
                record.topic(), record.partition(), record.offset());

        try {
            ProcessingOutcome outcome = processor.process(InboundMessage.from(record, schemaVersionHeader));

            if (outcome.isCommit()) {
                ack.acknowledge();
            } else {
                log.info("Redelivering partition={} from offset={} after {}ms",
                        record.partition(), record.offset(), outcome.getPause().toMillis());
                ack.nack(outcome.getPause());
            }
        } finally {
            MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
            MDC.remove(CorrelationContext.TRACE_ID_MDC_KEY);
        }
    }
}
