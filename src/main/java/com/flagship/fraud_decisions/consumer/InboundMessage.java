package com.flagship.fraud_decisions.consumer;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;

import java.nio.charset.StandardCharsets;

/**
 * A consumed record, detached from the Kafka client types.
 *
 * @param schemaVersion value of the schema-version header, or null when absent
 */
public record InboundMessage(String topic, int partition, long offset, String key, String value,
                             String schemaVersion) {

    public static InboundMessage from(ConsumerRecord<String, String> record, String schemaVersionHeader) {
        Header header = record.headers().lastHeader(schemaVersionHeader);
        String schemaVersion = header == null || header.value() == null
                ? null
                : new String(header.value(), StandardCharsets.UTF_8);
        return new InboundMessage(record.topic(), record.partition(), record.offset(),
                record.key(), record.value(), schemaVersion);
    }
}
