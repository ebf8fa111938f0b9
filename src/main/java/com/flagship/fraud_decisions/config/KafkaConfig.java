package com.flagship.fraud_decisions.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topics owned by the ingestion service.
 *
 * The decisions topic is keyed by business id upstream, so every stage and redelivery of one
 * transaction lands on the same partition.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.decisions:fraud.card.decisions.v1}")
    private String decisionsTopic;

    @Value("${ingestion.dead-letter.topic:fraud.card.decisions.v1.dlq}")
    private String deadLetterTopic;

    @Bean
    public NewTopic decisionsTopic() {
        return TopicBuilder.name(decisionsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic deadLetterTopic() {
        return TopicBuilder.name(deadLetterTopic)
                .partitions(1)
                .replicas(1)
                .build();
    }
}
