package com.flagship.fraud_decisions.observability;

import com.flagship.fraud_decisions.consumer.StoreCircuitBreakers;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Custom health indicators for the ingestion service.
 *
 * Used by readiness checks: an open store circuit means the consumer is not making progress.
 */
public class HealthIndicators {

    /**
     * Reports the store circuit breakers. DOWN while any of them is open.
     */
    @Component("storeCircuitHealth")
    public static class StoreCircuitHealthIndicator implements HealthIndicator {

        private final StoreCircuitBreakers circuitBreakers;

        public StoreCircuitHealthIndicator(StoreCircuitBreakers circuitBreakers) {
            this.circuitBreakers = circuitBreakers;
        }

        @Override
        public Health health() {
            boolean anyOpen = false;
            Health.Builder builder = Health.up();

            for (CircuitBreaker breaker : circuitBreakers.all()) {
                CircuitBreaker.State state = breaker.getState();
                builder.withDetail(breaker.getName(), state.name());
                if (state == CircuitBreaker.State.OPEN || state == CircuitBreaker.State.FORCED_OPEN) {
                    anyOpen = true;
                }
            }

            return anyOpen ? builder.down().build() : builder.build();
        }
    }

    /**
     * Health indicator for Kafka connectivity.
     */
    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                var metrics = kafkaTemplate.metrics();
                if (metrics == null || metrics.isEmpty()) {
                    return Health.down()
                            .withDetail("error", "No Kafka producer connections established")
                            .build();
                }
                return Health.up()
                        .withDetail("metricsCount", metrics.size())
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }
}
