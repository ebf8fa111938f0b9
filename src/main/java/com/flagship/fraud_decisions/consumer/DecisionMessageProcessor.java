package com.flagship.fraud_decisions.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.fraud_decisions.config.IngestionProperties;
import com.flagship.fraud_decisions.event.DecisionEvent;
import com.flagship.fraud_decisions.event.IngestionProvenance;
import com.flagship.fraud_decisions.event.IngestionSource;
import com.flagship.fraud_decisions.ingestion.IngestionService;
import com.flagship.fraud_decisions.ingestion.StoreFailureClassifier;
import com.flagship.fraud_decisions.observability.CorrelationContext;
import com.flagship.fraud_decisions.observability.IngestionMetrics;
import com.flagship.fraud_decisions.validation.EventIdentity;
import com.flagship.fraud_decisions.validation.IngestionRejectedException;
import com.flagship.fraud_decisions.validation.RejectionCode;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.backoff.BackOffExecution;
import org.springframework.util.backoff.ExponentialBackOff;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Processes one consumed record and decides whether its offset may be committed.
 *
 * <ul>
 *   <li>Rejections (schema, card data, last-4, unexpected errors) go to the dead-letter topic and
 *       the offset is committed.</li>
 *   <li>Transient store failures are retried in place with exponential backoff. Each failure counts
 *       toward the store circuit breaker. A record that fails {@code failureThreshold} times in a
 *       row opens the circuit even when other partitions keep succeeding, and after
 *       {@code maxAttempts} it is handed back for redelivery, so the listener returns to poll()
 *       in bounded time.</li>
 *   <li>Once the circuit is open the record is handed back with the remaining cool-down as pause,
 *       so the partition stops consuming without attempting the store.</li>
 * </ul>
 *
 * Never throws: every failure ends in one of the two outcomes, so the listener loop survives it.
 * Puts the event's transaction and trace ids in the MDC; the listener clears them.
 */
@Component
@Slf4j
public class DecisionMessageProcessor {

    static final String MALFORMED_JSON = "$: message value is not valid JSON";

    private final ObjectMapper objectMapper;
    private final IngestionService ingestionService;
    private final DeadLetterPublisher deadLetterPublisher;
    private final StoreCircuitBreakers circuitBreakers;
    private final StoreFailureClassifier failureClassifier;
    private final IngestionMetrics metrics;
    private final IngestionProperties.Retry retry;
    private final Sleeper sleeper;

    @Autowired
    public DecisionMessageProcessor(ObjectMapper objectMapper,
                                    IngestionService ingestionService,
                                    DeadLetterPublisher deadLetterPublisher,
                                    StoreCircuitBreakers circuitBreakers,
                                    StoreFailureClassifier failureClassifier,
                                    IngestionMetrics metrics,
                                    IngestionProperties properties) {
        this(objectMapper, ingestionService, deadLetterPublisher, circuitBreakers, failureClassifier,
                metrics, properties, Thread::sleep);
    }

    DecisionMessageProcessor(ObjectMapper objectMapper,
                             IngestionService ingestionService,
                             DeadLetterPublisher deadLetterPublisher,
                             StoreCircuitBreakers circuitBreakers,
                             StoreFailureClassifier failureClassifier,
                             IngestionMetrics metrics,
                             IngestionProperties properties,
                             Sleeper sleeper) {
        this.objectMapper = objectMapper;
        this.ingestionService = ingestionService;
        this.deadLetterPublisher = deadLetterPublisher;
        this.circuitBreakers = circuitBreakers;
        this.failureClassifier = failureClassifier;
        this.metrics = metrics;
        this.retry = properties.retry();
        this.sleeper = sleeper;
    }

    public ProcessingOutcome process(InboundMessage message) {
        JsonNode body;
        try {
            body = message.value() == null ? null : objectMapper.readTree(message.value());
        } catch (JsonProcessingException e) {
            metrics.recordRejected(RejectionCode.SCHEMA_INVALID, IngestionSource.KAFKA);
            return deadLetter(message, EventIdentity.UNKNOWN, RejectionCode.SCHEMA_INVALID.name(), MALFORMED_JSON);
        }

        EventIdentity identity = EventIdentity.from(body);
        putIfPresent(CorrelationContext.TRANSACTION_ID_MDC_KEY, identity.businessId());
        putIfPresent(CorrelationContext.TRACE_ID_MDC_KEY, identity.traceId());
        try {
            DecisionEvent event = ingestionService.prepare(body, message.schemaVersion(), IngestionSource.KAFKA);
            return storeWithRetry(message, identity, event);
        } catch (IngestionRejectedException e) {
            return deadLetter(message, identity, e.getCode().name(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected failure processing partition={}, offset={}",
                    message.partition(), message.offset(), e);
            return deadLetter(message, identity, RejectionCode.UNHANDLED.name(), e.getClass().getSimpleName());
        }
    }

    private ProcessingOutcome storeWithRetry(InboundMessage message, EventIdentity identity, DecisionEvent event) {
        IngestionProvenance provenance = IngestionProvenance.kafka(message.partition(), message.offset());
        CircuitBreaker breaker = circuitBreakers.forPartition(message.topic(), message.partition());
        BackOffExecution backOff = newBackOff().start();
        int attempt = 0;

        while (true) {
            if (!breaker.tryAcquirePermission()) {
                Duration pause = breaker.getState() == CircuitBreaker.State.OPEN
                        ? circuitBreakers.remainingCoolDown(breaker)
                        : retry.initialBackoff();
                log.warn("Store circuit {} is {}, pausing partition={} at offset={} for {}ms",
                        breaker.getName(), breaker.getState(), message.partition(), message.offset(),
                        pause.toMillis());
                return ProcessingOutcome.retryLater(pause);
            }

            attempt++;
            long start = System.nanoTime();
            try {
                ingestionService.store(event, provenance);
                breaker.onSuccess(System.nanoTime() - start, TimeUnit.NANOSECONDS);
                return ProcessingOutcome.commit();
            } catch (RuntimeException e) {
                long elapsed = System.nanoTime() - start;
                if (!failureClassifier.isTransient(e)) {
                    // the store answered; this says nothing about its health
                    breaker.releasePermission();
                    metrics.recordStoreFailure(false);
                    log.error("Permanent store failure: transactionId={}, partition={}, offset={}",
                            identity.businessId(), message.partition(), message.offset(), e);
                    return deadLetter(message, identity, RejectionCode.UNHANDLED.name(), e.getClass().getSimpleName());
                }

                breaker.onError(elapsed, TimeUnit.NANOSECONDS, e);
                metrics.recordStoreFailure(true);

                // successes on other partitions can keep a shared window below its failure rate
                if (attempt >= circuitBreakers.getFailureThreshold()
                        && breaker.getState() == CircuitBreaker.State.CLOSED) {
                    log.warn("Record at partition={}, offset={} failed {} times in a row, opening circuit {}",
                            message.partition(), message.offset(), attempt, breaker.getName());
                    breaker.transitionToOpenState();
                }
                if (breaker.getState() == CircuitBreaker.State.OPEN) {
                    continue;
                }

                long backOffMillis = backOff.nextBackOff();
                if (attempt >= retry.maxAttempts() || backOffMillis == BackOffExecution.STOP) {
                    log.warn("Transient store failure (attempt {} of {}): transactionId={}, partition={}, offset={}, error={}, redelivering",
                            attempt, retry.maxAttempts(), identity.businessId(), message.partition(),
                            message.offset(), e.getClass().getSimpleName());
                    return ProcessingOutcome.retryLater(retry.maxBackoff());
                }
                log.warn("Transient store failure (attempt {}): transactionId={}, partition={}, offset={}, error={}, retrying in {}ms",
                        attempt, identity.businessId(), message.partition(), message.offset(),
                        e.getClass().getSimpleName(), backOffMillis);

                try {
                    sleeper.sleep(backOffMillis);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    return ProcessingOutcome.retryLater(Duration.ZERO);
                }
            }
        }
    }

    private ProcessingOutcome deadLetter(InboundMessage message, EventIdentity identity,
                                         String errorCode, String errorMessage) {
        try {
            deadLetterPublisher.publish(message, identity, errorCode, errorMessage);
            return ProcessingOutcome.commit();
        } catch (RuntimeException e) {
            log.error("Dead-letter publish failed, offset not committed: code={}, partition={}, offset={}",
                    errorCode, message.partition(), message.offset(), e);
            return ProcessingOutcome.retryLater(retry.initialBackoff());
        }
    }

    private static void putIfPresent(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        }
    }

    private ExponentialBackOff newBackOff() {
        ExponentialBackOff backOff = new ExponentialBackOff(retry.initialBackoff().toMillis(), retry.multiplier());
        backOff.setMaxInterval(retry.maxBackoff().toMillis());
        return backOff;
    }

    /**
     * Blocking pause between store attempts.
     */
    @FunctionalInterface
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
