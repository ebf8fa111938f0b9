package com.flagship.fraud_decisions.consumer;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flagship.fraud_decisions.config.IngestionProperties;
import com.flagship.fraud_decisions.event.DecisionEvent;
import com.flagship.fraud_decisions.event.IngestionProvenance;
import com.flagship.fraud_decisions.event.IngestionSource;
import com.flagship.fraud_decisions.ingestion.IngestionService;
import com.flagship.fraud_decisions.ingestion.StoreFailureClassifier;
import com.flagship.fraud_decisions.observability.IngestionMetrics;
import com.flagship.fraud_decisions.support.TestIngestionProperties;
import com.flagship.fraud_decisions.validation.DecisionEventValidator;
import com.flagship.fraud_decisions.validation.EventIdentity;
import com.flagship.fraud_decisions.validation.IngestionRejectedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.flagship.fraud_decisions.support.DecisionEventFixtures.MAPPER;
import static com.flagship.fraud_decisions.support.DecisionEventFixtures.authEvent;
import static com.flagship.fraud_decisions.support.DecisionEventFixtures.json;
import static com.flagship.fraud_decisions.support.DecisionEventFixtures.validator;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DecisionMessageProcessorTest {

    private static final String TOPIC = "fraud.card.decisions.v1";

    private final DecisionEventValidator validator = validator();
    private final IngestionService ingestionService = mock(IngestionService.class);
    private final DeadLetterPublisher deadLetterPublisher = mock(DeadLetterPublisher.class);
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final IngestionMetrics metrics = new IngestionMetrics(registry);
    private final List<Long> sleeps = new ArrayList<>();

    private StoreCircuitBreakers circuitBreakers;
    private DecisionMessageProcessor processor;

    private void createProcessor(IngestionProperties properties) {
        circuitBreakers = new StoreCircuitBreakers(properties, metrics);
        processor = new DecisionMessageProcessor(MAPPER, ingestionService, deadLetterPublisher,
                circuitBreakers, new StoreFailureClassifier(), metrics, properties, sleeps::add);
    }

    private InboundMessage message(long offset, ObjectNode body) {
        return new InboundMessage(TOPIC, 0, offset, null, json(body), null);
    }

    private DecisionEvent prepared(String transactionId) {
        DecisionEvent event = validator.validate(authEvent(transactionId), null);
        when(ingestionService.prepare(any(), any(), eq(IngestionSource.KAFKA))).thenReturn(event);
        return event;
    }

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Nested
    @DisplayName("Transient store failures")
    class TransientFailures {

        @Test
        @DisplayName("Retried in place until the store recovers, later messages follow in order")
        void retriedThenCommitted() {
            createProcessor(TestIngestionProperties.defaults());
            prepared("txn-retry");
            when(ingestionService.store(any(), any()))
                    .thenReturn(null)
                    .thenThrow(new QueryTimeoutException("statement timeout"))
                    .thenThrow(new QueryTimeoutException("statement timeout"))
                    .thenReturn(null)
                    .thenReturn(null);

            ProcessingOutcome first = processor.process(message(1L, authEvent("txn-retry")));
            ProcessingOutcome second = processor.process(message(2L, authEvent("txn-retry")));
            ProcessingOutcome third = processor.process(message(3L, authEvent("txn-retry")));

            assertTrue(first.isCommit());
            assertTrue(second.isCommit());
            assertTrue(third.isCommit());
            verify(ingestionService, times(5)).store(any(), any());
            verify(ingestionService, times(3)).store(any(), eq(IngestionProvenance.kafka(0, 2L)));
            verify(deadLetterPublisher, never()).publish(any(), any(), anyString(), anyString());
            assertEquals(List.of(10L, 20L), sleeps);
            assertEquals(2.0, registry.counter("ingestion.store.failures", "type", "transient").count());
        }

        @Test
        @DisplayName("Circuit opens at the threshold and stops store attempts")
        void circuitOpens() {
            createProcessor(TestIngestionProperties.withBreaker(3, Duration.ofSeconds(30),
                    IngestionProperties.BreakerScope.CONSUMER));
            prepared("txn-open");
            when(ingestionService.store(any(), any())).thenThrow(new QueryTimeoutException("store down"));

            ProcessingOutcome first = processor.process(message(1L, authEvent("txn-open")));

            assertFalse(first.isCommit());
            assertTrue(first.getPause().compareTo(Duration.ofSeconds(30)) <= 0);
            assertTrue(first.getPause().compareTo(Duration.ofSeconds(29)) > 0);
            verify(ingestionService, times(3)).store(any(), any());
            CircuitBreaker breaker = circuitBreakers.forPartition(TOPIC, 0);
            assertEquals(CircuitBreaker.State.OPEN, breaker.getState());

            ProcessingOutcome whileOpen = processor.process(message(1L, authEvent("txn-open")));

            assertFalse(whileOpen.isCommit());
            verify(ingestionService, times(3)).store(any(), any());
            verify(deadLetterPublisher, never()).publish(any(), any(), anyString(), anyString());
            assertEquals(1.0, registry.counter("ingestion.circuit.transitions",
                    "breaker", "event_store", "from", "CLOSED", "to", "OPEN").count());
        }

        @Test
        @DisplayName("An open circuit pauses the partition for the remaining cool-down only")
        void remainingCoolDown() throws InterruptedException {
            createProcessor(TestIngestionProperties.withBreaker(2, Duration.ofSeconds(1),
                    IngestionProperties.BreakerScope.CONSUMER));
            prepared("txn-cool");
            when(ingestionService.store(any(), any())).thenThrow(new QueryTimeoutException("store down"));

            assertFalse(processor.process(message(1L, authEvent("txn-cool"))).isCommit());
            Thread.sleep(300);

            ProcessingOutcome whileOpen = processor.process(message(1L, authEvent("txn-cool")));

            assertFalse(whileOpen.isCommit());
            assertTrue(whileOpen.getPause().compareTo(Duration.ofMillis(700)) <= 0,
                    "pause was " + whileOpen.getPause());
            verify(ingestionService, times(2)).store(any(), any());
        }

        @Test
        @DisplayName("A record failing on a shared circuit opens it while other partitions succeed")
        void sharedCircuitOpensDespiteOtherPartitions() {
            IngestionProperties properties = TestIngestionProperties.withBreaker(3, Duration.ofSeconds(30),
                    IngestionProperties.BreakerScope.CONSUMER);
            InboundMessage healthyPartition = new InboundMessage(TOPIC, 1, 1L, null, json(authEvent("txn-shared")), null);
            List<ProcessingOutcome> healthyOutcomes = new ArrayList<>();
            circuitBreakers = new StoreCircuitBreakers(properties, metrics);
            processor = new DecisionMessageProcessor(MAPPER, ingestionService, deadLetterPublisher,
                    circuitBreakers, new StoreFailureClassifier(), metrics, properties,
                    millis -> healthyOutcomes.add(processor.process(healthyPartition)));
            prepared("txn-shared");
            when(ingestionService.store(any(), eq(IngestionProvenance.kafka(0, 1L))))
                    .thenThrow(new QueryTimeoutException("row lock timeout"));
            when(ingestionService.store(any(), eq(IngestionProvenance.kafka(1, 1L)))).thenReturn(null);

            ProcessingOutcome outcome = processor.process(message(1L, authEvent("txn-shared")));

            assertFalse(outcome.isCommit());
            assertTrue(outcome.getPause().compareTo(Duration.ofSeconds(29)) > 0);
            assertEquals(CircuitBreaker.State.OPEN, circuitBreakers.forPartition(TOPIC, 0).getState());
            verify(ingestionService, times(3)).store(any(), eq(IngestionProvenance.kafka(0, 1L)));
            assertEquals(2, healthyOutcomes.size());
            assertTrue(healthyOutcomes.stream().allMatch(ProcessingOutcome::isCommit));
            assertEquals(1.0, registry.counter("ingestion.circuit.transitions",
                    "breaker", "event_store", "from", "CLOSED", "to", "OPEN").count());
        }

        @Test
        @DisplayName("Retries in place stop after the attempt limit and the record is redelivered")
        void attemptsBounded() {
            createProcessor(TestIngestionProperties.withBreaker(50, Duration.ofSeconds(30),
                    IngestionProperties.BreakerScope.CONSUMER));
            prepared("txn-bounded");
            when(ingestionService.store(any(), any())).thenThrow(new QueryTimeoutException("store down"));

            ProcessingOutcome outcome = processor.process(message(1L, authEvent("txn-bounded")));

            assertFalse(outcome.isCommit());
            assertEquals(Duration.ofMillis(40), outcome.getPause());
            verify(ingestionService, times(10)).store(any(), any());
            assertEquals(9, sleeps.size());
            assertEquals(CircuitBreaker.State.CLOSED, circuitBreakers.forPartition(TOPIC, 0).getState());
            verify(deadLetterPublisher, never()).publish(any(), any(), anyString(), anyString());
        }

        @Test
        @DisplayName("After the cool-down a successful trial write closes the circuit")
        void trialWriteCloses() throws InterruptedException {
            createProcessor(TestIngestionProperties.withBreaker(2, Duration.ofMillis(100),
                    IngestionProperties.BreakerScope.CONSUMER));
            prepared("txn-trial");
            when(ingestionService.store(any(), any()))
                    .thenThrow(new QueryTimeoutException("store down"))
                    .thenThrow(new QueryTimeoutException("store down"))
                    .thenReturn(null);

            assertFalse(processor.process(message(1L, authEvent("txn-trial"))).isCommit());
            Thread.sleep(250);

            ProcessingOutcome trial = processor.process(message(1L, authEvent("txn-trial")));

            assertTrue(trial.isCommit());
            assertEquals(CircuitBreaker.State.CLOSED, circuitBreakers.forPartition(TOPIC, 0).getState());
            verify(ingestionService, times(3)).store(any(), any());
        }

        @Test
        @DisplayName("Per-partition scope isolates a failing partition")
        void partitionScope() {
            createProcessor(TestIngestionProperties.withBreaker(2, Duration.ofSeconds(30),
                    IngestionProperties.BreakerScope.PARTITION));
            prepared("txn-scope");
            when(ingestionService.store(any(), any()))
                    .thenThrow(new QueryTimeoutException("store down"))
                    .thenThrow(new QueryTimeoutException("store down"))
                    .thenReturn(null);

            assertFalse(processor.process(message(1L, authEvent("txn-scope"))).isCommit());
            InboundMessage otherPartition = new InboundMessage(TOPIC, 1, 1L, null, json(authEvent("txn-scope")), null);

            assertTrue(processor.process(otherPartition).isCommit());
            assertEquals(CircuitBreaker.State.OPEN, circuitBreakers.forPartition(TOPIC, 0).getState());
            assertEquals(CircuitBreaker.State.CLOSED, circuitBreakers.forPartition(TOPIC, 1).getState());
        }
    }

    @Nested
    @DisplayName("Dead-lettered messages")
    class DeadLettered {

        @Test
        @DisplayName("Malformed JSON is dead-lettered without touching the store")
        void malformedJson() {
            createProcessor(TestIngestionProperties.defaults());
            InboundMessage message = new InboundMessage(TOPIC, 0, 5L, null, "{not json", null);

            ProcessingOutcome outcome = processor.process(message);

            assertTrue(outcome.isCommit());
            verify(deadLetterPublisher).publish(message, EventIdentity.UNKNOWN, "SCHEMA_INVALID",
                    DecisionMessageProcessor.MALFORMED_JSON);
            verify(ingestionService, never()).prepare(any(), any(), any());
            assertEquals(1.0, registry.counter("ingestion.rejected", "code", "SCHEMA_INVALID", "source", "KAFKA").count());
        }

        @Test
        @DisplayName("Card-data rejection is dead-lettered and the stream moves on")
        void panDetected() {
            createProcessor(TestIngestionProperties.defaults());
            ObjectNode body = authEvent("txn-pan");
            when(ingestionService.prepare(any(), any(), eq(IngestionSource.KAFKA)))
                    .thenThrow(IngestionRejectedException.panDetected("transaction.merchant_id"));
            InboundMessage message = message(6L, body);

            ProcessingOutcome outcome = processor.process(message);

            assertTrue(outcome.isCommit());
            verify(deadLetterPublisher).publish(message, new EventIdentity("txn-pan", "trace-txn-pan"),
                    "PAN_DETECTED", "card number pattern detected in transaction.merchant_id");
            verify(ingestionService, never()).store(any(), any());
        }

        @Test
        @DisplayName("Schema-version header is passed to validation")
        void schemaVersionHeader() {
            createProcessor(TestIngestionProperties.defaults());
            prepared("txn-header");
            InboundMessage message = new InboundMessage(TOPIC, 0, 7L, null, json(authEvent("txn-header")), "1.0");

            processor.process(message);

            verify(ingestionService).prepare(any(), eq("1.0"), eq(IngestionSource.KAFKA));
        }

        @Test
        @DisplayName("Permanent store failure is dead-lettered and does not trip the circuit")
        void permanentFailure() {
            createProcessor(TestIngestionProperties.withBreaker(1, Duration.ofSeconds(30),
                    IngestionProperties.BreakerScope.CONSUMER));
            prepared("txn-perm");
            when(ingestionService.store(any(), any()))
                    .thenThrow(new DataIntegrityViolationException("check constraint violated"));
            InboundMessage message = message(8L, authEvent("txn-perm"));

            ProcessingOutcome outcome = processor.process(message);

            assertTrue(outcome.isCommit());
            verify(ingestionService, times(1)).store(any(), any());
            verify(deadLetterPublisher).publish(eq(message), any(), eq("UNHANDLED"),
                    eq("DataIntegrityViolationException"));
            assertEquals(CircuitBreaker.State.CLOSED, circuitBreakers.forPartition(TOPIC, 0).getState());
        }

        @Test
        @DisplayName("Unreachable dead-letter topic leaves the offset uncommitted")
        void deadLetterUnavailable() {
            createProcessor(TestIngestionProperties.defaults());
            doThrow(new DeadLetterPublishException("no ack", new RuntimeException()))
                    .when(deadLetterPublisher).publish(any(), any(), anyString(), anyString());

            ProcessingOutcome outcome = processor.process(new InboundMessage(TOPIC, 0, 9L, null, "[", null));

            assertFalse(outcome.isCommit());
            assertEquals(Duration.ofMillis(10), outcome.getPause());
        }
    }
}
