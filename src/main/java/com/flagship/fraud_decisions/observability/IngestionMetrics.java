package com.flagship.fraud_decisions.observability;

import com.flagship.fraud_decisions.event.IngestionSource;
import com.flagship.fraud_decisions.transaction.WriteKind;
import com.flagship.fraud_decisions.validation.RejectionCode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralized metrics for decision-event ingestion.
 *
 * Metrics exposed:
 * - ingestion.events: events stored, tagged by result (CREATED/UPDATED/NOOP) and source
 * - ingestion.rejected: events rejected before storage, tagged by code and source
 * - ingestion.idempotent.conflicts: redeliveries whose business fields differ from the stored row
 * - ingestion.dead_lettered: messages routed to the dead-letter topic, tagged by code
 * - ingestion.store.failures: failed store attempts, tagged by transient/permanent
 * - ingestion.store.duration: time spent in the store transaction
 * - ingestion.circuit.transitions: store circuit-breaker state changes
 * - ingestion.http.duration: ingestion endpoint latency
 */
@Component
public class IngestionMetrics {

    private final MeterRegistry registry;

    private final Counter idempotentConflicts;
    private final Timer storeTimer;

    public IngestionMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.idempotentConflicts = Counter.builder("ingestion.idempotent.conflicts")
                .description("Redeliveries carrying business fields that differ from the stored event")
                .register(registry);

        this.storeTimer = Timer.builder("ingestion.store.duration")
                .description("Time taken by the event store transaction")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordIngested(WriteKind kind, IngestionSource source) {
        registry.counter("ingestion.events",
                "result", kind.name(),
                "source", source.name()
        ).increment();
    }

    public void recordRejected(RejectionCode code, IngestionSource source) {
        registry.counter("ingestion.rejected",
                "code", code.name(),
                "source", source.name()
        ).increment();
    }

    public void recordIdempotentConflict() {
        idempotentConflicts.increment();
    }

    public void recordDeadLettered(String errorCode) {
        registry.counter("ingestion.dead_lettered", "code", sanitizeTag(errorCode)).increment();
    }

    public void recordStoreFailure(boolean transientFailure) {
        registry.counter("ingestion.store.failures",
                "type", transientFailure ? "transient" : "permanent"
        ).increment();
    }

    public void recordCircuitTransition(String breaker, String fromState, String toState) {
        registry.counter("ingestion.circuit.transitions",
                "breaker", sanitizeTag(breaker),
                "from", fromState,
                "to", toState
        ).increment();
    }

    public <T> T timeStore(Supplier<T> operation) {
        return storeTimer.record(operation);
    }

    public void recordHttpDuration(int statusCode, Duration duration) {
        registry.timer("ingestion.http.duration",
                "status", String.valueOf(statusCode)
        ).record(duration);
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_.]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
