package com.flagship.fraud_decisions.config;

import com.flagship.fraud_decisions.validation.CardIdentifierMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.Set;

/**
 * Configuration surface of the ingestion pipeline, bound from {@code ingestion.*}.
 *
 * Immutable once bound. The pure pipeline components receive the values they need through
 * their constructors (see {@link IngestionConfig}) and never read this class themselves.
 */
@Validated
@ConfigurationProperties(prefix = "ingestion")
public record IngestionProperties(
        @NotNull @DefaultValue("TOKEN_ONLY") CardIdentifierMode cardIdentifierMode,
        @Valid @DefaultValue RawPayload rawPayload,
        @Valid @DefaultValue Http http,
        @Valid @DefaultValue Consumer consumer,
        @Valid @DefaultValue CircuitBreaker circuitBreaker,
        @Valid @DefaultValue Retry retry,
        @Valid @DefaultValue Store store,
        @Valid @DefaultValue DeadLetter deadLetter) {

    public record RawPayload(
            @DefaultValue Set<String> allowedKeys,
            @Min(1) @DefaultValue("8192") int maxBytes) {
    }

    public record Http(@DefaultValue("false") boolean enabled) {
    }

    public record Consumer(
            @Min(1) @DefaultValue("3") int concurrency,
            @Min(1) @DefaultValue("100") int batchSize,
            @NotNull @DefaultValue("1s") Duration pollTimeout,
            @NotBlank @DefaultValue("schema-version") String schemaVersionHeader) {
    }

    /**
     * Blast radius of an open circuit.
     */
    public enum BreakerScope {
        /** One breaker shared by every partition of this consumer. */
        CONSUMER,
        /** One breaker per topic-partition. */
        PARTITION
    }

    public record CircuitBreaker(
            @Min(1) @DefaultValue("5") int failureThreshold,
            @NotNull @DefaultValue("30s") Duration coolDown,
            @Min(1) @DefaultValue("1") int halfOpenCalls,
            @NotNull @DefaultValue("CONSUMER") BreakerScope scope) {
    }

    /**
     * In-place retries of one record. {@code maxAttempts} bounds how long the listener thread stays
     * away from poll(); keep attempts times (max backoff plus store timeout) well below
     * {@code max.poll.interval.ms}.
     */
    public record Retry(
            @NotNull @DefaultValue("200ms") Duration initialBackoff,
            @DecimalMin("1.0") @DefaultValue("2.0") double multiplier,
            @NotNull @DefaultValue("5s") Duration maxBackoff,
            @Min(1) @DefaultValue("10") int maxAttempts) {
    }

    public record Store(@NotNull @DefaultValue("5s") Duration timeout) {
    }

    public record DeadLetter(
            @NotBlank @DefaultValue("fraud.card.decisions.v1.dlq") String topic,
            @NotNull @DefaultValue("10s") Duration sendTimeout) {
    }
}
