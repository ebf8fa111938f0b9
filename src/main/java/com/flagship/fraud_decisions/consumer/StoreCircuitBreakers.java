package com.flagship.fraud_decisions.consumer;

import com.flagship.fraud_decisions.config.IngestionProperties;
import com.flagship.fraud_decisions.observability.IngestionMetrics;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Circuit breakers guarding the event store.
 *
 * A breaker opens after {@code failureThreshold} consecutive failed store attempts (a count-based
 * window of that size where every call failed). While open, no store attempt is made. After the
 * cool-down it half-opens and lets {@code halfOpenCalls} attempts through; a successful trial
 * closes it. Depending on scope there is one breaker for the whole consumer or one per partition.
 */
@Component
@Slf4j
public class StoreCircuitBreakers {

    static final String CONSUMER_BREAKER = "event-store";

    private final CircuitBreakerRegistry registry;
    private final IngestionProperties.BreakerScope scope;
    private final Duration coolDown;
    @Getter
    private final int failureThreshold;
    private final Map<String, Instant> openedAt = new ConcurrentHashMap<>();

    public StoreCircuitBreakers(IngestionProperties properties, IngestionMetrics metrics) {
        IngestionProperties.CircuitBreaker settings = properties.circuitBreaker();
        this.scope = settings.scope();
        this.coolDown = settings.coolDown();
        this.failureThreshold = settings.failureThreshold();

        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(settings.failureThreshold())
                .minimumNumberOfCalls(settings.failureThreshold())
                .failureRateThreshold(100.0f)
                .waitDurationInOpenState(settings.coolDown())
                .permittedNumberOfCallsInHalfOpenState(settings.halfOpenCalls())
                .build();

        this.registry = CircuitBreakerRegistry.of(config);
        this.registry.getEventPublisher().onEntryAdded(event -> {
            CircuitBreaker breaker = event.getAddedEntry();
            breaker.getEventPublisher().onStateTransition(transition -> {
                CircuitBreaker.StateTransition change = transition.getStateTransition();
                log.warn("Store circuit breaker {} changed state: {} -> {}",
                        breaker.getName(), change.getFromState(), change.getToState());
                if (change.getToState() == CircuitBreaker.State.OPEN) {
                    openedAt.put(breaker.getName(), transition.getCreationTime().toInstant());
                }
                metrics.recordCircuitTransition(breaker.getName(),
                        change.getFromState().name(), change.getToState().name());
            });
        });
    }

    public CircuitBreaker forPartition(String topic, int partition) {
        if (scope == IngestionProperties.BreakerScope.PARTITION) {
            return registry.circuitBreaker(CONSUMER_BREAKER + "-" + topic + "-" + partition);
        }
        return registry.circuitBreaker(CONSUMER_BREAKER);
    }

    /**
     * Time left until an open breaker admits trial calls. Zero once the cool-down has passed.
     */
    public Duration remainingCoolDown(CircuitBreaker breaker) {
        Instant opened = openedAt.get(breaker.getName());
        if (opened == null) {
            return coolDown;
        }
        Duration remaining = coolDown.minus(Duration.between(opened, Instant.now()));
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public Set<CircuitBreaker> all() {
        return registry.getAllCircuitBreakers();
    }
}
