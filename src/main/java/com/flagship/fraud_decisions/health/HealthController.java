package com.flagship.fraud_decisions.health;

import com.flagship.fraud_decisions.consumer.StoreCircuitBreakers;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Simple health check endpoint for liveness and readiness checks.
 * Unlike the Actuator health endpoint, this does not require authorization.
 */
@RestController
public class HealthController {

    private final DataSource dataSource;
    private final StoreCircuitBreakers circuitBreakers;

    public HealthController(DataSource dataSource, StoreCircuitBreakers circuitBreakers) {
        this.dataSource = dataSource;
        this.circuitBreakers = circuitBreakers;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");

        boolean circuitClosed = circuitBreakers.all().stream()
                .noneMatch(breaker -> breaker.getState() == CircuitBreaker.State.OPEN);
        response.put("storeCircuit", circuitClosed ? "CLOSED" : "OPEN");

        if (!dbHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (Exception e) {
            return false;
        }
    }
}
