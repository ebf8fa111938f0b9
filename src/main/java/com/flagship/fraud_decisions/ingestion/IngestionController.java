package com.flagship.fraud_decisions.ingestion;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.fraud_decisions.event.IngestionProvenance;
import com.flagship.fraud_decisions.ingestion.dto.IngestionResponse;
import com.flagship.fraud_decisions.observability.CorrelationContext;
import com.flagship.fraud_decisions.observability.IngestionMetrics;
import com.flagship.fraud_decisions.transaction.WriteKind;
import com.flagship.fraud_decisions.validation.EventIdentity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;

/**
 * Synchronous ingestion of a single decision event.
 *
 * Development and test entry point; production traffic arrives over Kafka. Only registered
 * when {@code ingestion.http.enabled=true}. Returns 201 when the event was stored for the first
 * time and 200 when it refreshed or matched an already stored event.
 */
@RestController
@RequestMapping("/v1/decision-events")
@ConditionalOnProperty(name = "ingestion.http.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class IngestionController {

    static final String SCHEMA_VERSION_HEADER = "X-Schema-Version";

    private final IngestionService ingestionService;
    private final IngestionMetrics metrics;

    @PostMapping
    public ResponseEntity<IngestionResponse> ingest(
            @RequestBody JsonNode body,
            @RequestHeader(value = SCHEMA_VERSION_HEADER, required = false) String schemaVersion) {

        long startTime = System.currentTimeMillis();
        String requestId = CorrelationContext.getRequestId();

        // read by the exception handler; CorrelationIdFilter clears them
        EventIdentity identity = EventIdentity.from(body);
        putIfPresent(CorrelationContext.TRANSACTION_ID_MDC_KEY, identity.businessId());
        putIfPresent(CorrelationContext.TRACE_ID_MDC_KEY, identity.traceId());

        HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
        try {
            IngestionResult result = ingestionService.ingest(body, schemaVersion, IngestionProvenance.http(requestId));
            status = result.getKind() == WriteKind.CREATED ? HttpStatus.CREATED : HttpStatus.OK;
            return ResponseEntity.status(status).body(IngestionResponse.from(result));
        } finally {
            long duration = System.currentTimeMillis() - startTime;
            metrics.recordHttpDuration(status.value(), Duration.ofMillis(duration));
            log.debug("Ingestion request finished: requestId={}, duration={}ms", requestId, duration);
        }
    }

    private static void putIfPresent(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        }
    }
}
