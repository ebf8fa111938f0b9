package com.flagship.fraud_decisions.observability;

import com.flagship.fraud_decisions.validation.PanScanner;

import java.util.UUID;

/**
 * Thread-local request id for the HTTP ingestion path, plus the MDC keys shared by
 * both ingestion paths.
 *
 * The request id is stored with every event ingested over HTTP, so it is taken from the
 * caller when provided and generated otherwise.
 */
public final class CorrelationContext {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String REQUEST_ID_MDC_KEY = "requestId";
    public static final String TRACE_ID_MDC_KEY = "traceId";
    public static final String TRANSACTION_ID_MDC_KEY = "transactionId";

    private static final int MAX_REQUEST_ID_LENGTH = 128;

    private static final ThreadLocal<String> requestId = new ThreadLocal<>();

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Gets the current request id, or generates a new one if not set.
     */
    public static String getRequestId() {
        String id = requestId.get();
        if (id == null) {
            id = generateRequestId();
            requestId.set(id);
        }
        return id;
    }

    /**
     * Sets the request id for the current thread. Blank, oversized or card-number-like ids are replaced.
     */
    public static void setRequestId(String id) {
        if (id != null && !id.isBlank() && id.length() <= MAX_REQUEST_ID_LENGTH && !PanScanner.containsPan(id)) {
            requestId.set(id);
        } else {
            requestId.set(generateRequestId());
        }
    }

    public static void clear() {
        requestId.remove();
    }

    public static String generateRequestId() {
        return UUID.randomUUID().toString();
    }
}
