package com.flagship.fraud_decisions.event;

/**
 * Where a single delivery of an event came from.
 * Kafka deliveries carry partition and offset; HTTP deliveries carry the request id.
 */
public record IngestionProvenance(IngestionSource source, Integer partition, Long offset, String requestId) {

    public static IngestionProvenance kafka(int partition, long offset) {
        return new IngestionProvenance(IngestionSource.KAFKA, partition, offset, null);
    }

    public static IngestionProvenance http(String requestId) {
        return new IngestionProvenance(IngestionSource.HTTP, null, null, requestId);
    }
}
