package com.flagship.fraud_decisions.transaction;

import lombok.Value;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Pure merge of an incoming record with whatever is stored under the same business key.
 *
 * Business fields of a stored record are never overwritten. A redelivery only refreshes
 * delivery metadata; if it carries different business values, they are reported as
 * conflicting fields and otherwise ignored.
 */
public final class TransactionMerge {

    private TransactionMerge() {
    }

    public static MergeResult merge(TransactionRecord incoming, Optional<TransactionRecord> existing) {
        if (existing.isEmpty()) {
            return new MergeResult(incoming, WriteKind.CREATED, List.of());
        }

        TransactionRecord stored = existing.get();
        List<String> conflicts = conflictingBusinessFields(incoming, stored);

        if (!metadataChanged(incoming, stored)) {
            return new MergeResult(stored, WriteKind.NOOP, conflicts);
        }

        TransactionRecord refreshed = stored.toBuilder()
                .ingestedAt(incoming.getIngestedAt())
                .producedAt(incoming.getProducedAt())
                .traceId(incoming.getTraceId())
                .ingestionSource(incoming.getIngestionSource())
                .sourcePartition(incoming.getSourcePartition())
                .sourceOffset(incoming.getSourceOffset())
                .requestId(incoming.getRequestId())
                .engineMetadata(incoming.getEngineMetadata())
                .rawPayload(incoming.getRawPayload())
                .build();
        return new MergeResult(refreshed, WriteKind.UPDATED, conflicts);
    }

    // ingestedAt is excluded: it differs on every delivery
    private static boolean metadataChanged(TransactionRecord incoming, TransactionRecord stored) {
        return !Objects.equals(incoming.getProducedAt(), stored.getProducedAt())
                || !Objects.equals(incoming.getTraceId(), stored.getTraceId())
                || incoming.getIngestionSource() != stored.getIngestionSource()
                || !Objects.equals(incoming.getSourcePartition(), stored.getSourcePartition())
                || !Objects.equals(incoming.getSourceOffset(), stored.getSourceOffset())
                || !Objects.equals(incoming.getRequestId(), stored.getRequestId())
                || !Objects.equals(incoming.getEngineMetadata(), stored.getEngineMetadata())
                || !Objects.equals(incoming.getRawPayload(), stored.getRawPayload());
    }

    private static List<String> conflictingBusinessFields(TransactionRecord incoming, TransactionRecord stored) {
        List<String> conflicts = new ArrayList<>();
        compare(conflicts, "card_id", incoming.getCardId(), stored.getCardId());
        compare(conflicts, "card_last4", incoming.getCardLast4(), stored.getCardLast4());
        compare(conflicts, "card_network", incoming.getCardNetwork(), stored.getCardNetwork());
        compareDecimal(conflicts, "amount", incoming.getAmount(), stored.getAmount());
        compare(conflicts, "currency", incoming.getCurrency(), stored.getCurrency());
        compare(conflicts, "country", incoming.getCountry(), stored.getCountry());
        compare(conflicts, "merchant_id", incoming.getMerchantId(), stored.getMerchantId());
        compare(conflicts, "mcc", incoming.getMerchantCategoryCode(), stored.getMerchantCategoryCode());
        compare(conflicts, "decision", incoming.getDecision(), stored.getDecision());
        compare(conflicts, "decision_reason", incoming.getDecisionReason(), stored.getDecisionReason());
        compare(conflicts, "risk_level", incoming.getRiskLevel(), stored.getRiskLevel());
        compareDecimal(conflicts, "risk_score", incoming.getRiskScore(), stored.getRiskScore());
        compare(conflicts, "ruleset_key", incoming.getRulesetKey(), stored.getRulesetKey());
        compare(conflicts, "ruleset_id", incoming.getRulesetId(), stored.getRulesetId());
        compare(conflicts, "ruleset_version", incoming.getRulesetVersion(), stored.getRulesetVersion());
        compare(conflicts, "transaction_context", incoming.getTransactionContext(), stored.getTransactionContext());
        compare(conflicts, "velocity_snapshot", incoming.getVelocitySnapshot(), stored.getVelocitySnapshot());
        compare(conflicts, "velocity_results", incoming.getVelocityResults(), stored.getVelocityResults());
        return List.copyOf(conflicts);
    }

    private static void compare(List<String> conflicts, String field, Object incoming, Object stored) {
        if (!Objects.equals(incoming, stored)) {
            conflicts.add(field);
        }
    }

    // the store normalizes scale, 100.00 and 100.0000 are the same amount
    private static void compareDecimal(List<String> conflicts, String field, BigDecimal incoming, BigDecimal stored) {
        boolean same = incoming == null ? stored == null : stored != null && incoming.compareTo(stored) == 0;
        if (!same) {
            conflicts.add(field);
        }
    }

    @Value
    public static class MergeResult {
        TransactionRecord record;
        WriteKind kind;
        List<String> conflictingFields;

        public boolean hasConflicts() {
            return !conflictingFields.isEmpty();
        }
    }
}
