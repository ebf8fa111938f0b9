package com.flagship.fraud_decisions.transaction;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flagship.fraud_decisions.event.RuleMatch;
import com.flagship.fraud_decisions.review.ReviewBootstrapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Applies a normalized event to the store with upsert semantics on the business key.
 *
 * The existing row, if any, is locked and merged through {@link TransactionMerge}; a missing row
 * is inserted together with its review. Two deliveries racing on a key that is not yet stored
 * both attempt the insert; the loser fails on the unique constraint and must retry the whole
 * unit, which then takes the merge path.
 *
 * Must be called inside a transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentTransactionWriter {

    private final TransactionRepository transactionRepository;
    private final RuleMatchRepository ruleMatchRepository;
    private final ReviewBootstrapper reviewBootstrapper;
    private final JsonColumns jsonColumns;

    @Transactional(propagation = Propagation.MANDATORY)
    public WriteOutcome write(TransactionRecord incoming, List<RuleMatch> ruleMatches) {
        Optional<TransactionEntity> existing = transactionRepository.findByBusinessKeyForUpdate(
                incoming.getTransactionId(), incoming.getEvaluationType(), incoming.getOccurredAt());

        TransactionMerge.MergeResult merge = TransactionMerge.merge(
                incoming, existing.map(entity -> entity.toDomain(jsonColumns)));
        TransactionRecord record = merge.getRecord();

        UUID reviewId = null;
        switch (merge.getKind()) {
            case CREATED -> {
                transactionRepository.saveAndFlush(TransactionEntity.fromDomain(record, jsonColumns));
                reviewId = reviewBootstrapper.bootstrap(record);
            }
            case UPDATED -> existing.get().refreshMetadata(record, jsonColumns);
            case NOOP -> log.debug("Redelivery with unchanged metadata: transactionId={}, evaluationType={}",
                    record.getTransactionId(), record.getEvaluationType());
        }

        int inserted = insertMissingRuleMatches(record.getId(), ruleMatches);

        return new WriteOutcome(record, merge.getKind(), reviewId, merge.getConflictingFields(), inserted);
    }

    /**
     * Inserts rule matches whose (rule id, rule version) is not yet stored for the event.
     * Duplicates within the incoming list collapse to the first occurrence.
     */
    private int insertMissingRuleMatches(UUID transactionId, List<RuleMatch> ruleMatches) {
        if (ruleMatches == null || ruleMatches.isEmpty()) {
            return 0;
        }

        List<RuleMatchEntity> stored = ruleMatchRepository.findByTransactionId(transactionId);
        List<RuleMatch> accepted = new ArrayList<>();
        List<RuleMatchEntity> toInsert = new ArrayList<>();

        for (RuleMatch match : ruleMatches) {
            boolean alreadyStored = stored.stream().anyMatch(entity -> entity.isSameRule(match));
            boolean repeated = accepted.stream().anyMatch(match::sameRuleAs);
            if (alreadyStored || repeated) {
                continue;
            }
            accepted.add(match);
            toInsert.add(RuleMatchEntity.of(transactionId, match, evidenceOf(match)));
        }

        if (!toInsert.isEmpty()) {
            ruleMatchRepository.saveAll(toInsert);
        }
        return toInsert.size();
    }

    private String evidenceOf(RuleMatch match) {
        if (match.getConditionsMet() == null && match.getConditionValues() == null) {
            return null;
        }
        ObjectNode evidence = JsonNodeFactory.instance.objectNode();
        if (match.getConditionsMet() != null) {
            evidence.set("conditions_met", match.getConditionsMet());
        }
        if (match.getConditionValues() != null) {
            evidence.set("condition_values", match.getConditionValues());
        }
        return jsonColumns.write(evidence);
    }
}
