package com.flagship.fraud_decisions.ingestion;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.fraud_decisions.event.DecisionEvent;
import com.flagship.fraud_decisions.event.IngestionProvenance;
import com.flagship.fraud_decisions.event.IngestionSource;
import com.flagship.fraud_decisions.observability.IngestionMetrics;
import com.flagship.fraud_decisions.transaction.IdempotentTransactionWriter;
import com.flagship.fraud_decisions.transaction.SurrogateIds;
import com.flagship.fraud_decisions.transaction.TransactionRecord;
import com.flagship.fraud_decisions.transaction.WriteOutcome;
import com.flagship.fraud_decisions.validation.CardDataGuard;
import com.flagship.fraud_decisions.validation.DecisionEventValidator;
import com.flagship.fraud_decisions.validation.IngestionRejectedException;
import com.flagship.fraud_decisions.validation.PanScanner;
import com.flagship.fraud_decisions.validation.PayloadRedactor;
import com.flagship.fraud_decisions.validation.RejectionCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * The ingestion pipeline shared by the Kafka consumer and the HTTP endpoint.
 *
 * {@link #prepare} runs validation, the card-data guard and payload redaction. It is pure and
 * its rejections are final. {@link #store} performs the idempotent write in one transaction
 * and lets store failures propagate for the caller to classify.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionService {

    private final DecisionEventValidator validator;
    private final CardDataGuard cardDataGuard;
    private final PayloadRedactor payloadRedactor;
    private final IdempotentTransactionWriter writer;
    private final TransactionTemplate ingestionTransactionTemplate;
    private final IngestionMetrics metrics;

    public IngestionResult ingest(JsonNode body, String declaredVersion, IngestionProvenance provenance) {
        return store(prepare(body, declaredVersion, provenance.source()), provenance);
    }

    /**
     * Turns a raw body into a normalized event that is safe to store.
     *
     * @throws IngestionRejectedException if the event must not be stored
     */
    public DecisionEvent prepare(JsonNode body, String declaredVersion, IngestionSource source) {
        try {
            DecisionEvent validated = validator.validate(body, declaredVersion);
            DecisionEvent guarded = cardDataGuard.inspect(validated);
            return guarded.toBuilder()
                    .rawPayload(payloadRedactor.redact(guarded.getRawPayload()))
                    .build();
        } catch (IngestionRejectedException e) {
            IngestionRejectedException rejection = escalateIfCardDataPresent(e, body);
            metrics.recordRejected(rejection.getCode(), source);
            log.warn("Decision event rejected: code={}, field={}, source={}",
                    rejection.getCode(), rejection.getField(), source);
            throw rejection;
        }
    }

    /**
     * Stores a prepared event. A unique-key violation means another delivery inserted the same
     * business key concurrently; the unit is retried once and then takes the merge path.
     */
    public IngestionResult store(DecisionEvent event, IngestionProvenance provenance) {
        TransactionRecord candidate = TransactionRecord.from(event, provenance,
                SurrogateIds.newId(), Instant.now().truncatedTo(ChronoUnit.MICROS));

        WriteOutcome outcome;
        try {
            outcome = writeInTransaction(event, candidate);
        } catch (DataIntegrityViolationException e) {
            log.info("Concurrent insert of transactionId={}, evaluationType={}, retrying as merge",
                    candidate.getTransactionId(), candidate.getEvaluationType());
            outcome = writeInTransaction(event, candidate);
        }

        IngestionResult result = IngestionResult.from(outcome);
        if (!result.getConflictingFields().isEmpty()) {
            metrics.recordIdempotentConflict();
            log.warn("IDEMPOTENT_CONFLICT: transactionId={}, evaluationType={}, fields={}; stored values kept",
                    result.getTransactionId(), result.getEvaluationType(), result.getConflictingFields());
        }
        metrics.recordIngested(result.getKind(), provenance.source());
        log.info("Decision event stored: transactionId={}, evaluationType={}, result={}, source={}, partition={}, offset={}",
                result.getTransactionId(), result.getEvaluationType(), result.getKind(),
                provenance.source(), provenance.partition(), provenance.offset());
        return result;
    }

    private WriteOutcome writeInTransaction(DecisionEvent event, TransactionRecord candidate) {
        return metrics.timeStore(() -> ingestionTransactionTemplate.execute(
                status -> writer.write(candidate, event.getMatchedRules())));
    }

    /**
     * A body that failed validation may still carry a card number. Reporting it as
     * PAN_DETECTED keeps it off the dead-letter topic in clear.
     */
    private IngestionRejectedException escalateIfCardDataPresent(IngestionRejectedException rejection, JsonNode body) {
        if (rejection.getCode() == RejectionCode.PAN_DETECTED) {
            return rejection;
        }
        Optional<String> panField = PanScanner.findPan(body, "");
        if (panField.isEmpty()) {
            return rejection;
        }
        String field = panField.get().isEmpty() ? "$" : panField.get();
        log.warn("Card number pattern rejected: security_event=PAN_DETECTED field={}", field);
        return IngestionRejectedException.panDetected(field);
    }
}
