package com.flagship.fraud_decisions.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.fraud_decisions.validation.CardDataGuard;
import com.flagship.fraud_decisions.validation.DecisionEventValidator;
import com.flagship.fraud_decisions.validation.PayloadRedactor;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Wires the pure pipeline components with explicit configuration values.
 */
@Configuration
@Slf4j
public class IngestionConfig {

    @Bean
    public DecisionEventValidator decisionEventValidator(Validator validator) {
        return new DecisionEventValidator(validator);
    }

    @Bean
    public CardDataGuard cardDataGuard(IngestionProperties properties) {
        log.info("Card identifier mode: {}", properties.cardIdentifierMode());
        return new CardDataGuard(properties.cardIdentifierMode());
    }

    @Bean
    public PayloadRedactor payloadRedactor(IngestionProperties properties, ObjectMapper objectMapper) {
        IngestionProperties.RawPayload rawPayload = properties.rawPayload();
        return new PayloadRedactor(rawPayload.allowedKeys(), rawPayload.maxBytes(), objectMapper);
    }

    /**
     * Transaction template for the event write. The timeout bounds a single attempt;
     * exceeding it surfaces as a transient store failure.
     */
    @Bean
    public TransactionTemplate ingestionTransactionTemplate(PlatformTransactionManager transactionManager,
                                                            IngestionProperties properties) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setTimeout((int) Math.max(1, properties.store().timeout().toSeconds()));
        return template;
    }
}
