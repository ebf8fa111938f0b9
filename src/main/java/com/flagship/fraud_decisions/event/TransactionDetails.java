package com.flagship.fraud_decisions.event;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * The card transaction a decision was made about.
 *
 * Card data is tokenized upstream: {@code cardId} is a token, never a card number.
 * {@code cardLast4} only survives normalization when the card-identifier mode allows it.
 */
@Value
@Builder(toBuilder = true)
public class TransactionDetails {
    Instant occurredAt;
    String cardId;
    String cardLast4;
    CardNetwork cardNetwork;
    BigDecimal amount;
    String currency;
    String country;
    String merchantId;
    String merchantCategoryCode;
    String ipAddress;
}
