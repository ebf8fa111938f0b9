package com.flagship.fraud_decisions.validation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fraud_decisions.event.CardNetwork;
import com.flagship.fraud_decisions.validation.constraint.MillisTimestamp;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * The {@code transaction} object of a decision event.
 */
@Value
@Builder
@Jacksonized
public class TransactionPayload {

    @MillisTimestamp
    @JsonProperty("occurred_at")
    String occurredAt;

    @NotBlank(message = "is required")
    @Size(max = 128, message = "must be at most 128 characters")
    @Pattern(regexp = "^tok_.+$", message = "must be a card token starting with 'tok_'")
    @JsonProperty("card_id")
    String cardId;

    @Size(max = 128, message = "must be at most 128 characters")
    @JsonProperty("card_last4")
    String cardLast4;

    @JsonProperty("card_network")
    CardNetwork cardNetwork;

    @NotNull(message = "is required")
    @DecimalMin(value = "0", inclusive = false, message = "must be greater than 0")
    @Digits(integer = 15, fraction = 4, message = "at most 15 integer digits and 4 decimal places")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotBlank(message = "is required")
    @Pattern(regexp = "^[A-Z]{3}$", message = "must be a 3-letter uppercase code")
    @JsonProperty("currency")
    String currency;

    @NotBlank(message = "is required")
    @Pattern(regexp = "^[A-Z]{2}$", message = "must be a 2-letter uppercase code")
    @JsonProperty("country")
    String country;

    @Size(max = 128, message = "must be at most 128 characters")
    @JsonProperty("merchant_id")
    String merchantId;

    @Pattern(regexp = "^[0-9]{4}$", message = "must be 4 digits")
    @JsonProperty("mcc")
    String mcc;

    @Size(max = 64, message = "must be at most 64 characters")
    @JsonProperty("ip_address")
    String ipAddress;
}
