package com.eainde.policylens.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * A financial transaction submitted for compliance evaluation.
 *
 * @param transactionId   caller-assigned identifier
 * @param amount          transaction amount in {@code currency}
 * @param currency        ISO-4217 code as supplied
 * @param sender          sender identity
 * @param receiver        receiver identity
 * @param senderCountry   sender country, or null when unknown
 * @param receiverCountry receiver country, or null when unknown
 * @param description     free-text description, or null
 * @param timestamp       when the transaction happened
 */
public record Transaction(
        @JsonProperty("transaction_id")   String transactionId,
        @JsonProperty("amount")           BigDecimal amount,
        @JsonProperty("currency")         String currency,
        @JsonProperty("sender")           String sender,
        @JsonProperty("receiver")         String receiver,
        @JsonProperty("sender_country")   String senderCountry,
        @JsonProperty("receiver_country") String receiverCountry,
        @JsonProperty("description")      String description,
        @JsonProperty("timestamp")        Instant timestamp
) {

    public Transaction {
        Objects.requireNonNull(transactionId, "transactionId");
        Objects.requireNonNull(amount, "amount");
        Objects.requireNonNull(currency, "currency");
    }
}
