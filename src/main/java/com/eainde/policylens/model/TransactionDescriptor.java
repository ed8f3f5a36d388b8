package com.eainde.policylens.model;

import java.math.BigDecimal;

/**
 * Canonical text form of a transaction. The same descriptor is embedded for policy retrieval,
 * for case retrieval and for risk scoring, so it must not vary between calls.
 */
public final class TransactionDescriptor {

    private TransactionDescriptor() {
    }

    public static String describe(Transaction tx) {
        return "Transaction " + tx.transactionId() + ": "
                + plain(tx.amount()) + " " + tx.currency()
                + " from " + orUnknown(tx.sender()) + " (" + orUnknown(tx.senderCountry()) + ")"
                + " to " + orUnknown(tx.receiver()) + " (" + orUnknown(tx.receiverCountry()) + ")."
                + " Description: " + (isBlank(tx.description()) ? "N/A" : tx.description().strip());
    }

    private static String plain(BigDecimal amount) {
        return amount.stripTrailingZeros().toPlainString();
    }

    private static String orUnknown(String value) {
        return isBlank(value) ? "Unknown" : value.strip();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
