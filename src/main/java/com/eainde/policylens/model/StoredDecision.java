package com.eainde.policylens.model;

import java.time.Instant;

/**
 * A decision as kept in the decision store, together with the raw transaction payload
 * needed to replay it.
 *
 * @param decisionId         trace id of the evaluation that produced the decision
 * @param transactionPayload original transaction as JSON text; may be unparsable for
 *                           imported or legacy records
 * @param decision           the decision, or null when the stored record could not be read
 * @param storedAt           when the record was written
 */
public record StoredDecision(
        String decisionId,
        String transactionPayload,
        ComplianceDecision decision,
        Instant storedAt
) {

    /**
     * A record whose stored decision could not be read back.
     */
    public static StoredDecision unreadable(String decisionId, String transactionPayload, Instant storedAt) {
        return new StoredDecision(decisionId, transactionPayload, null, storedAt);
    }

    public boolean isReadable() {
        return decision != null;
    }
}
