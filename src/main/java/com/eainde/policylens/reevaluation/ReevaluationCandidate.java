package com.eainde.policylens.reevaluation;

import com.eainde.policylens.model.Verdict;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A stored decision old enough to be worth replaying.
 */
public record ReevaluationCandidate(
        @JsonProperty("decision_id")    String decisionId,
        @JsonProperty("transaction_id") String transactionId,
        @JsonProperty("verdict")        Verdict verdict,
        @JsonProperty("risk_score")     double riskScore,
        @JsonProperty("stored_at")      Instant storedAt,
        @JsonProperty("age_days")       long ageDays
) {}
