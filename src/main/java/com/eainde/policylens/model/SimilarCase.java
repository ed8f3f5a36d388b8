package com.eainde.policylens.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A past case retrieved as precedent, with its similarity to the query in [0,1].
 */
public record SimilarCase(
        @JsonProperty("case_id")          String caseId,
        @JsonProperty("transaction_id")   String transactionId,
        @JsonProperty("similarity_score") double similarityScore,
        @JsonProperty("decision")         Verdict verdict,
        @JsonProperty("risk_score")       double riskScore,
        @JsonProperty("reasoning")        String reasoning,
        @JsonProperty("timestamp")        Instant timestamp
) {}
