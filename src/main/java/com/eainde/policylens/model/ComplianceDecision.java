package com.eainde.policylens.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * The auditable verdict for one transaction. Immutable once stored; re-evaluation
 * produces a new record.
 *
 * @param transactionId   evaluated transaction
 * @param verdict         FLAG / NEEDS_REVIEW / ACCEPTABLE
 * @param riskLevel       HIGH / MEDIUM / LOW / ACCEPTABLE
 * @param riskScore       in [0,1]
 * @param reasoning       explanation text
 * @param policyCitations every chunk that was handed to the reasoning step
 * @param similarCases    precedent retrieved for this evaluation
 * @param confidence      in [0,1]; 0.6 for the fallback heuristic
 * @param source          reasoning gateway, coerced reasoning output, or fallback
 * @param timestamp       creation time
 * @param rawReasoningOutput reasoning output as received, kept when it had to be coerced;
 *                        null otherwise
 */
public record ComplianceDecision(
        @JsonProperty("transaction_id")   String transactionId,
        @JsonProperty("verdict")          Verdict verdict,
        @JsonProperty("risk_level")       RiskLevel riskLevel,
        @JsonProperty("risk_score")       double riskScore,
        @JsonProperty("reasoning")        String reasoning,
        @JsonProperty("policy_citations") List<PolicyCitation> policyCitations,
        @JsonProperty("similar_cases")    List<SimilarCase> similarCases,
        @JsonProperty("confidence")       double confidence,
        @JsonProperty("source")           DecisionSource source,
        @JsonProperty("timestamp")        Instant timestamp,
        @JsonProperty("raw_reasoning_output") String rawReasoningOutput
) {

    public ComplianceDecision {
        policyCitations = policyCitations == null ? List.of() : List.copyOf(policyCitations);
        similarCases = similarCases == null ? List.of() : List.copyOf(similarCases);
    }

    /**
     * @return true if the decision cites any chunk of the given document
     */
    public boolean cites(String docId) {
        return policyCitations.stream().anyMatch(c -> docId.equals(c.docId()));
    }
}
