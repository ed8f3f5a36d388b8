package com.eainde.policylens.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A reviewer's correction of a stored decision. Kept alongside the decision; the decision
 * itself is never edited.
 *
 * @param feedbackId         generated id
 * @param transactionId      transaction of the reviewed decision
 * @param decisionId         reviewed decision
 * @param originalVerdict    verdict the decision carried when reviewed
 * @param correctedVerdict   verdict the reviewer assigns
 * @param correctedReasoning reviewer's reasoning, or null
 * @param reviewerNotes      free-text notes, or null
 * @param reviewerId         who reviewed
 * @param submittedAt        when the feedback was recorded
 */
public record DecisionFeedback(
        @JsonProperty("feedback_id")         String feedbackId,
        @JsonProperty("transaction_id")      String transactionId,
        @JsonProperty("decision_id")         String decisionId,
        @JsonProperty("original_verdict")    Verdict originalVerdict,
        @JsonProperty("corrected_verdict")   Verdict correctedVerdict,
        @JsonProperty("corrected_reasoning") String correctedReasoning,
        @JsonProperty("reviewer_notes")      String reviewerNotes,
        @JsonProperty("reviewer_id")         String reviewerId,
        @JsonProperty("submitted_at")        Instant submittedAt
) {

    public boolean overturnsVerdict() {
        return originalVerdict != correctedVerdict;
    }
}
