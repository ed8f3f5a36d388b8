package com.eainde.policylens.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Verdict drift observed for one replayed decision.
 */
public record ReevaluationOutcome(
        @JsonProperty("transaction_id")     String transactionId,
        @JsonProperty("decision_id")        String decisionId,
        @JsonProperty("new_decision_id")    String newDecisionId,
        @JsonProperty("old_verdict")        Verdict oldVerdict,
        @JsonProperty("new_verdict")        Verdict newVerdict,
        @JsonProperty("old_risk_score")     double oldRiskScore,
        @JsonProperty("new_risk_score")     double newRiskScore,
        @JsonProperty("re_evaluation_date") Instant reEvaluatedAt,
        @JsonProperty("reason_for_change")  String reason
) {}
