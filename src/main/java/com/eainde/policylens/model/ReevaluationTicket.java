package com.eainde.policylens.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * A durable request to replay a set of decisions. Enqueued by the policy sentinel and
 * consumed by the batch re-evaluator.
 */
public record ReevaluationTicket(
        @JsonProperty("token")        String token,
        @JsonProperty("decision_ids") List<String> decisionIds,
        @JsonProperty("status")       Status status,
        @JsonProperty("created_at")   Instant createdAt,
        @JsonProperty("completed_at") Instant completedAt
) {

    public enum Status { QUEUED, COMPLETED }

    public ReevaluationTicket {
        decisionIds = decisionIds == null ? List.of() : List.copyOf(decisionIds);
    }

    public String message() {
        return "Re-evaluation queued for " + decisionIds.size() + " decisions";
    }
}
