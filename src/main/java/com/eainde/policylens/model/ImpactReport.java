package com.eainde.policylens.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Which past decisions a policy change may invalidate, and what to do about it.
 */
public record ImpactReport(
        @JsonProperty("report_id")              String reportId,
        @JsonProperty("generated_at")           Instant generatedAt,
        @JsonProperty("policy_change")          PolicyChangeRecord policyChange,
        @JsonProperty("affected_decision_ids")  List<String> affectedDecisionIds,
        @JsonProperty("requires_re_evaluation") boolean requiresReEvaluation,
        @JsonProperty("recommendations")        List<String> recommendations
) {

    public ImpactReport {
        affectedDecisionIds = affectedDecisionIds == null ? List.of() : List.copyOf(affectedDecisionIds);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }

    public int decisionsAffected() {
        return affectedDecisionIds.size();
    }
}
