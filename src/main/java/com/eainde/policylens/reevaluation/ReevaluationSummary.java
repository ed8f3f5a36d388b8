package com.eainde.policylens.reevaluation;

import com.eainde.policylens.model.ReevaluationOutcome;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Aggregate result of one batch re-evaluation run.
 *
 * @param status          COMPLETED, or CANCELLED when the run was cancelled
 * @param totalDecisions  decisions in the store snapshot
 * @param filtered        decisions matching the filter
 * @param reEvaluated     decisions replayed successfully
 * @param skipped         decisions whose payload could not be parsed
 * @param failed          decisions whose replay threw
 * @param notStarted      matching decisions not started because of cancellation
 * @param verdictsChanged replays whose verdict differs from the stored one
 * @param changes         one outcome per verdict change, in no particular order
 * @param timestamp       when the run finished
 */
public record ReevaluationSummary(
        @JsonProperty("status")                  Status status,
        @JsonProperty("total_decisions")         long totalDecisions,
        @JsonProperty("filtered")                int filtered,
        @JsonProperty("re_evaluated")            int reEvaluated,
        @JsonProperty("skipped")                 int skipped,
        @JsonProperty("failed")                  int failed,
        @JsonProperty("not_started")             int notStarted,
        @JsonProperty("verdicts_changed")        int verdictsChanged,
        @JsonProperty("changes")                 List<ReevaluationOutcome> changes,
        @JsonProperty("timestamp")               Instant timestamp
) {

    public enum Status { COMPLETED, CANCELLED }

    public ReevaluationSummary {
        changes = changes == null ? List.of() : List.copyOf(changes);
    }

    /**
     * Share of re-evaluated decisions whose verdict changed, in percent.
     */
    public double changeRate() {
        return reEvaluated == 0 ? 0.0 : 100.0 * verdictsChanged / reEvaluated;
    }
}
