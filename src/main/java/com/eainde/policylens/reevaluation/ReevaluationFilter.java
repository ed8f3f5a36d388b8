package com.eainde.policylens.reevaluation;

import com.eainde.policylens.model.Verdict;

import java.time.Instant;
import java.util.Set;

/**
 * Which stored decisions a batch run replays.
 *
 * @param verdict     only decisions with this verdict; null for any
 * @param decisionIds only these decision ids; null for any, empty for none
 * @param from        stored at or after; null for no lower bound
 * @param to          stored at or before; null for no upper bound
 */
public record ReevaluationFilter(
        Verdict verdict,
        Set<String> decisionIds,
        Instant from,
        Instant to
) {

    public ReevaluationFilter {
        decisionIds = decisionIds == null ? null : Set.copyOf(decisionIds);
    }

    public static ReevaluationFilter all() {
        return new ReevaluationFilter(null, null, null, null);
    }

    public static ReevaluationFilter ofDecisionIds(Set<String> decisionIds) {
        return new ReevaluationFilter(null, decisionIds, null, null);
    }

    boolean acceptsId(String decisionId) {
        return decisionIds == null || decisionIds.contains(decisionId);
    }
}
