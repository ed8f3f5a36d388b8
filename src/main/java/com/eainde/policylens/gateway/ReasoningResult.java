package com.eainde.policylens.gateway;

import com.eainde.policylens.model.RiskLevel;
import com.eainde.policylens.model.Verdict;

/**
 * Validated output of the reasoning step.
 *
 * @param kind       VALID when every field was present and in range, COERCED when defaults
 *                   or clamping were applied
 * @param verdict    verdict
 * @param riskLevel  risk level
 * @param riskScore  in [0,1]
 * @param confidence in [0,1]
 * @param reasoning  explanation
 * @param rawText    model output as received
 */
public record ReasoningResult(
        Kind kind,
        Verdict verdict,
        RiskLevel riskLevel,
        double riskScore,
        double confidence,
        String reasoning,
        String rawText
) {

    public enum Kind { VALID, COERCED }

    public boolean isCoerced() {
        return kind == Kind.COERCED;
    }
}
