package com.eainde.policylens.service;

import com.eainde.policylens.engine.EvaluationResult;
import com.eainde.policylens.risk.RiskAssessment;

/**
 * Outcome of submitting a transaction: the engine's stored decision and the composite risk
 * view. The two verdicts come from independent thresholds and may differ.
 */
public record TransactionAssessment(EvaluationResult evaluation, RiskAssessment risk) {

    public String decisionId() {
        return evaluation.traceId();
    }
}
