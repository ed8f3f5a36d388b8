package com.eainde.policylens.risk;

import com.eainde.policylens.model.SimilarCase;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Composite risk for one transaction.
 *
 * @param compositeScore {@code (1 - caseWeight) * policyRisk + caseWeight * caseRisk}, in [0,1]
 * @param policyRisk     policy-derived risk in [0,1]
 * @param caseRisk       similarity-weighted risk of precedent cases; 0.5 without precedent
 * @param caseWeight     weight given to case risk
 * @param verdict        FLAG / REVIEW / CLEAR
 * @param confidence     precedent-backed confidence label
 * @param riskFactors    contributing factors
 * @param similarCases   precedent used
 * @param degraded       true when precedent retrieval failed and only policy risk was used
 */
public record RiskAssessment(
        @JsonProperty("composite_score") double compositeScore,
        @JsonProperty("policy_risk")     double policyRisk,
        @JsonProperty("case_risk")       double caseRisk,
        @JsonProperty("case_weight")     double caseWeight,
        @JsonProperty("verdict")         RiskVerdict verdict,
        @JsonProperty("confidence")      ConfidenceLabel confidence,
        @JsonProperty("risk_factors")    List<RiskFactor> riskFactors,
        @JsonProperty("similar_cases")   List<SimilarCase> similarCases,
        @JsonProperty("degraded")        boolean degraded
) {

    public RiskAssessment {
        riskFactors = riskFactors == null ? List.of() : List.copyOf(riskFactors);
        similarCases = similarCases == null ? List.of() : List.copyOf(similarCases);
    }
}
