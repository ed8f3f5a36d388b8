package com.eainde.policylens.risk;

import com.eainde.policylens.config.PolicyLensProperties;
import com.eainde.policylens.engine.HighRiskCountries;
import com.eainde.policylens.gateway.EmbeddingGateway;
import com.eainde.policylens.gateway.RetrievalGateway;
import com.eainde.policylens.model.ComplianceDecision;
import com.eainde.policylens.model.RiskLevel;
import com.eainde.policylens.model.SimilarCase;
import com.eainde.policylens.model.Transaction;
import com.eainde.policylens.model.TransactionDescriptor;
import com.eainde.policylens.model.Verdict;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Blends policy-derived risk with the risk of similar past cases.
 *
 * <pre>
 *   caseRisk  = Σ(sim² · risk) / Σ(sim²)        0.5 without precedent
 *   composite = (1 - w) · policyRisk + w · caseRisk
 * </pre>
 *
 * Squaring the similarity lets close precedent dominate distant precedent.
 */
@Slf4j
public class CompositeRiskScorer {

    static final double NEUTRAL_CASE_RISK = 0.5;
    static final BigDecimal LARGE_AMOUNT = new BigDecimal("50000");
    static final BigDecimal VERY_LARGE_AMOUNT = new BigDecimal("100000");
    static final double CLOSE_PRECEDENT = 0.8;
    static final int HIGH_CONFIDENCE_CASES = 3;
    static final double HIGH_CONFIDENCE_SIMILARITY = 0.7;
    static final double MEDIUM_CONFIDENCE_SIMILARITY = 0.5;

    private static final Set<Verdict> PRECEDENT_VERDICTS = EnumSet.of(Verdict.FLAG, Verdict.NEEDS_REVIEW);

    private final PolicyLensProperties.Risk settings;
    private final HighRiskCountries highRiskCountries;
    private final EmbeddingGateway embeddingGateway;
    private final RetrievalGateway retrievalGateway;

    public CompositeRiskScorer(PolicyLensProperties.Risk settings,
                               HighRiskCountries highRiskCountries,
                               EmbeddingGateway embeddingGateway,
                               RetrievalGateway retrievalGateway) {
        this.settings = settings;
        this.highRiskCountries = highRiskCountries;
        this.embeddingGateway = embeddingGateway;
        this.retrievalGateway = retrievalGateway;
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    /**
     * Scores a transaction already evaluated by the engine. Retrieves flagged or under-review
     * precedent, excluding the transaction's own case. Never throws: a retrieval failure
     * degrades to policy-only risk.
     */
    public RiskAssessment assess(Transaction transaction, ComplianceDecision decision) {
        List<SimilarCase> cases;
        boolean degraded = false;
        try {
            float[] vector = embeddingGateway.embed(TransactionDescriptor.describe(transaction));
            cases = retrievalGateway.searchCases(vector, settings.getSimilarCases(), PRECEDENT_VERDICTS,
                    transaction.transactionId());
        } catch (RuntimeException e) {
            log.warn("Precedent retrieval failed for transaction {}, scoring on policy risk only: {}",
                    transaction.transactionId(), e.getMessage());
            cases = List.of();
            degraded = true;
        }

        RiskAssessment assessment = score(transaction, decision.riskScore(), decision.policyCitations().size(),
                cases, settings.getCaseWeight());
        if (!degraded) return assessment;
        return new RiskAssessment(assessment.compositeScore(), assessment.policyRisk(), assessment.caseRisk(),
                assessment.caseWeight(), assessment.verdict(), assessment.confidence(), assessment.riskFactors(),
                assessment.similarCases(), true);
    }

    public RiskAssessment score(Transaction transaction, double policyRisk, int citationCount,
                                List<SimilarCase> similarCases) {
        return score(transaction, policyRisk, citationCount, similarCases, settings.getCaseWeight());
    }

    public RiskAssessment score(Transaction transaction, double policyRisk, int citationCount,
                                List<SimilarCase> similarCases, double caseWeight) {
        double weight = clamp(caseWeight);
        double policy = clamp(policyRisk);
        double caseRisk = caseRisk(similarCases);
        double composite = clamp((1.0 - weight) * policy + weight * caseRisk);

        return new RiskAssessment(
                composite,
                policy,
                caseRisk,
                weight,
                verdict(composite),
                confidence(similarCases),
                riskFactors(transaction, citationCount, similarCases),
                similarCases,
                false);
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    static double caseRisk(List<SimilarCase> cases) {
        double weighted = 0.0;
        double totalWeight = 0.0;
        for (SimilarCase c : cases) {
            double sim = clamp(c.similarityScore());
            double w = sim * sim;
            weighted += w * clamp(c.riskScore());
            totalWeight += w;
        }
        if (totalWeight == 0.0) return NEUTRAL_CASE_RISK;
        return clamp(weighted / totalWeight);
    }

    private RiskVerdict verdict(double composite) {
        if (composite >= settings.getFlagThreshold()) return RiskVerdict.FLAG;
        if (composite >= settings.getReviewThreshold()) return RiskVerdict.REVIEW;
        return RiskVerdict.CLEAR;
    }

    static ConfidenceLabel confidence(List<SimilarCase> cases) {
        if (cases.isEmpty()) return ConfidenceLabel.MEDIUM;
        double avg = averageSimilarity(cases);
        if (cases.size() >= HIGH_CONFIDENCE_CASES && avg > HIGH_CONFIDENCE_SIMILARITY) return ConfidenceLabel.HIGH;
        if (avg > MEDIUM_CONFIDENCE_SIMILARITY) return ConfidenceLabel.MEDIUM;
        return ConfidenceLabel.LOW;
    }

    private List<RiskFactor> riskFactors(Transaction tx, int citationCount, List<SimilarCase> cases) {
        List<RiskFactor> factors = new ArrayList<>();

        if (tx.amount().compareTo(LARGE_AMOUNT) > 0) {
            RiskLevel severity = tx.amount().compareTo(VERY_LARGE_AMOUNT) > 0 ? RiskLevel.HIGH : RiskLevel.MEDIUM;
            factors.add(new RiskFactor("large_amount", severity,
                    "Transaction amount " + tx.amount().toPlainString() + " " + tx.currency()
                            + " exceeds " + LARGE_AMOUNT.toPlainString()));
        }

        List<String> risky = new ArrayList<>();
        if (highRiskCountries.contains(tx.senderCountry())) risky.add(tx.senderCountry().strip());
        if (highRiskCountries.contains(tx.receiverCountry())) risky.add(tx.receiverCountry().strip());
        if (!risky.isEmpty()) {
            factors.add(new RiskFactor("high_risk_country", RiskLevel.HIGH,
                    "Involves high-risk jurisdiction: " + String.join(", ", risky)));
        }

        if (citationCount > 0) {
            factors.add(new RiskFactor("policy_citations", RiskLevel.HIGH,
                    citationCount + " policy section(s) apply to this transaction"));
        }

        List<SimilarCase> flagged = cases.stream()
                .filter(c -> PRECEDENT_VERDICTS.contains(c.verdict()))
                .collect(Collectors.toList());
        if (!flagged.isEmpty()) {
            double avg = averageSimilarity(flagged);
            factors.add(new RiskFactor("similar_flagged_cases",
                    avg > CLOSE_PRECEDENT ? RiskLevel.HIGH : RiskLevel.MEDIUM,
                    String.format(Locale.ROOT, "%d similar flagged case(s), average similarity %.2f",
                            flagged.size(), avg)));
        }
        return factors;
    }

    private static double averageSimilarity(List<SimilarCase> cases) {
        return cases.stream().mapToDouble(c -> clamp(c.similarityScore())).average().orElse(0.0);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
