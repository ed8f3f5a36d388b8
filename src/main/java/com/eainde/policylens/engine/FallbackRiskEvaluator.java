package com.eainde.policylens.engine;

import com.eainde.policylens.config.PolicyLensProperties;
import com.eainde.policylens.gateway.ScoredChunk;
import com.eainde.policylens.model.RiskLevel;
import com.eainde.policylens.model.Transaction;
import com.eainde.policylens.model.Verdict;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic rule-based risk used when the reasoning gateway is unavailable. A pure
 * function of the transaction, the top retrieval score and configuration.
 *
 * <pre>
 *   + 0.3  amount &gt; 10,000
 *   + 0.2  amount &gt; 50,000
 *   + 0.4  sender country high-risk
 *   + 0.4  receiver country high-risk
 *   + 0.2  top policy relevance &gt; 0.8
 *   clamp to [0,1]
 * </pre>
 */
public class FallbackRiskEvaluator {

    /** Confidence of every fallback assessment. */
    public static final double CONFIDENCE = 0.6;

    static final BigDecimal LARGE_AMOUNT = new BigDecimal("10000");
    static final BigDecimal VERY_LARGE_AMOUNT = new BigDecimal("50000");
    static final double LARGE_AMOUNT_RISK = 0.3;
    static final double VERY_LARGE_AMOUNT_RISK = 0.2;
    static final double COUNTRY_RISK = 0.4;
    static final double STRONG_POLICY_MATCH = 0.8;
    static final double STRONG_POLICY_MATCH_RISK = 0.2;

    private final PolicyLensProperties.Evaluation settings;
    private final HighRiskCountries highRiskCountries;

    public FallbackRiskEvaluator(PolicyLensProperties.Evaluation settings) {
        this.settings = settings;
        this.highRiskCountries = new HighRiskCountries(settings.getHighRiskCountries());
    }

    public record Assessment(Verdict verdict, RiskLevel riskLevel, double riskScore,
                             double confidence, String reasoning) {}

    public Assessment evaluate(Transaction tx, List<ScoredChunk> policies) {
        double score = 0.0;
        List<String> factors = new ArrayList<>();

        if (tx.amount().compareTo(LARGE_AMOUNT) > 0) {
            score += LARGE_AMOUNT_RISK;
            factors.add("amount exceeds 10,000");
        }
        if (tx.amount().compareTo(VERY_LARGE_AMOUNT) > 0) {
            score += VERY_LARGE_AMOUNT_RISK;
            factors.add("amount exceeds 50,000");
        }
        if (highRiskCountries.contains(tx.senderCountry())) {
            score += COUNTRY_RISK;
            factors.add("sender country " + tx.senderCountry().strip() + " is high-risk");
        }
        if (highRiskCountries.contains(tx.receiverCountry())) {
            score += COUNTRY_RISK;
            factors.add("receiver country " + tx.receiverCountry().strip() + " is high-risk");
        }
        double topRelevance = policies.isEmpty() ? 0.0 : policies.get(0).score();
        if (topRelevance > STRONG_POLICY_MATCH) {
            score += STRONG_POLICY_MATCH_RISK;
            factors.add("strong match with policy " + policies.get(0).chunk().docTitle());
        }
        score = Math.max(0.0, Math.min(1.0, score));

        Verdict verdict;
        RiskLevel level;
        if (score >= settings.getHighThreshold()) {
            verdict = Verdict.FLAG;
            level = RiskLevel.HIGH;
        } else if (score >= settings.getMediumThreshold()) {
            verdict = Verdict.NEEDS_REVIEW;
            level = RiskLevel.MEDIUM;
        } else {
            verdict = Verdict.ACCEPTABLE;
            level = RiskLevel.LOW;
        }

        String reasoning = "Rule-based assessment (reasoning model unavailable): "
                + (factors.isEmpty() ? "no risk indicators found" : String.join("; ", factors))
                + String.format(Locale.ROOT, ". Risk score %.2f.", score);
        return new Assessment(verdict, level, score, CONFIDENCE, reasoning);
    }

    public HighRiskCountries highRiskCountries() {
        return highRiskCountries;
    }
}
