package com.eainde.policylens.engine;

import com.eainde.policylens.config.PolicyLensProperties;
import com.eainde.policylens.gateway.ScoredChunk;
import com.eainde.policylens.model.RiskLevel;
import com.eainde.policylens.model.Verdict;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.eainde.policylens.support.Fixtures.chunk;
import static com.eainde.policylens.support.Fixtures.transaction;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FallbackRiskEvaluatorTest {

    private final FallbackRiskEvaluator evaluator = new FallbackRiskEvaluator(new PolicyLensProperties.Evaluation());

    private static List<ScoredChunk> topRelevance(double score) {
        return List.of(new ScoredChunk(chunk("doc_1", 0, "policy text"), score));
    }

    @Test
    @DisplayName("75,000 from USA to a high-risk country scores 0.9 and is flagged")
    void largeTransferToHighRiskCountry() {
        FallbackRiskEvaluator.Assessment result =
                evaluator.evaluate(transaction("tx-1", "75000", "USA", "Iran"), topRelevance(0.6));

        assertThat(result.riskScore()).isCloseTo(0.9, within(1e-9));
        assertThat(result.verdict()).isEqualTo(Verdict.FLAG);
        assertThat(result.riskLevel()).isEqualTo(RiskLevel.HIGH);
        assertThat(result.confidence()).isEqualTo(FallbackRiskEvaluator.CONFIDENCE).isEqualTo(0.6);
        assertThat(result.reasoning()).contains("receiver country Iran is high-risk");
    }

    @Test
    @DisplayName("clamps the sum of every indicator to 1.0")
    void clamps() {
        FallbackRiskEvaluator.Assessment result =
                evaluator.evaluate(transaction("tx-1", "60000", "Syria", "North Korea"), topRelevance(0.95));

        assertThat(result.riskScore()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("scores a small domestic transfer as acceptable")
    void acceptable() {
        FallbackRiskEvaluator.Assessment result =
                evaluator.evaluate(transaction("tx-1", "250", "USA", "Canada"), List.of());

        assertThat(result.riskScore()).isEqualTo(0.0);
        assertThat(result.verdict()).isEqualTo(Verdict.ACCEPTABLE);
        assertThat(result.riskLevel()).isEqualTo(RiskLevel.LOW);
        assertThat(result.reasoning()).contains("no risk indicators");
    }

    @Test
    @DisplayName("sends a medium score to review")
    void review() {
        // 0.3 (amount) + 0.2 (strong policy match)
        FallbackRiskEvaluator.Assessment result =
                evaluator.evaluate(transaction("tx-1", "20000", "USA", "UK"), topRelevance(0.85));

        assertThat(result.riskScore()).isCloseTo(0.5, within(1e-9));
        assertThat(result.verdict()).isEqualTo(Verdict.NEEDS_REVIEW);
        assertThat(result.riskLevel()).isEqualTo(RiskLevel.MEDIUM);
    }

    @Test
    @DisplayName("matches high-risk countries case-insensitively, by name or code")
    void countryMatching() {
        HighRiskCountries countries = evaluator.highRiskCountries();

        assertThat(countries.contains("iran")).isTrue();
        assertThat(countries.contains(" NORTH KOREA ")).isTrue();
        assertThat(countries.contains("kp")).isTrue();
        assertThat(countries.contains("Germany")).isFalse();
        assertThat(countries.contains(null)).isFalse();
    }

    @Test
    @DisplayName("is a pure function of its inputs")
    void deterministic() {
        var tx = transaction("tx-1", "15000", "Iran", "USA");

        assertThat(evaluator.evaluate(tx, topRelevance(0.5))).isEqualTo(evaluator.evaluate(tx, topRelevance(0.5)));
    }
}
