package com.eainde.policylens.risk;

import com.eainde.policylens.config.PolicyLensProperties;
import com.eainde.policylens.engine.HighRiskCountries;
import com.eainde.policylens.exception.RetrievalException;
import com.eainde.policylens.gateway.EmbeddingGateway;
import com.eainde.policylens.gateway.RetrievalGateway;
import com.eainde.policylens.model.ComplianceDecision;
import com.eainde.policylens.model.RiskLevel;
import com.eainde.policylens.model.SimilarCase;
import com.eainde.policylens.model.Transaction;
import com.eainde.policylens.model.Verdict;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.EnumSet;
import java.util.List;

import static com.eainde.policylens.support.Fixtures.citation;
import static com.eainde.policylens.support.Fixtures.decision;
import static com.eainde.policylens.support.Fixtures.similarCase;
import static com.eainde.policylens.support.Fixtures.transaction;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CompositeRiskScorerTest {

    private static final float[] VECTOR = {0.5f, 0.5f};

    @Mock
    private EmbeddingGateway embeddingGateway;
    @Mock
    private RetrievalGateway retrievalGateway;

    private CompositeRiskScorer scorer;
    private final Transaction domestic = transaction("tx-1", "500", "USA", "Canada");

    @BeforeEach
    void setUp() {
        scorer = new CompositeRiskScorer(new PolicyLensProperties.Risk(),
                new HighRiskCountries(List.of("Iran", "North Korea")), embeddingGateway, retrievalGateway);
    }

    // =========================================================================
    //  Composite score
    // =========================================================================

    @Nested
    @DisplayName("Composite score")
    class Composite {

        @Test
        @DisplayName("uses a neutral case risk of 0.5 without precedent")
        void noPrecedent() {
            RiskAssessment result = scorer.score(domestic, 0.8, 0, List.of());

            assertThat(result.caseRisk()).isEqualTo(0.5);
            assertThat(result.compositeScore()).isCloseTo(0.7 * 0.8 + 0.3 * 0.5, within(1e-9));
            assertThat(result.verdict()).isEqualTo(RiskVerdict.REVIEW);
            assertThat(result.confidence()).isEqualTo(ConfidenceLabel.MEDIUM);
        }

        @Test
        @DisplayName("weights precedent by squared similarity")
        void squaredSimilarity() {
            List<SimilarCase> cases = List.of(
                    similarCase("a", 0.9, Verdict.FLAG, 0.9),
                    similarCase("b", 0.3, Verdict.ACCEPTABLE, 0.1));

            // (0.81 * 0.9 + 0.09 * 0.1) / 0.9
            assertThat(CompositeRiskScorer.caseRisk(cases)).isCloseTo(0.82, within(1e-9));
        }

        @Test
        @DisplayName("ignores precedent with zero similarity")
        void zeroSimilarity() {
            assertThat(CompositeRiskScorer.caseRisk(List.of(similarCase("a", 0.0, Verdict.FLAG, 1.0))))
                    .isEqualTo(0.5);
        }

        @Test
        @DisplayName("honours the case weight at its extremes")
        void weightExtremes() {
            List<SimilarCase> cases = List.of(similarCase("a", 0.9, Verdict.FLAG, 0.2));

            assertThat(scorer.score(domestic, 0.9, 0, cases, 0.0).compositeScore()).isCloseTo(0.9, within(1e-9));
            assertThat(scorer.score(domestic, 0.9, 0, cases, 1.0).compositeScore()).isCloseTo(0.2, within(1e-9));
        }

        @Test
        @DisplayName("maps the composite score onto FLAG / REVIEW / CLEAR")
        void verdicts() {
            assertThat(scorer.score(domestic, 1.0, 0, List.of()).verdict()).isEqualTo(RiskVerdict.FLAG);
            assertThat(scorer.score(domestic, 0.5, 0, List.of()).verdict()).isEqualTo(RiskVerdict.REVIEW);
            assertThat(scorer.score(domestic, 0.1, 0, List.of()).verdict()).isEqualTo(RiskVerdict.CLEAR);
        }
    }

    // =========================================================================
    //  Confidence and factors
    // =========================================================================

    @Nested
    @DisplayName("Confidence and risk factors")
    class Factors {

        @Test
        @DisplayName("labels confidence by precedent count and average similarity")
        void confidence() {
            assertThat(CompositeRiskScorer.confidence(List.of(
                    similarCase("a", 0.8, Verdict.FLAG, 0.9),
                    similarCase("b", 0.75, Verdict.FLAG, 0.9),
                    similarCase("c", 0.9, Verdict.FLAG, 0.9)))).isEqualTo(ConfidenceLabel.HIGH);
            assertThat(CompositeRiskScorer.confidence(List.of(
                    similarCase("a", 0.8, Verdict.FLAG, 0.9),
                    similarCase("b", 0.9, Verdict.FLAG, 0.9)))).isEqualTo(ConfidenceLabel.MEDIUM);
            assertThat(CompositeRiskScorer.confidence(List.of(
                    similarCase("a", 0.4, Verdict.FLAG, 0.9)))).isEqualTo(ConfidenceLabel.LOW);
        }

        @Test
        @DisplayName("reports amount, country, citation and precedent factors")
        void allFactors() {
            Transaction tx = transaction("tx-1", "120000", "USA", "iran");
            List<SimilarCase> cases = List.of(
                    similarCase("a", 0.95, Verdict.FLAG, 0.9),
                    similarCase("b", 0.85, Verdict.NEEDS_REVIEW, 0.6));

            RiskAssessment result = scorer.score(tx, 0.9, 2, cases);

            assertThat(result.riskFactors()).extracting(RiskFactor::factor)
                    .containsExactly("large_amount", "high_risk_country", "policy_citations", "similar_flagged_cases");
            assertThat(result.riskFactors().get(0).severity()).isEqualTo(RiskLevel.HIGH);
            assertThat(result.riskFactors().get(1).description()).contains("iran");
            assertThat(result.riskFactors().get(2).description()).startsWith("2 policy section(s)");
            assertThat(result.riskFactors().get(3).severity()).isEqualTo(RiskLevel.HIGH);
            assertThat(result.riskFactors().get(3).description()).contains("2 similar flagged case(s)", "0.90");
        }

        @Test
        @DisplayName("grades a moderately large amount as medium severity")
        void mediumAmount() {
            RiskAssessment result = scorer.score(transaction("tx-1", "60000", "USA", "UK"), 0.3, 0, List.of());

            assertThat(result.riskFactors()).singleElement()
                    .satisfies(f -> {
                        assertThat(f.factor()).isEqualTo("large_amount");
                        assertThat(f.severity()).isEqualTo(RiskLevel.MEDIUM);
                    });
        }

        @Test
        @DisplayName("reports no factors for a small domestic transfer")
        void noFactors() {
            assertThat(scorer.score(domestic, 0.1, 0, List.of()).riskFactors()).isEmpty();
        }
    }

    // =========================================================================
    //  Assess
    // =========================================================================

    @Nested
    @DisplayName("Assessing an evaluated transaction")
    class Assess {

        private final ComplianceDecision decision = decision("tx-1", Verdict.FLAG, 0.9, List.of(citation("doc_1")));

        @Test
        @DisplayName("retrieves flagged precedent excluding the transaction's own case")
        void excludesOwnCase() {
            when(embeddingGateway.embed(anyString())).thenReturn(VECTOR);
            when(retrievalGateway.searchCases(VECTOR, 5, EnumSet.of(Verdict.FLAG, Verdict.NEEDS_REVIEW), "tx-1"))
                    .thenReturn(List.of(similarCase("a", 0.9, Verdict.FLAG, 0.8)));

            RiskAssessment result = scorer.assess(domestic, decision);

            verify(retrievalGateway).searchCases(VECTOR, 5, EnumSet.of(Verdict.FLAG, Verdict.NEEDS_REVIEW), "tx-1");
            assertThat(result.policyRisk()).isEqualTo(0.9);
            assertThat(result.caseRisk()).isCloseTo(0.8, within(1e-9));
            assertThat(result.compositeScore()).isCloseTo(0.7 * 0.9 + 0.3 * 0.8, within(1e-9));
            assertThat(result.degraded()).isFalse();
        }

        @Test
        @DisplayName("degrades to policy risk when precedent retrieval fails")
        void degrades() {
            when(embeddingGateway.embed(anyString()))
                    .thenThrow(new RetrievalException("embedding model down", new RuntimeException()));

            RiskAssessment result = scorer.assess(domestic, decision);

            assertThat(result.degraded()).isTrue();
            assertThat(result.similarCases()).isEmpty();
            assertThat(result.caseRisk()).isEqualTo(0.5);
            assertThat(result.compositeScore()).isCloseTo(0.7 * 0.9 + 0.3 * 0.5, within(1e-9));
        }
    }
}
