package com.eainde.policylens.reevaluation;

import com.eainde.policylens.model.ReevaluationOutcome;
import com.eainde.policylens.model.Verdict;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.eainde.policylens.support.Fixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;

class ReevaluationReportFormatterTest {

    private static ReevaluationOutcome outcome(String txId, Verdict from, Verdict to) {
        return new ReevaluationOutcome(txId, "d-" + txId, "n-" + txId, from, to, 0.4, 0.8, NOW, "Risk score increased");
    }

    @Test
    @DisplayName("lists verdict changes sorted by transaction with the change rate")
    void withChanges() {
        ReevaluationSummary summary = new ReevaluationSummary(ReevaluationSummary.Status.COMPLETED,
                12, 10, 8, 2, 0, 0, 2,
                List.of(outcome("tx-9", Verdict.ACCEPTABLE, Verdict.FLAG),
                        outcome("tx-1", Verdict.NEEDS_REVIEW, Verdict.FLAG)),
                NOW);

        String report = ReevaluationReportFormatter.format(summary);

        assertThat(report).contains("RE-EVALUATION IMPACT REPORT", "SUMMARY", "VERDICT CHANGES",
                "Status:    COMPLETED", "(25.0%)", "Reason: Risk score increased");
        assertThat(report.indexOf("tx-1: NEEDS_REVIEW -> FLAG (risk 0.40 -> 0.80)"))
                .isPositive()
                .isLessThan(report.indexOf("tx-9: ACCEPTABLE -> FLAG"));
    }

    @Test
    @DisplayName("says so when nothing changed")
    void noChanges() {
        ReevaluationSummary summary = new ReevaluationSummary(ReevaluationSummary.Status.CANCELLED,
                5, 5, 0, 0, 0, 5, 0, List.of(), NOW);

        assertThat(ReevaluationReportFormatter.format(summary))
                .contains("Status:    CANCELLED", "No verdict changes.")
                .doesNotContain("VERDICT CHANGES");
        assertThat(summary.changeRate()).isZero();
    }
}
