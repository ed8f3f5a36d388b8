package com.eainde.policylens.reevaluation;

import com.eainde.policylens.model.ReevaluationOutcome;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Plain-text re-evaluation impact report.
 */
public final class ReevaluationReportFormatter {

    private static final String RULE = "=".repeat(60);

    private ReevaluationReportFormatter() {
    }

    public static String format(ReevaluationSummary summary) {
        StringBuilder sb = new StringBuilder();
        sb.append(RULE).append('\n')
                .append("RE-EVALUATION IMPACT REPORT\n")
                .append(RULE).append('\n')
                .append("Generated: ").append(summary.timestamp()).append('\n')
                .append("Status:    ").append(summary.status()).append("\n\n");

        sb.append("SUMMARY\n");
        line(sb, "Total decisions", summary.totalDecisions());
        line(sb, "Matching filter", summary.filtered());
        line(sb, "Re-evaluated", summary.reEvaluated());
        line(sb, "Skipped (malformed)", summary.skipped());
        line(sb, "Failed", summary.failed());
        line(sb, "Not started", summary.notStarted());
        sb.append(String.format(Locale.ROOT, "  %-22s %6d (%.1f%%)%n",
                "Verdicts changed", summary.verdictsChanged(), summary.changeRate()));

        if (summary.changes().isEmpty()) {
            sb.append("\nNo verdict changes.\n");
            return sb.toString();
        }

        sb.append("\nVERDICT CHANGES\n");
        List<ReevaluationOutcome> ordered = summary.changes().stream()
                .sorted(Comparator.comparing(ReevaluationOutcome::transactionId))
                .collect(Collectors.toList());
        for (ReevaluationOutcome change : ordered) {
            sb.append(String.format(Locale.ROOT, "  %s: %s -> %s (risk %.2f -> %.2f)%n",
                    change.transactionId(), change.oldVerdict(), change.newVerdict(),
                    change.oldRiskScore(), change.newRiskScore()));
            sb.append("    Reason: ").append(change.reason()).append('\n');
        }
        return sb.toString();
    }

    private static void line(StringBuilder sb, String label, long value) {
        sb.append(String.format(Locale.ROOT, "  %-22s %6d%n", label, value));
    }
}
