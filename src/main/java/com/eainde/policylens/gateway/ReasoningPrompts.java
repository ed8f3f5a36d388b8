package com.eainde.policylens.gateway;

import com.eainde.policylens.model.SimilarCase;
import com.eainde.policylens.model.Transaction;
import com.eainde.policylens.model.TransactionDescriptor;

import java.util.List;
import java.util.Locale;

/**
 * Prompt text for the reasoning model.
 */
final class ReasoningPrompts {

    static final String EVALUATION_SYSTEM = """
            You are a financial compliance analyst. Evaluate the transaction against the \
            policy excerpts and precedent cases provided. Cite only the policies given. \
            Respond with a single JSON object and nothing else:
            {
              "verdict": "FLAG" | "NEEDS_REVIEW" | "ACCEPTABLE",
              "risk_level": "HIGH" | "MEDIUM" | "LOW" | "ACCEPTABLE",
              "risk_score": number between 0 and 1,
              "confidence": number between 0 and 1,
              "reasoning": "short explanation referencing the policies"
            }
            """;

    static final String QUERY_SYSTEM = """
            You answer compliance questions using only the policy excerpts provided. \
            If the excerpts do not answer the question, say so. \
            Respond with a single JSON object and nothing else:
            {"answer": "text", "confidence": number between 0 and 1}
            """;

    private ReasoningPrompts() {
    }

    static String evaluation(Transaction tx, List<ScoredChunk> policies, List<SimilarCase> cases) {
        StringBuilder sb = new StringBuilder();
        sb.append("TRANSACTION\n").append(TransactionDescriptor.describe(tx)).append("\n\n");

        sb.append("POLICY EXCERPTS\n");
        appendPolicies(sb, policies);

        sb.append("\nSIMILAR PAST CASES\n");
        if (cases.isEmpty()) {
            sb.append("(none)\n");
        }
        for (int i = 0; i < cases.size(); i++) {
            SimilarCase c = cases.get(i);
            sb.append(i + 1).append(". similarity=").append(format(c.similarityScore()))
                    .append(" verdict=").append(c.verdict())
                    .append(" risk=").append(format(c.riskScore()))
                    .append(" reasoning: ").append(c.reasoning()).append('\n');
        }
        return sb.toString();
    }

    static String question(String question, List<ScoredChunk> policies) {
        StringBuilder sb = new StringBuilder();
        sb.append("QUESTION\n").append(question.strip()).append("\n\nPOLICY EXCERPTS\n");
        appendPolicies(sb, policies);
        return sb.toString();
    }

    private static void appendPolicies(StringBuilder sb, List<ScoredChunk> policies) {
        if (policies.isEmpty()) {
            sb.append("(none)\n");
        }
        for (int i = 0; i < policies.size(); i++) {
            ScoredChunk p = policies.get(i);
            sb.append('[').append(i + 1).append("] ").append(p.chunk().docTitle())
                    .append(" v").append(p.chunk().version());
            if (p.chunk().section() != null) {
                sb.append(", ").append(p.chunk().section());
            }
            sb.append(" (relevance ").append(format(p.score())).append(")\n")
                    .append(p.chunk().text()).append("\n");
        }
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
