package com.eainde.policylens.support;

import com.eainde.policylens.model.ComplianceDecision;
import com.eainde.policylens.model.DecisionSource;
import com.eainde.policylens.model.PolicyCitation;
import com.eainde.policylens.model.PolicyChunk;
import com.eainde.policylens.model.PolicySource;
import com.eainde.policylens.model.PolicyTopic;
import com.eainde.policylens.model.RiskLevel;
import com.eainde.policylens.model.SimilarCase;
import com.eainde.policylens.model.Transaction;
import com.eainde.policylens.model.Verdict;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

public final class Fixtures {

    public static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private Fixtures() {
    }

    public static ObjectMapper objectMapper() {
        return JsonMapper.builder()
                .findAndAddModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build();
    }

    public static Clock fixedClock() {
        return Clock.fixed(NOW, ZoneOffset.UTC);
    }

    /** Three attempts, 1 ms apart. */
    public static Retry fastRetry(String name) {
        return Retry.of(name, RetryConfig.custom()
                .maxAttempts(3)
                .intervalFunction(IntervalFunction.of(1))
                .build());
    }

    public static Transaction transaction(String id, String amount, String senderCountry, String receiverCountry) {
        return new Transaction(id, new BigDecimal(amount), "USD", "Acme Corp", "Globex Ltd",
                senderCountry, receiverCountry, "Invoice payment", NOW);
    }

    public static PolicyChunk chunk(String docId, int ordinal, String text) {
        return chunk(docId, ordinal, text, PolicyTopic.AML);
    }

    public static PolicyChunk chunk(String docId, int ordinal, String text, PolicyTopic topic) {
        return new PolicyChunk(docId + "_chunk_" + ordinal, docId, ordinal, text, "Policy " + docId,
                "Section " + (ordinal + 1), PolicySource.INTERNAL, topic, "1.0", true, NOW, null);
    }

    public static PolicyCitation citation(String docId) {
        return new PolicyCitation(docId, "Policy " + docId, "Section 1", "excerpt", 0.9, "1.0");
    }

    public static SimilarCase similarCase(String id, double similarity, Verdict verdict, double risk) {
        return new SimilarCase(id, "tx-" + id, similarity, verdict, risk, "past reasoning", NOW);
    }

    public static ComplianceDecision decision(String transactionId, Verdict verdict, double risk,
                                              List<PolicyCitation> citations) {
        RiskLevel level = verdict == Verdict.FLAG ? RiskLevel.HIGH
                : verdict == Verdict.NEEDS_REVIEW ? RiskLevel.MEDIUM : RiskLevel.LOW;
        return new ComplianceDecision(transactionId, verdict, level, risk, "reasoning for " + transactionId,
                citations, List.of(), 0.6, DecisionSource.FALLBACK_HEURISTIC, NOW, null);
    }
}
