package com.eainde.policylens.engine;

import com.eainde.policylens.config.PolicyLensProperties;
import com.eainde.policylens.exception.EvaluationFailureException;
import com.eainde.policylens.exception.PersistenceException;
import com.eainde.policylens.exception.ReasoningUnavailableException;
import com.eainde.policylens.exception.RetrievalException;
import com.eainde.policylens.gateway.CaseStore;
import com.eainde.policylens.gateway.EmbeddingGateway;
import com.eainde.policylens.gateway.ReasoningGateway;
import com.eainde.policylens.gateway.ReasoningResult;
import com.eainde.policylens.gateway.RetrievalGateway;
import com.eainde.policylens.gateway.ScoredChunk;
import com.eainde.policylens.metrics.ComplianceMetrics;
import com.eainde.policylens.model.ComplianceCase;
import com.eainde.policylens.model.ComplianceDecision;
import com.eainde.policylens.model.DecisionSource;
import com.eainde.policylens.model.PolicyCitation;
import com.eainde.policylens.model.PolicyTopic;
import com.eainde.policylens.model.SimilarCase;
import com.eainde.policylens.model.StoredDecision;
import com.eainde.policylens.model.Transaction;
import com.eainde.policylens.model.TransactionDescriptor;
import com.eainde.policylens.store.DecisionStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Evaluates one transaction: retrieve policy and precedent, reason (or fall back), persist.
 *
 * <h3>Flow:</h3>
 * <pre>
 *   descriptor ──► embed ──► searchPolicies(topK) ─┐
 *                        └─► searchCases(topCases) ┴─► reason ──► decision
 *                                                        │ unavailable
 *                                                        └─► fallback heuristic
 *   decision ──► DecisionStore.put ──► CaseStore.append
 * </pre>
 *
 * <p>Retrieval and decision-store failures fail the evaluation closed: an
 * {@link EvaluationFailureException} is thrown and no case is written. Reasoning failures
 * fail open into the fallback.</p>
 */
@Slf4j
public class TransactionEvaluationEngine {

    public static final String TRACE_ID = "traceId";

    private final EmbeddingGateway embeddingGateway;
    private final RetrievalGateway retrievalGateway;
    private final CaseStore caseStore;
    private final ReasoningGateway reasoningGateway;
    private final FallbackRiskEvaluator fallback;
    private final DecisionStore decisionStore;
    private final ObjectMapper objectMapper;
    private final ComplianceMetrics metrics;
    private final PolicyLensProperties.Evaluation settings;
    private final Clock clock;

    public TransactionEvaluationEngine(EmbeddingGateway embeddingGateway,
                                       RetrievalGateway retrievalGateway,
                                       CaseStore caseStore,
                                       ReasoningGateway reasoningGateway,
                                       FallbackRiskEvaluator fallback,
                                       DecisionStore decisionStore,
                                       ObjectMapper objectMapper,
                                       ComplianceMetrics metrics,
                                       PolicyLensProperties.Evaluation settings,
                                       Clock clock) {
        this.embeddingGateway = embeddingGateway;
        this.retrievalGateway = retrievalGateway;
        this.caseStore = caseStore;
        this.reasoningGateway = reasoningGateway;
        this.fallback = fallback;
        this.decisionStore = decisionStore;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.settings = settings;
        this.clock = clock;
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    public EvaluationResult evaluate(Transaction transaction) {
        return evaluate(transaction, null);
    }

    /**
     * @param topic optional policy topic restriction
     * @throws EvaluationFailureException on retrieval or persistence failure
     */
    public EvaluationResult evaluate(Transaction transaction, PolicyTopic topic) {
        String traceId = UUID.randomUUID().toString();
        String outerTraceId = MDC.get(TRACE_ID);
        MDC.put(TRACE_ID, traceId);
        long start = System.nanoTime();

        try {
            log.info("Evaluating transaction {} ({} {})",
                    transaction.transactionId(), transaction.amount(), transaction.currency());

            // Steps 1-3: descriptor, embedding, retrieval
            float[] vector;
            List<ScoredChunk> policies;
            List<SimilarCase> cases;
            try {
                vector = embeddingGateway.embed(TransactionDescriptor.describe(transaction));
                policies = retrievalGateway.searchPolicies(vector, settings.getTopK(), topic);
                cases = retrievalGateway.searchCases(vector, settings.getTopCases(), null);
            } catch (RetrievalException e) {
                throw failed(traceId, transaction, e);
            }
            log.debug("Retrieved {} policy chunks and {} similar cases", policies.size(), cases.size());

            // Steps 4-6: reasoning or fallback
            ComplianceDecision decision = decide(transaction, policies, cases);

            // Step 7: decision store, then step 8: case memory
            try {
                decisionStore.put(new StoredDecision(traceId, toPayload(transaction), decision, clock.instant()));
            } catch (PersistenceException e) {
                throw failed(traceId, transaction, e);
            }
            appendCase(transaction, vector, decision);

            Duration latency = Duration.ofNanos(System.nanoTime() - start);
            metrics.evaluationCompleted(decision.verdict(), decision.source(), latency);
            log.info("Transaction {} evaluated: {} / {} (risk {}, confidence {}, source {}) in {}ms",
                    transaction.transactionId(), decision.verdict(), decision.riskLevel(),
                    decision.riskScore(), decision.confidence(), decision.source(), latency.toMillis());
            return new EvaluationResult(decision, traceId, latency);
        } finally {
            if (outerTraceId != null) {
                MDC.put(TRACE_ID, outerTraceId);
            } else {
                MDC.remove(TRACE_ID);
            }
        }
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    private ComplianceDecision decide(Transaction tx, List<ScoredChunk> policies, List<SimilarCase> cases) {
        List<PolicyCitation> citations = policies.stream()
                .map(this::toCitation)
                .collect(Collectors.toList());
        Instant now = clock.instant();

        try {
            ReasoningResult result = reasoningGateway.reason(tx, policies, cases);
            return new ComplianceDecision(
                    tx.transactionId(),
                    result.verdict(),
                    result.riskLevel(),
                    clamp(result.riskScore()),
                    result.reasoning(),
                    citations,
                    cases,
                    clamp(result.confidence()),
                    result.isCoerced() ? DecisionSource.REASONING_COERCED : DecisionSource.REASONING_GATEWAY,
                    now,
                    result.isCoerced() ? result.rawText() : null);
        } catch (ReasoningUnavailableException e) {
            log.warn("Reasoning unavailable for transaction {}, using fallback heuristic: {}",
                    tx.transactionId(), e.getMessage());
            FallbackRiskEvaluator.Assessment assessment = fallback.evaluate(tx, policies);
            return new ComplianceDecision(
                    tx.transactionId(),
                    assessment.verdict(),
                    assessment.riskLevel(),
                    assessment.riskScore(),
                    assessment.reasoning(),
                    citations,
                    cases,
                    assessment.confidence(),
                    DecisionSource.FALLBACK_HEURISTIC,
                    now,
                    null);
        }
    }

    private void appendCase(Transaction tx, float[] vector, ComplianceDecision decision) {
        ComplianceCase newCase = new ComplianceCase(
                UUID.randomUUID().toString(),
                tx.transactionId(),
                vector,
                decision.verdict(),
                decision.riskScore(),
                decision.reasoning(),
                clock.instant());
        try {
            caseStore.append(newCase);
        } catch (RetrievalException e) {
            // the decision is already stored; a missing case only weakens future precedent
            log.error("Decision for transaction {} stored but case {} could not be written",
                    tx.transactionId(), newCase.caseId(), e);
        }
    }

    private PolicyCitation toCitation(ScoredChunk scored) {
        String text = scored.chunk().text();
        int limit = settings.getExcerptLength();
        String excerpt = text.length() > limit ? text.substring(0, limit) : text;
        return new PolicyCitation(
                scored.chunk().docId(),
                scored.chunk().docTitle(),
                scored.chunk().section(),
                excerpt,
                clamp(scored.score()),
                scored.chunk().version());
    }

    private String toPayload(Transaction transaction) {
        try {
            return objectMapper.writeValueAsString(transaction);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize transaction " + transaction.transactionId(), e);
        }
    }

    private EvaluationFailureException failed(String traceId, Transaction tx, RuntimeException cause) {
        metrics.evaluationFailed();
        log.error("Evaluation of transaction {} failed: {}", tx.transactionId(), cause.getMessage());
        return new EvaluationFailureException(traceId, tx.transactionId(), cause);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
