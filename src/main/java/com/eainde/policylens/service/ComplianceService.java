package com.eainde.policylens.service;

import com.eainde.policylens.engine.EvaluationResult;
import com.eainde.policylens.engine.PolicyQueryService;
import com.eainde.policylens.engine.QueryAnswer;
import com.eainde.policylens.engine.TransactionEvaluationEngine;
import com.eainde.policylens.metrics.ComplianceMetrics;
import com.eainde.policylens.model.DecisionFeedback;
import com.eainde.policylens.model.PolicyTopic;
import com.eainde.policylens.model.StoredDecision;
import com.eainde.policylens.model.Transaction;
import com.eainde.policylens.model.Verdict;
import com.eainde.policylens.reevaluation.BatchReevaluator;
import com.eainde.policylens.reevaluation.ReevaluationCandidate;
import com.eainde.policylens.reevaluation.ReevaluationFilter;
import com.eainde.policylens.reevaluation.ReevaluationJob;
import com.eainde.policylens.reevaluation.ReevaluationReportFormatter;
import com.eainde.policylens.reevaluation.ReevaluationSummary;
import com.eainde.policylens.risk.CompositeRiskScorer;
import com.eainde.policylens.risk.RiskAssessment;
import com.eainde.policylens.store.AuditRecordStore;
import com.eainde.policylens.store.DecisionFilter;
import com.eainde.policylens.store.DecisionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Entry point for transactions, decisions, reviewer feedback, re-evaluation and policy questions.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ComplianceService {

    private final TransactionEvaluationEngine engine;
    private final CompositeRiskScorer riskScorer;
    private final DecisionStore decisionStore;
    private final BatchReevaluator reevaluator;
    private final PolicyQueryService queryService;
    private final AuditRecordStore auditStore;
    private final ComplianceMetrics metrics;
    private final Clock clock;

    // =========================================================================
    //  Transactions and decisions
    // =========================================================================

    /**
     * Evaluates and stores a decision for the transaction, then scores composite risk.
     *
     * @param topic optional policy topic restriction
     * @throws com.eainde.policylens.exception.EvaluationFailureException if the evaluation failed closed
     */
    public TransactionAssessment submitTransaction(Transaction transaction, PolicyTopic topic) {
        EvaluationResult evaluation = engine.evaluate(transaction, topic);
        RiskAssessment risk = riskScorer.assess(transaction, evaluation.decision());
        return new TransactionAssessment(evaluation, risk);
    }

    public Optional<StoredDecision> getDecision(String decisionId) {
        return decisionStore.get(decisionId);
    }

    public List<StoredDecision> listDecisions(Verdict verdict, int page, int pageSize) {
        return decisionStore.list(verdict == null ? DecisionFilter.all() : DecisionFilter.ofVerdict(verdict),
                page, pageSize);
    }

    public long countDecisions(Verdict verdict) {
        return decisionStore.count(verdict == null ? DecisionFilter.all() : DecisionFilter.ofVerdict(verdict));
    }

    // =========================================================================
    //  Feedback
    // =========================================================================

    /**
     * Records a reviewer's correction of a stored decision. The decision is left as stored.
     *
     * @param correctedReasoning optional
     * @param reviewerNotes      optional
     * @throws IllegalArgumentException if the decision is unknown, or the verdict or reviewer is missing
     * @throws IllegalStateException    if the stored decision cannot be read
     */
    public DecisionFeedback submitFeedback(String decisionId, Verdict correctedVerdict, String correctedReasoning,
                                           String reviewerNotes, String reviewerId) {
        if (correctedVerdict == null) {
            throw new IllegalArgumentException("Corrected verdict is required");
        }
        if (reviewerId == null || reviewerId.isBlank()) {
            throw new IllegalArgumentException("Reviewer id is required");
        }
        StoredDecision stored = decisionStore.get(decisionId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown decision " + decisionId));
        if (!stored.isReadable()) {
            throw new IllegalStateException("Stored decision " + decisionId + " is unreadable");
        }

        DecisionFeedback feedback = new DecisionFeedback(
                UUID.randomUUID().toString(),
                stored.decision().transactionId(),
                decisionId,
                stored.decision().verdict(),
                correctedVerdict,
                correctedReasoning,
                reviewerNotes,
                reviewerId.strip(),
                clock.instant());
        auditStore.saveFeedback(feedback);
        metrics.feedbackReceived(correctedVerdict, feedback.overturnsVerdict());
        log.info("Feedback {} on decision {} (transaction {}): {} -> {} by {}",
                feedback.feedbackId(), decisionId, feedback.transactionId(),
                feedback.originalVerdict(), correctedVerdict, feedback.reviewerId());
        return feedback;
    }

    public List<DecisionFeedback> feedbackFor(String transactionId) {
        return auditStore.feedbackFor(transactionId);
    }

    public List<DecisionFeedback> recentFeedback(int limit) {
        return auditStore.recentFeedback(limit);
    }

    // =========================================================================
    //  Re-evaluation
    // =========================================================================

    /**
     * Replays one stored decision.
     *
     * @throws IllegalArgumentException if no such decision is stored
     */
    public ReevaluationSummary replay(String decisionId) {
        if (decisionStore.get(decisionId).isEmpty()) {
            throw new IllegalArgumentException("Unknown decision " + decisionId);
        }
        return reevaluator.reevaluate(ReevaluationFilter.ofDecisionIds(Set.of(decisionId)));
    }

    public ReevaluationSummary reevaluate(ReevaluationFilter filter) {
        return reevaluator.reevaluate(filter);
    }

    public ReevaluationJob triggerBatch(ReevaluationFilter filter) {
        return reevaluator.start(filter);
    }

    public ReevaluationSummary reevaluateByPolicy(String docId) {
        return reevaluator.reevaluateByPolicy(docId);
    }

    public ReevaluationSummary processTicket(String token) {
        return reevaluator.processTicket(token);
    }

    public List<ReevaluationCandidate> candidates(int daysOld, Verdict verdict) {
        return reevaluator.candidates(daysOld, verdict);
    }

    public String report(ReevaluationSummary summary) {
        return ReevaluationReportFormatter.format(summary);
    }

    // =========================================================================
    //  Policy questions
    // =========================================================================

    public QueryAnswer query(String question, PolicyTopic topic, int topK) {
        log.info("Answering policy question (topic={}, topK={})", topic, topK);
        return queryService.answer(question, topic, topK);
    }
}
