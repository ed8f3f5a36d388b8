package com.eainde.policylens.reevaluation;

import com.eainde.policylens.config.PolicyLensProperties;
import com.eainde.policylens.engine.EvaluationResult;
import com.eainde.policylens.engine.TransactionEvaluationEngine;
import com.eainde.policylens.exception.MalformedRecordException;
import com.eainde.policylens.metrics.ComplianceMetrics;
import com.eainde.policylens.model.ComplianceDecision;
import com.eainde.policylens.model.ReevaluationOutcome;
import com.eainde.policylens.model.ReevaluationTicket;
import com.eainde.policylens.model.StoredDecision;
import com.eainde.policylens.model.Transaction;
import com.eainde.policylens.model.Verdict;
import com.eainde.policylens.sentinel.PolicySentinel;
import com.eainde.policylens.store.AuditRecordStore;
import com.eainde.policylens.store.DecisionFilter;
import com.eainde.policylens.store.DecisionStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Replays stored decisions through the evaluation engine and reports verdict drift.
 *
 * <h3>Run:</h3>
 * <pre>
 *   1. snapshot cutoff = now (inclusive)
 *   2. page through the snapshot, keep decisions matching the filter
 *   3. per decision, on the worker pool:
 *        cancelled?            -> not started
 *        record unreadable     -> skipped
 *        payload unparsable    -> skipped
 *        engine throws         -> failed
 *        otherwise             -> re-evaluated, outcome recorded if the verdict changed
 * </pre>
 *
 * <p>The selection is read in full before the first replay starts, so decisions the run
 * itself stores are never part of it. One bad record never stops the run. Outcomes are collected across workers in no
 * guaranteed order.</p>
 */
@Slf4j
public class BatchReevaluator {

    static final double RISK_DELTA_THRESHOLD = 0.1;
    static final String DEFAULT_REASON = "Policy updates affected decision criteria";

    private final TransactionEvaluationEngine engine;
    private final DecisionStore decisionStore;
    private final AuditRecordStore auditStore;
    private final PolicySentinel sentinel;
    private final ObjectMapper objectMapper;
    private final Executor workers;
    private final Executor jobs;
    private final ComplianceMetrics metrics;
    private final PolicyLensProperties.Batch settings;
    private final Clock clock;

    /**
     * @param workers runs individual replays; bounded
     * @param jobs    runs asynchronous jobs started with {@link #start}; must not be {@code workers}
     */
    public BatchReevaluator(TransactionEvaluationEngine engine,
                            DecisionStore decisionStore,
                            AuditRecordStore auditStore,
                            PolicySentinel sentinel,
                            ObjectMapper objectMapper,
                            Executor workers,
                            Executor jobs,
                            ComplianceMetrics metrics,
                            PolicyLensProperties.Batch settings,
                            Clock clock) {
        this.engine = engine;
        this.decisionStore = decisionStore;
        this.auditStore = auditStore;
        this.sentinel = sentinel;
        this.objectMapper = objectMapper;
        this.workers = workers;
        this.jobs = jobs;
        this.metrics = metrics;
        this.settings = settings;
        this.clock = clock;
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    /**
     * Runs a batch to completion on the calling thread (replays run on the worker pool).
     */
    public ReevaluationSummary reevaluate(ReevaluationFilter filter) {
        return reevaluate(filter, new AtomicBoolean(false));
    }

    /**
     * Starts a batch asynchronously.
     */
    public ReevaluationJob start(ReevaluationFilter filter) {
        AtomicBoolean cancelled = new AtomicBoolean(false);
        String jobId = UUID.randomUUID().toString();
        CompletableFuture<ReevaluationSummary> result =
                CompletableFuture.supplyAsync(() -> reevaluate(filter, cancelled), jobs);
        log.info("Re-evaluation job {} started", jobId);
        return new ReevaluationJob(jobId, cancelled, result);
    }

    /**
     * Stored decisions at least {@code daysOld} days old, oldest first.
     *
     * @param verdict optional verdict restriction
     */
    public List<ReevaluationCandidate> candidates(int daysOld, Verdict verdict) {
        Instant now = clock.instant();
        DecisionFilter filter = new DecisionFilter(verdict, null, now.minus(Duration.ofDays(daysOld)), null);

        List<ReevaluationCandidate> candidates = new ArrayList<>();
        scan(filter, stored -> {
            if (!stored.isReadable()) {
                log.warn("Skipping unreadable decision {} from candidates", stored.decisionId());
                return;
            }
            candidates.add(new ReevaluationCandidate(
                    stored.decisionId(),
                    stored.decision().transactionId(),
                    stored.decision().verdict(),
                    stored.decision().riskScore(),
                    stored.storedAt(),
                    Duration.between(stored.storedAt(), now).toDays()));
        });
        return candidates;
    }

    /**
     * Replays every stored decision that cites the document.
     */
    public ReevaluationSummary reevaluateByPolicy(String docId) {
        List<String> impacted = sentinel.findImpacted(docId);
        log.info("Re-evaluating {} decisions citing document {}", impacted.size(), docId);
        return reevaluate(ReevaluationFilter.ofDecisionIds(new HashSet<>(impacted)));
    }

    /**
     * Replays the decisions of a queued ticket and marks the ticket completed.
     *
     * @throws IllegalArgumentException if no queued ticket has this token
     */
    public ReevaluationSummary processTicket(String token) {
        ReevaluationTicket ticket = auditStore.ticket(token)
                .filter(t -> t.status() == ReevaluationTicket.Status.QUEUED)
                .orElseThrow(() -> new IllegalArgumentException("No queued re-evaluation ticket " + token));

        ReevaluationSummary summary = reevaluate(ReevaluationFilter.ofDecisionIds(new HashSet<>(ticket.decisionIds())));
        auditStore.markCompleted(token, clock.instant());
        log.info("Re-evaluation ticket {} completed", token);
        return summary;
    }

    // =========================================================================
    //  Run
    // =========================================================================

    ReevaluationSummary reevaluate(ReevaluationFilter filter, AtomicBoolean cancelled) {
        Instant cutoff = clock.instant();
        long total = decisionStore.count(DecisionFilter.all().withSnapshotAt(cutoff));

        List<StoredDecision> selected = new ArrayList<>();
        if (filter.decisionIds() == null || !filter.decisionIds().isEmpty()) {
            DecisionFilter storeFilter = new DecisionFilter(filter.verdict(), filter.from(), filter.to(), cutoff);
            scan(storeFilter, stored -> {
                if (filter.acceptsId(stored.decisionId())) selected.add(stored);
            });
        }
        log.info("Re-evaluation started: {} of {} stored decisions match the filter", selected.size(), total);

        Counters counters = new Counters();
        List<CompletableFuture<Void>> tasks = new ArrayList<>(selected.size());
        for (StoredDecision stored : selected) {
            tasks.add(CompletableFuture.runAsync(() -> replay(stored, cancelled, counters), workers));
        }
        CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0])).join();

        ReevaluationSummary summary = new ReevaluationSummary(
                cancelled.get() ? ReevaluationSummary.Status.CANCELLED : ReevaluationSummary.Status.COMPLETED,
                total,
                selected.size(),
                counters.reEvaluated.get(),
                counters.skipped.get(),
                counters.failed.get(),
                counters.notStarted.get(),
                counters.changes.size(),
                new ArrayList<>(counters.changes),
                clock.instant());

        metrics.reevaluationFinished(summary.reEvaluated(), summary.verdictsChanged(),
                summary.skipped(), summary.failed());
        log.info("Re-evaluation {}: re-evaluated={}, changed={}, skipped={}, failed={}, notStarted={}",
                summary.status(), summary.reEvaluated(), summary.verdictsChanged(),
                summary.skipped(), summary.failed(), summary.notStarted());
        return summary;
    }

    private void replay(StoredDecision stored, AtomicBoolean cancelled, Counters counters) {
        if (cancelled.get()) {
            counters.notStarted.incrementAndGet();
            return;
        }

        Transaction transaction;
        try {
            transaction = parse(stored);
        } catch (MalformedRecordException e) {
            log.warn("Skipping decision {}: {}", e.getRecordId(), e.getMessage());
            counters.skipped.incrementAndGet();
            return;
        }

        try {
            EvaluationResult result = engine.evaluate(transaction);
            counters.reEvaluated.incrementAndGet();

            ComplianceDecision before = stored.decision();
            ComplianceDecision after = result.decision();
            if (before.verdict() != after.verdict()) {
                counters.changes.add(new ReevaluationOutcome(
                        transaction.transactionId(),
                        stored.decisionId(),
                        result.traceId(),
                        before.verdict(),
                        after.verdict(),
                        before.riskScore(),
                        after.riskScore(),
                        after.timestamp(),
                        reasonForChange(before, after)));
                log.info("Verdict changed for transaction {}: {} -> {}",
                        transaction.transactionId(), before.verdict(), after.verdict());
            }
        } catch (Exception e) {
            log.error("Re-evaluation of decision {} failed", stored.decisionId(), e);
            counters.failed.incrementAndGet();
        }
    }

    Transaction parse(StoredDecision stored) {
        if (!stored.isReadable()) {
            throw new MalformedRecordException(stored.decisionId(), "Stored decision is unreadable", null);
        }
        String payload = stored.transactionPayload();
        if (payload == null || payload.isBlank()) {
            throw new MalformedRecordException(stored.decisionId(), "Transaction payload is missing", null);
        }
        try {
            return objectMapper.readValue(payload, Transaction.class);
        } catch (JsonProcessingException e) {
            throw new MalformedRecordException(stored.decisionId(),
                    "Transaction payload is unparsable: " + e.getOriginalMessage(), e);
        }
    }

    static String reasonForChange(ComplianceDecision before, ComplianceDecision after) {
        List<String> reasons = new ArrayList<>();

        double delta = after.riskScore() - before.riskScore();
        if (Math.abs(delta) > RISK_DELTA_THRESHOLD) {
            reasons.add(String.format(Locale.ROOT, "Risk score %s from %.2f to %.2f",
                    delta > 0 ? "increased" : "decreased", before.riskScore(), after.riskScore()));
        }
        int citationsBefore = before.policyCitations().size();
        int citationsAfter = after.policyCitations().size();
        if (citationsBefore != citationsAfter) {
            reasons.add("Policy citations changed from " + citationsBefore + " to " + citationsAfter);
        }
        if (!Objects.equals(before.reasoning(), after.reasoning())) {
            reasons.add("Policy reasoning updated");
        }
        return reasons.isEmpty() ? DEFAULT_REASON : String.join("; ", reasons);
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    private void scan(DecisionFilter filter, Consumer<StoredDecision> sink) {
        int pageSize = settings.getPageSize();
        int page = 0;
        List<StoredDecision> batch;
        do {
            batch = decisionStore.list(filter, page++, pageSize);
            batch.forEach(sink);
        } while (batch.size() == pageSize);
    }

    private static final class Counters {
        final AtomicInteger reEvaluated = new AtomicInteger();
        final AtomicInteger skipped = new AtomicInteger();
        final AtomicInteger failed = new AtomicInteger();
        final AtomicInteger notStarted = new AtomicInteger();
        final Queue<ReevaluationOutcome> changes = new ConcurrentLinkedQueue<>();
    }
}
