package com.eainde.policylens.sentinel;

import com.eainde.policylens.chunk.SectionHeadings;
import com.eainde.policylens.config.PolicyLensProperties;
import com.eainde.policylens.metrics.ComplianceMetrics;
import com.eainde.policylens.model.ImpactReport;
import com.eainde.policylens.model.PolicyChangeRecord;
import com.eainde.policylens.model.ReevaluationTicket;
import com.eainde.policylens.model.StoredDecision;
import com.eainde.policylens.store.AuditRecordStore;
import com.eainde.policylens.store.DecisionFilter;
import com.eainde.policylens.store.DecisionStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Detects and classifies policy edits, finds the decisions they may invalidate and queues
 * those decisions for re-evaluation. Every change, report and ticket is written to the audit
 * store before it is returned.
 */
@Slf4j
public class PolicySentinel {

    static final String CONTENT_LEVEL_CHANGE = "Content-level changes detected";

    private final AuditRecordStore auditStore;
    private final DecisionStore decisionStore;
    private final ComplianceMetrics metrics;
    private final PolicyLensProperties.Sentinel settings;
    private final Clock clock;

    public PolicySentinel(AuditRecordStore auditStore,
                          DecisionStore decisionStore,
                          ComplianceMetrics metrics,
                          PolicyLensProperties.Sentinel settings,
                          Clock clock) {
        this.auditStore = auditStore;
        this.decisionStore = decisionStore;
        this.metrics = metrics;
        this.settings = settings;
        this.clock = clock;
    }

    // =========================================================================
    //  Change detection
    // =========================================================================

    public PolicyChangeRecord detectChange(String oldDocId, String newDocId, String oldText, String newText) {
        double ratio = SequenceSimilarity.ratio(oldText, newText);

        PolicyChangeRecord change = PolicyChangeRecord.of(
                UUID.randomUUID().toString(),
                oldDocId,
                newDocId,
                ratio,
                sectionsAffected(oldText, newText),
                clock.instant());

        auditStore.saveChange(change);
        metrics.policyChangeDetected(change.classification());
        log.info("Policy change {} -> {}: {} (similarity {}, magnitude {})",
                oldDocId, newDocId, change.classification(),
                format(change.similarityRatio()), format(change.changeMagnitude()));
        return change;
    }

    static List<String> sectionsAffected(String oldText, String newText) {
        Set<String> oldSections = SectionHeadings.labels(oldText);
        Set<String> newSections = SectionHeadings.labels(newText);

        List<String> affected = new ArrayList<>();
        for (String section : newSections) {
            if (!oldSections.contains(section)) affected.add("Added: " + section);
        }
        for (String section : oldSections) {
            if (!newSections.contains(section)) affected.add("Removed: " + section);
        }
        if (affected.isEmpty()) {
            affected.add(CONTENT_LEVEL_CHANGE);
        }
        return affected;
    }

    // =========================================================================
    //  Impact
    // =========================================================================

    /**
     * Ids of stored decisions that cite the document, in stored order. Unreadable records
     * are skipped.
     */
    public List<String> findImpacted(String docId) {
        DecisionFilter snapshot = DecisionFilter.all().withSnapshotAt(clock.instant());
        int pageSize = settings.getPageSize();
        Set<String> impacted = new LinkedHashSet<>();
        int unreadable = 0;

        int page = 0;
        List<StoredDecision> batch;
        do {
            batch = decisionStore.list(snapshot, page++, pageSize);
            for (StoredDecision stored : batch) {
                if (!stored.isReadable()) {
                    unreadable++;
                } else if (stored.decision().cites(docId)) {
                    impacted.add(stored.decisionId());
                }
            }
        } while (batch.size() == pageSize);

        if (unreadable > 0) {
            log.warn("Skipped {} unreadable stored decisions while scanning for document {}", unreadable, docId);
        }
        log.info("Document {} is cited by {} stored decisions", docId, impacted.size());
        return new ArrayList<>(impacted);
    }

    public ImpactReport buildImpactReport(PolicyChangeRecord change, List<String> impactedIds) {
        boolean requiresReEvaluation = change.changeMagnitude() > settings.getReEvaluationThreshold();

        ImpactReport report = new ImpactReport(
                UUID.randomUUID().toString(),
                clock.instant(),
                change,
                impactedIds,
                requiresReEvaluation,
                recommendations(change, impactedIds.size()));

        auditStore.saveImpactReport(report);
        log.info("Impact report {} for change {}: {} decisions affected, re-evaluation {}",
                report.reportId(), change.changeId(), report.decisionsAffected(),
                requiresReEvaluation ? "required" : "not required");
        return report;
    }

    private List<String> recommendations(PolicyChangeRecord change, int affected) {
        List<String> recommendations = new ArrayList<>();
        switch (change.classification()) {
            case MAJOR:
                recommendations.add("CRITICAL: Major policy change detected. Immediate review required.");
                recommendations.add("Re-evaluate all " + affected + " affected decisions.");
                recommendations.add("Notify the compliance team of the policy update.");
                break;
            case MODERATE:
                recommendations.add("Moderate policy change detected. Review recommended.");
                recommendations.add("Consider re-evaluating the " + affected + " affected decisions.");
                break;
            default:
                recommendations.add("Minor policy change. Monitor for impact.");
                break;
        }
        if (affected > settings.getHighImpactCount()) {
            recommendations.add("High impact: " + affected + " decisions affected. Prioritize re-evaluation.");
        }
        return recommendations;
    }

    // =========================================================================
    //  Re-evaluation queue
    // =========================================================================

    /**
     * Enqueues the decisions for re-evaluation. Does not run anything.
     */
    public ReevaluationTicket triggerReEvaluation(List<String> decisionIds) {
        ReevaluationTicket ticket = new ReevaluationTicket(
                UUID.randomUUID().toString(),
                decisionIds,
                ReevaluationTicket.Status.QUEUED,
                clock.instant(),
                null);
        auditStore.enqueue(ticket);
        log.info("{} (token {})", ticket.message(), ticket.token());
        return ticket;
    }

    public List<PolicyChangeRecord> recentChanges(int limit) {
        return auditStore.recentChanges(limit);
    }

    public List<ImpactReport> impactReports(int limit) {
        return auditStore.impactReports(limit);
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.3f", value);
    }
}
