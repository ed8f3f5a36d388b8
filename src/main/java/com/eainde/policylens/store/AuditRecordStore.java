package com.eainde.policylens.store;

import com.eainde.policylens.model.DecisionFeedback;
import com.eainde.policylens.model.ImpactReport;
import com.eainde.policylens.model.PolicyChangeRecord;
import com.eainde.policylens.model.ReevaluationTicket;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable audit trail of policy changes, impact reports, the re-evaluation queue and reviewer
 * feedback on decisions.
 */
public interface AuditRecordStore {

    void saveChange(PolicyChangeRecord change);

    /** Most recent first. */
    List<PolicyChangeRecord> recentChanges(int limit);

    void saveImpactReport(ImpactReport report);

    /** Most recent first. */
    List<ImpactReport> impactReports(int limit);

    void enqueue(ReevaluationTicket ticket);

    Optional<ReevaluationTicket> ticket(String token);

    List<ReevaluationTicket> queuedTickets();

    /**
     * @return the completed ticket, or empty if no queued ticket has this token
     */
    Optional<ReevaluationTicket> markCompleted(String token, Instant completedAt);

    void saveFeedback(DecisionFeedback feedback);

    /** Feedback on decisions for the transaction, most recent first. */
    List<DecisionFeedback> feedbackFor(String transactionId);

    /** Most recent first. */
    List<DecisionFeedback> recentFeedback(int limit);
}
