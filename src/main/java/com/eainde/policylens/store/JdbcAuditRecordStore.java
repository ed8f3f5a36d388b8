package com.eainde.policylens.store;

import com.eainde.policylens.exception.PersistenceException;
import com.eainde.policylens.model.DecisionFeedback;
import com.eainde.policylens.model.ImpactReport;
import com.eainde.policylens.model.PolicyChangeRecord;
import com.eainde.policylens.model.ReevaluationTicket;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

/**
 * JSON-per-row audit tables. Each record is serialized whole; the key and sort columns are
 * the only ones queried.
 */
public class JdbcAuditRecordStore implements AuditRecordStore {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public JdbcAuditRecordStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    // =========================================================================
    //  Policy changes
    // =========================================================================

    @Override
    public void saveChange(PolicyChangeRecord change) {
        write("""
                MERGE INTO policy_change (change_id, old_doc_id, new_doc_id, change_type, record_json, detected_at)
                KEY (change_id)
                VALUES (?, ?, ?, ?, ?, ?)
                """,
                "policy change " + change.changeId(),
                change.changeId(),
                change.oldDocId(),
                change.newDocId(),
                change.classification().name(),
                toJson(change),
                change.timestamp().atOffset(ZoneOffset.UTC));
    }

    @Override
    public List<PolicyChangeRecord> recentChanges(int limit) {
        return readAll("SELECT record_json FROM policy_change ORDER BY detected_at DESC, change_id LIMIT ?",
                PolicyChangeRecord.class, limit);
    }

    // =========================================================================
    //  Impact reports
    // =========================================================================

    @Override
    public void saveImpactReport(ImpactReport report) {
        write("""
                MERGE INTO impact_report (report_id, change_id, report_json, generated_at)
                KEY (report_id)
                VALUES (?, ?, ?, ?)
                """,
                "impact report " + report.reportId(),
                report.reportId(),
                report.policyChange().changeId(),
                toJson(report),
                report.generatedAt().atOffset(ZoneOffset.UTC));
    }

    @Override
    public List<ImpactReport> impactReports(int limit) {
        return readAll("SELECT report_json FROM impact_report ORDER BY generated_at DESC, report_id LIMIT ?",
                ImpactReport.class, limit);
    }

    // =========================================================================
    //  Re-evaluation queue
    // =========================================================================

    @Override
    public void enqueue(ReevaluationTicket ticket) {
        write("""
                MERGE INTO reevaluation_queue (token, status, ticket_json, created_at)
                KEY (token)
                VALUES (?, ?, ?, ?)
                """,
                "re-evaluation ticket " + ticket.token(),
                ticket.token(),
                ticket.status().name(),
                toJson(ticket),
                ticket.createdAt().atOffset(ZoneOffset.UTC));
    }

    @Override
    public Optional<ReevaluationTicket> ticket(String token) {
        return readAll("SELECT ticket_json FROM reevaluation_queue WHERE token = ?",
                ReevaluationTicket.class, token).stream().findFirst();
    }

    @Override
    public List<ReevaluationTicket> queuedTickets() {
        return readAll("SELECT ticket_json FROM reevaluation_queue WHERE status = ? ORDER BY created_at, token",
                ReevaluationTicket.class, ReevaluationTicket.Status.QUEUED.name());
    }

    @Override
    public Optional<ReevaluationTicket> markCompleted(String token, Instant completedAt) {
        Optional<ReevaluationTicket> queued = ticket(token)
                .filter(t -> t.status() == ReevaluationTicket.Status.QUEUED);
        if (queued.isEmpty()) return Optional.empty();

        ReevaluationTicket ticket = queued.get();
        ReevaluationTicket completed = new ReevaluationTicket(ticket.token(), ticket.decisionIds(),
                ReevaluationTicket.Status.COMPLETED, ticket.createdAt(), completedAt);
        enqueue(completed);
        return Optional.of(completed);
    }

    // =========================================================================
    //  Feedback
    // =========================================================================

    @Override
    public void saveFeedback(DecisionFeedback feedback) {
        write("""
                MERGE INTO decision_feedback (feedback_id, transaction_id, decision_id, feedback_json, submitted_at)
                KEY (feedback_id)
                VALUES (?, ?, ?, ?, ?)
                """,
                "feedback " + feedback.feedbackId(),
                feedback.feedbackId(),
                feedback.transactionId(),
                feedback.decisionId(),
                toJson(feedback),
                feedback.submittedAt().atOffset(ZoneOffset.UTC));
    }

    @Override
    public List<DecisionFeedback> feedbackFor(String transactionId) {
        return readAll("""
                SELECT feedback_json FROM decision_feedback
                WHERE transaction_id = ?
                ORDER BY submitted_at DESC, feedback_id
                """, DecisionFeedback.class, transactionId);
    }

    @Override
    public List<DecisionFeedback> recentFeedback(int limit) {
        return readAll("SELECT feedback_json FROM decision_feedback ORDER BY submitted_at DESC, feedback_id LIMIT ?",
                DecisionFeedback.class, limit);
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    private void write(String sql, String what, Object... args) {
        try {
            jdbcTemplate.update(sql, args);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to store " + what, e);
        }
    }

    private <T> List<T> readAll(String sql, Class<T> type, Object... args) {
        try {
            return jdbcTemplate.query(sql, (rs, rowNum) -> fromJson(rs.getString(1), type), args);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to read " + type.getSimpleName() + " records", e);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Stored " + type.getSimpleName() + " is unreadable", e);
        }
    }
}
