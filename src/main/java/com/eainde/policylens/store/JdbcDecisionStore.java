package com.eainde.policylens.store;

import com.eainde.policylens.exception.PersistenceException;
import com.eainde.policylens.model.ComplianceDecision;
import com.eainde.policylens.model.StoredDecision;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link DecisionStore} over a single {@code compliance_decision} table. The decision itself
 * is kept as JSON; verdict and risk score are duplicated into columns for filtering. A row
 * whose JSON cannot be read is returned as {@link StoredDecision#unreadable}.
 */
@Slf4j
public class JdbcDecisionStore implements DecisionStore {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<StoredDecision> rowMapper;

    public JdbcDecisionStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = (rs, rowNum) -> {
            String decisionId = rs.getString("decision_id");
            String payload = rs.getString("transaction_payload");
            Instant storedAt = rs.getObject("stored_at", OffsetDateTime.class).toInstant();
            ComplianceDecision decision = readDecision(decisionId, rs.getString("decision_json"));
            return decision != null
                    ? new StoredDecision(decisionId, payload, decision, storedAt)
                    : StoredDecision.unreadable(decisionId, payload, storedAt);
        };
    }

    @Override
    public void put(StoredDecision stored) {
        String json;
        try {
            json = objectMapper.writeValueAsString(stored.decision());
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize decision " + stored.decisionId(), e);
        }

        try {
            jdbcTemplate.update("""
                    MERGE INTO compliance_decision
                        (decision_id, transaction_id, verdict, risk_score, transaction_payload, decision_json, stored_at)
                    KEY (decision_id)
                    VALUES (?, ?, ?, ?, ?, ?, ?)
                    """,
                    stored.decisionId(),
                    stored.decision().transactionId(),
                    stored.decision().verdict().name(),
                    stored.decision().riskScore(),
                    stored.transactionPayload(),
                    json,
                    stored.storedAt().atOffset(ZoneOffset.UTC));
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to store decision " + stored.decisionId(), e);
        }
    }

    @Override
    public Optional<StoredDecision> get(String decisionId) {
        try {
            return Optional.ofNullable(jdbcTemplate.queryForObject(
                    "SELECT * FROM compliance_decision WHERE decision_id = ?", rowMapper, decisionId));
        } catch (EmptyResultDataAccessException e) {
            return Optional.empty();
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to load decision " + decisionId, e);
        }
    }

    @Override
    public List<StoredDecision> list(DecisionFilter filter, int page, int pageSize) {
        List<Object> args = new ArrayList<>();
        String sql = "SELECT * FROM compliance_decision" + where(filter, args)
                + " ORDER BY stored_at, decision_id LIMIT ? OFFSET ?";
        args.add(pageSize);
        args.add((long) page * pageSize);
        try {
            return jdbcTemplate.query(sql, rowMapper, args.toArray());
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to list decisions (page " + page + ")", e);
        }
    }

    @Override
    public long count(DecisionFilter filter) {
        List<Object> args = new ArrayList<>();
        String sql = "SELECT COUNT(*) FROM compliance_decision" + where(filter, args);
        try {
            Long count = jdbcTemplate.queryForObject(sql, Long.class, args.toArray());
            return count != null ? count : 0L;
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to count decisions", e);
        }
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    private static String where(DecisionFilter filter, List<Object> args) {
        List<String> clauses = new ArrayList<>();
        if (filter.verdict() != null) {
            clauses.add("verdict = ?");
            args.add(filter.verdict().name());
        }
        if (filter.storedFrom() != null) {
            clauses.add("stored_at >= ?");
            args.add(filter.storedFrom().atOffset(ZoneOffset.UTC));
        }
        if (filter.storedTo() != null) {
            clauses.add("stored_at <= ?");
            args.add(filter.storedTo().atOffset(ZoneOffset.UTC));
        }
        if (filter.snapshotAt() != null) {
            clauses.add("stored_at <= ?");
            args.add(filter.snapshotAt().atOffset(ZoneOffset.UTC));
        }
        return clauses.isEmpty() ? "" : " WHERE " + String.join(" AND ", clauses);
    }

    /**
     * Null when the JSON cannot be mapped; one bad row must not fail a page.
     */
    private ComplianceDecision readDecision(String decisionId, String json) {
        try {
            return objectMapper.readValue(json, ComplianceDecision.class);
        } catch (JsonProcessingException e) {
            log.warn("Stored decision {} is unreadable: {}", decisionId, e.getOriginalMessage());
            return null;
        }
    }
}
