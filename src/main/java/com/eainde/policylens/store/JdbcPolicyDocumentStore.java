package com.eainde.policylens.store;

import com.eainde.policylens.exception.PersistenceException;
import com.eainde.policylens.model.PolicyChunk;
import com.eainde.policylens.model.PolicyDocument;
import com.eainde.policylens.model.PolicySource;
import com.eainde.policylens.model.PolicyTopic;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

public class JdbcPolicyDocumentStore implements PolicyDocumentStore {

    private static final RowMapper<PolicyDocument> DOCUMENT_MAPPER = (rs, rowNum) -> new PolicyDocument(
            rs.getString("doc_id"),
            rs.getString("title"),
            PolicySource.valueOf(rs.getString("source")),
            PolicyTopic.valueOf(rs.getString("topic")),
            rs.getString("doc_version"),
            rs.getString("content"),
            rs.getBoolean("active"),
            toInstant(rs.getObject("valid_from", OffsetDateTime.class)),
            toInstant(rs.getObject("valid_to", OffsetDateTime.class)),
            rs.getString("superseded_by"));

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public JdbcPolicyDocumentStore(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
    }

    @Override
    public void save(PolicyDocument document, List<PolicyChunk> chunks) {
        try {
            transactionTemplate.executeWithoutResult(status -> {
                jdbcTemplate.update("""
                        MERGE INTO policy_document
                            (doc_id, title, source, topic, doc_version, content, active, valid_from, valid_to, superseded_by)
                        KEY (doc_id)
                        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                        """,
                        document.docId(),
                        document.title(),
                        document.source().name(),
                        document.topic().name(),
                        document.version(),
                        document.content(),
                        document.active(),
                        toOffset(document.validFrom()),
                        toOffset(document.validTo()),
                        document.supersededBy());

                jdbcTemplate.batchUpdate("""
                        MERGE INTO policy_chunk (chunk_id, doc_id, ordinal, section, chunk_text)
                        KEY (chunk_id)
                        VALUES (?, ?, ?, ?, ?)
                        """,
                        chunks,
                        chunks.size(),
                        (ps, chunk) -> {
                            ps.setString(1, chunk.chunkId());
                            ps.setString(2, chunk.docId());
                            ps.setInt(3, chunk.ordinal());
                            ps.setString(4, chunk.section());
                            ps.setString(5, chunk.text());
                        });
            });
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to store policy document " + document.docId(), e);
        }
    }

    @Override
    public Optional<PolicyDocument> find(String docId) {
        try {
            return Optional.ofNullable(jdbcTemplate.queryForObject(
                    "SELECT * FROM policy_document WHERE doc_id = ?", DOCUMENT_MAPPER, docId));
        } catch (EmptyResultDataAccessException e) {
            return Optional.empty();
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to load policy document " + docId, e);
        }
    }

    @Override
    public List<PolicyDocument> listActive() {
        try {
            return jdbcTemplate.query(
                    "SELECT * FROM policy_document WHERE active = TRUE ORDER BY valid_from, doc_id",
                    DOCUMENT_MAPPER);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to list active policy documents", e);
        }
    }

    @Override
    public List<PolicyChunk> chunks(String docId) {
        PolicyDocument document = find(docId).orElse(null);
        if (document == null) return List.of();
        try {
            return jdbcTemplate.query(
                    "SELECT * FROM policy_chunk WHERE doc_id = ? ORDER BY ordinal",
                    (rs, rowNum) -> new PolicyChunk(
                            rs.getString("chunk_id"),
                            docId,
                            rs.getInt("ordinal"),
                            rs.getString("chunk_text"),
                            document.title(),
                            rs.getString("section"),
                            document.source(),
                            document.topic(),
                            document.version(),
                            document.active(),
                            document.validFrom(),
                            document.validTo()),
                    docId);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to load chunks of " + docId, e);
        }
    }

    @Override
    public boolean deactivate(String docId, String supersededBy, Instant validTo) {
        try {
            int rows = jdbcTemplate.update("""
                    UPDATE policy_document
                       SET active = FALSE, superseded_by = ?, valid_to = ?
                     WHERE doc_id = ? AND active = TRUE
                    """, supersededBy, toOffset(validTo), docId);
            return rows > 0;
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to deactivate policy document " + docId, e);
        }
    }

    private static OffsetDateTime toOffset(Instant instant) {
        return instant != null ? instant.atOffset(ZoneOffset.UTC) : null;
    }

    private static Instant toInstant(OffsetDateTime time) {
        return time != null ? time.toInstant() : null;
    }
}
