package com.eainde.policylens.gateway;

import com.eainde.policylens.exception.RetrievalException;
import com.eainde.policylens.model.ComplianceCase;
import com.eainde.policylens.model.PolicyChunk;
import com.eainde.policylens.model.PolicySource;
import com.eainde.policylens.model.PolicyTopic;
import com.eainde.policylens.model.SimilarCase;
import com.eainde.policylens.model.Verdict;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.filter.Filter;
import dev.langchain4j.store.embedding.filter.logical.And;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;

/**
 * Policy index, case store and retrieval over two LangChain4j {@link EmbeddingStore}s.
 *
 * <p>Chunks are never removed. Deactivated documents are tracked in a concurrent set that
 * every policy search consults, so a deactivation is visible to the next search.</p>
 */
@Slf4j
public class EmbeddingStoreRetrievalGateway implements RetrievalGateway, PolicyIndex, CaseStore {

    // Metadata keys
    static final String DOC_ID = "doc_id";
    static final String CHUNK_ID = "chunk_id";
    static final String ORDINAL = "ordinal";
    static final String DOC_TITLE = "doc_title";
    static final String SECTION = "section";
    static final String SOURCE = "source";
    static final String TOPIC = "topic";
    static final String VERSION = "version";
    static final String VALID_FROM = "valid_from";
    static final String VALID_TO = "valid_to";

    static final String CASE_ID = "case_id";
    static final String TRANSACTION_ID = "transaction_id";
    static final String VERDICT = "verdict";
    static final String RISK_SCORE = "risk_score";
    static final String REASONING = "reasoning";
    static final String CREATED_AT = "created_at";

    private final EmbeddingStore<TextSegment> policyStore;
    private final EmbeddingStore<TextSegment> caseStore;
    private final Set<String> inactiveDocIds = ConcurrentHashMap.newKeySet();

    public EmbeddingStoreRetrievalGateway(EmbeddingStore<TextSegment> policyStore,
                                          EmbeddingStore<TextSegment> caseStore) {
        this.policyStore = policyStore;
        this.caseStore = caseStore;
    }

    // =========================================================================
    //  PolicyIndex
    // =========================================================================

    @Override
    public void index(List<PolicyChunk> chunks, List<float[]> vectors) {
        if (chunks.size() != vectors.size()) {
            throw new IllegalArgumentException(
                    "chunks (" + chunks.size() + ") and vectors (" + vectors.size() + ") differ in size");
        }
        if (chunks.isEmpty()) return;

        List<String> ids = new ArrayList<>(chunks.size());
        List<Embedding> embeddings = new ArrayList<>(chunks.size());
        List<TextSegment> segments = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            PolicyChunk chunk = chunks.get(i);
            ids.add(chunk.chunkId());
            embeddings.add(Embedding.from(vectors.get(i)));
            segments.add(TextSegment.from(chunk.text(), chunkMetadata(chunk)));
            if (!chunk.active()) inactiveDocIds.add(chunk.docId());
        }

        try {
            policyStore.addAll(ids, embeddings, segments);
        } catch (RuntimeException e) {
            throw new RetrievalException("Failed to index " + chunks.size() + " chunks", e);
        }
        log.info("Indexed {} chunks of document {}", chunks.size(), chunks.get(0).docId());
    }

    @Override
    public void deactivate(String docId) {
        if (inactiveDocIds.add(docId)) {
            log.info("Policy document {} deactivated in index", docId);
        }
    }

    public boolean isActive(String docId) {
        return !inactiveDocIds.contains(docId);
    }

    // =========================================================================
    //  CaseStore
    // =========================================================================

    @Override
    public void append(ComplianceCase c) {
        Metadata metadata = new Metadata()
                .put(CASE_ID, c.caseId())
                .put(TRANSACTION_ID, c.transactionId())
                .put(VERDICT, c.verdict().name())
                .put(RISK_SCORE, c.riskScore())
                .put(CREATED_AT, c.createdAt().toEpochMilli());
        String reasoning = c.reasoning() == null || c.reasoning().isBlank() ? c.caseId() : c.reasoning();
        metadata.put(REASONING, reasoning);

        try {
            caseStore.addAll(List.of(c.caseId()), List.of(Embedding.from(c.embedding())),
                    List.of(TextSegment.from(reasoning, metadata)));
        } catch (RuntimeException e) {
            throw new RetrievalException("Failed to store case " + c.caseId(), e);
        }
        log.debug("Case {} stored for transaction {}", c.caseId(), c.transactionId());
    }

    // =========================================================================
    //  RetrievalGateway
    // =========================================================================

    @Override
    public List<ScoredChunk> searchPolicies(float[] vector, int topK, PolicyTopic topic) {
        Filter filter = null;
        Set<String> inactive = new HashSet<>(inactiveDocIds);
        if (!inactive.isEmpty()) {
            filter = metadataKey(DOC_ID).isNotIn(inactive);
        }
        if (topic != null) {
            Filter topicFilter = metadataKey(TOPIC).isEqualTo(topic.name());
            filter = filter == null ? topicFilter : new And(filter, topicFilter);
        }

        List<EmbeddingMatch<TextSegment>> matches = search(policyStore, vector, topK, filter, "policy");
        return matches.stream()
                .map(m -> new ScoredChunk(toChunk(m.embedded()), similarity(m.score())))
                .collect(Collectors.toList());
    }

    @Override
    public List<SimilarCase> searchCases(float[] vector, int topK, Set<Verdict> verdicts,
                                         String excludeTransactionId) {
        Filter filter = null;
        if (verdicts != null && !verdicts.isEmpty()) {
            filter = metadataKey(VERDICT).isIn(verdicts.stream().map(Verdict::name).collect(Collectors.toSet()));
        }
        if (excludeTransactionId != null) {
            Filter exclude = metadataKey(TRANSACTION_ID).isNotEqualTo(excludeTransactionId);
            filter = filter == null ? exclude : new And(filter, exclude);
        }

        List<EmbeddingMatch<TextSegment>> matches = search(caseStore, vector, topK, filter, "case");
        return matches.stream()
                .map(m -> toSimilarCase(m.embedded().metadata(), similarity(m.score())))
                .collect(Collectors.toList());
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    private static List<EmbeddingMatch<TextSegment>> search(EmbeddingStore<TextSegment> store, float[] vector,
                                                            int topK, Filter filter, String what) {
        if (topK <= 0) return List.of();
        EmbeddingSearchRequest request = EmbeddingSearchRequest.builder()
                .queryEmbedding(Embedding.from(vector))
                .maxResults(topK)
                .filter(filter)
                .build();
        try {
            return store.search(request).matches();
        } catch (RuntimeException e) {
            throw new RetrievalException("Similarity search over " + what + " store failed", e);
        }
    }

    /**
     * Store relevance is {@code (cosine + 1) / 2}; callers work with cosine similarity clamped
     * to [0,1].
     */
    static double similarity(double relevanceScore) {
        double cosine = 2.0 * relevanceScore - 1.0;
        return Math.max(0.0, Math.min(1.0, cosine));
    }

    private static Metadata chunkMetadata(PolicyChunk chunk) {
        Metadata metadata = new Metadata()
                .put(CHUNK_ID, chunk.chunkId())
                .put(DOC_ID, chunk.docId())
                .put(ORDINAL, chunk.ordinal())
                .put(DOC_TITLE, chunk.docTitle())
                .put(SOURCE, chunk.source().name())
                .put(TOPIC, chunk.topic().name())
                .put(VERSION, chunk.version())
                .put(VALID_FROM, chunk.validFrom().toEpochMilli());
        // metadata does not accept null values
        if (chunk.section() != null) metadata.put(SECTION, chunk.section());
        if (chunk.validTo() != null) metadata.put(VALID_TO, chunk.validTo().toEpochMilli());
        return metadata;
    }

    private PolicyChunk toChunk(TextSegment segment) {
        Metadata m = segment.metadata();
        Long validTo = m.getLong(VALID_TO);
        String docId = m.getString(DOC_ID);
        return new PolicyChunk(
                m.getString(CHUNK_ID),
                docId,
                m.getInteger(ORDINAL),
                segment.text(),
                m.getString(DOC_TITLE),
                m.getString(SECTION),
                PolicySource.valueOf(m.getString(SOURCE)),
                PolicyTopic.valueOf(m.getString(TOPIC)),
                m.getString(VERSION),
                isActive(docId),
                Instant.ofEpochMilli(m.getLong(VALID_FROM)),
                validTo != null ? Instant.ofEpochMilli(validTo) : null);
    }

    private static SimilarCase toSimilarCase(Metadata m, double similarity) {
        return new SimilarCase(
                m.getString(CASE_ID),
                m.getString(TRANSACTION_ID),
                similarity,
                Verdict.valueOf(m.getString(VERDICT)),
                m.getDouble(RISK_SCORE),
                m.getString(REASONING),
                Instant.ofEpochMilli(m.getLong(CREATED_AT)));
    }
}
