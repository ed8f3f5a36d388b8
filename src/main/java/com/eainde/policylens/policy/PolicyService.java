package com.eainde.policylens.policy;

import com.eainde.policylens.chunk.PolicyChunker;
import com.eainde.policylens.extraction.DocumentExtractor;
import com.eainde.policylens.extraction.DocumentKind;
import com.eainde.policylens.gateway.EmbeddingGateway;
import com.eainde.policylens.gateway.PolicyIndex;
import com.eainde.policylens.model.ImpactReport;
import com.eainde.policylens.model.PolicyChangeRecord;
import com.eainde.policylens.model.PolicyChunk;
import com.eainde.policylens.model.PolicyDocument;
import com.eainde.policylens.model.PolicySource;
import com.eainde.policylens.model.PolicyTopic;
import com.eainde.policylens.model.ReevaluationTicket;
import com.eainde.policylens.sentinel.PolicySentinel;
import com.eainde.policylens.store.PolicyDocumentStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Policy document lifecycle: upload, versioned update, and index rebuild.
 *
 * <h3>Update:</h3>
 * <pre>
 *   1. ingest the new version (store, chunk, embed, index)
 *   2. deactivate the old version in the store and the index
 *   3. diff old and new raw text, find citing decisions, build the impact report
 *   4. queue re-evaluation when the change requires it and decisions are impacted
 * </pre>
 * Once update returns, evaluations no longer retrieve chunks of the old version.
 */
@Slf4j
public class PolicyService {

    private final PolicyDocumentStore documentStore;
    private final PolicyChunker chunker;
    private final EmbeddingGateway embeddingGateway;
    private final PolicyIndex policyIndex;
    private final PolicySentinel sentinel;
    private final DocumentExtractor extractor;
    private final Clock clock;

    public PolicyService(PolicyDocumentStore documentStore,
                         PolicyChunker chunker,
                         EmbeddingGateway embeddingGateway,
                         PolicyIndex policyIndex,
                         PolicySentinel sentinel,
                         DocumentExtractor extractor,
                         Clock clock) {
        this.documentStore = documentStore;
        this.chunker = chunker;
        this.embeddingGateway = embeddingGateway;
        this.policyIndex = policyIndex;
        this.sentinel = sentinel;
        this.extractor = extractor;
        this.clock = clock;
    }

    // =========================================================================
    //  Upload
    // =========================================================================

    public PolicyIngestion upload(PolicyUpload upload) {
        return ingest(upload);
    }

    /**
     * Extracts text from an uploaded file and ingests it.
     *
     * @throws com.eainde.policylens.exception.ExtractionException if the file cannot be read
     */
    public PolicyIngestion upload(String title, PolicySource source, PolicyTopic topic, String version,
                                  byte[] content, String fileName) {
        String text = extractor.extract(content, DocumentKind.fromFileName(fileName));
        return ingest(new PolicyUpload(title, source, topic, version, text));
    }

    // =========================================================================
    //  Update
    // =========================================================================

    /**
     * Replaces an active document with a new version.
     *
     * @throws IllegalArgumentException if the document is unknown
     * @throws IllegalStateException    if the document is no longer active
     */
    public PolicyUpdateOutcome update(String oldDocId, PolicyUpload upload) {
        PolicyDocument old = documentStore.find(oldDocId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown policy document " + oldDocId));
        if (!old.active()) {
            throw new IllegalStateException("Policy document " + oldDocId + " is inactive and cannot be updated");
        }

        PolicyIngestion ingestion = ingest(upload);
        Instant now = clock.instant();
        if (!documentStore.deactivate(oldDocId, ingestion.docId(), now)) {
            // another update superseded the document first; retire the version just ingested
            documentStore.deactivate(ingestion.docId(), null, now);
            policyIndex.deactivate(ingestion.docId());
            throw new IllegalStateException("Policy document " + oldDocId + " was superseded concurrently");
        }
        policyIndex.deactivate(oldDocId);

        PolicyChangeRecord change = sentinel.detectChange(oldDocId, ingestion.docId(), old.content(), upload.content());
        List<String> impacted = sentinel.findImpacted(oldDocId);
        ImpactReport report = sentinel.buildImpactReport(change, impacted);

        ReevaluationTicket ticket = null;
        if (report.requiresReEvaluation() && !impacted.isEmpty()) {
            ticket = sentinel.triggerReEvaluation(impacted);
        }

        log.info("Policy {} updated to {} (v{}): {} change, {} decisions impacted{}",
                oldDocId, ingestion.docId(), ingestion.version(), change.classification(), impacted.size(),
                ticket != null ? ", re-evaluation queued as " + ticket.token() : "");
        return new PolicyUpdateOutcome(oldDocId, ingestion, change, report, ticket);
    }

    // =========================================================================
    //  Queries and index rebuild
    // =========================================================================

    public Optional<PolicyDocument> document(String docId) {
        return documentStore.find(docId);
    }

    public List<PolicyDocument> activeDocuments() {
        return documentStore.listActive();
    }

    /**
     * Re-embeds and indexes the stored chunks of every active document. Used at startup,
     * since the vector index does not survive a restart.
     *
     * @return number of chunks indexed
     */
    public int reindexActive() {
        int indexed = 0;
        for (PolicyDocument document : documentStore.listActive()) {
            List<PolicyChunk> chunks = documentStore.chunks(document.docId());
            if (chunks.isEmpty()) continue;
            policyIndex.index(chunks, embed(chunks));
            indexed += chunks.size();
        }
        log.info("Rebuilt policy index with {} chunks", indexed);
        return indexed;
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    private PolicyIngestion ingest(PolicyUpload upload) {
        PolicyDocument document = new PolicyDocument(
                "doc_" + UUID.randomUUID().toString().replace("-", ""),
                upload.title(),
                upload.source(),
                upload.topic(),
                upload.version(),
                upload.content(),
                true,
                clock.instant(),
                null,
                null);

        List<PolicyChunk> chunks = chunker.chunk(document);
        List<float[]> vectors = embed(chunks);
        documentStore.save(document, chunks);
        policyIndex.index(chunks, vectors);

        log.info("Ingested policy '{}' v{} as {} ({} chunks)",
                document.title(), document.version(), document.docId(), chunks.size());
        return new PolicyIngestion(document.docId(), document.title(), document.version(), chunks.size());
    }

    private List<float[]> embed(List<PolicyChunk> chunks) {
        return embeddingGateway.embedAll(chunks.stream().map(PolicyChunk::text).collect(Collectors.toList()));
    }
}
