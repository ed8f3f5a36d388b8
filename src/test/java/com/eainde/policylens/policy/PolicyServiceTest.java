package com.eainde.policylens.policy;

import com.eainde.policylens.chunk.PolicyChunker;
import com.eainde.policylens.config.PolicyLensProperties;
import com.eainde.policylens.exception.ExtractionException;
import com.eainde.policylens.extraction.PlainTextDocumentExtractor;
import com.eainde.policylens.gateway.EmbeddingStoreRetrievalGateway;
import com.eainde.policylens.gateway.LangChain4jEmbeddingGateway;
import com.eainde.policylens.gateway.ScoredChunk;
import com.eainde.policylens.metrics.ComplianceMetrics;
import com.eainde.policylens.model.ChangeClassification;
import com.eainde.policylens.model.PolicyDocument;
import com.eainde.policylens.model.PolicySource;
import com.eainde.policylens.model.PolicyTopic;
import com.eainde.policylens.model.ReevaluationTicket;
import com.eainde.policylens.model.StoredDecision;
import com.eainde.policylens.model.Verdict;
import com.eainde.policylens.model.PolicyCitation;
import com.eainde.policylens.sentinel.PolicySentinel;
import com.eainde.policylens.store.JdbcAuditRecordStore;
import com.eainde.policylens.store.JdbcDecisionStore;
import com.eainde.policylens.store.JdbcPolicyDocumentStore;
import com.eainde.policylens.support.Fixtures;
import com.eainde.policylens.support.HashingEmbeddingModel;
import com.eainde.policylens.support.TestDatabase;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static com.eainde.policylens.support.Fixtures.NOW;
import static com.eainde.policylens.support.Fixtures.decision;
import static com.eainde.policylens.support.HashingEmbeddingModel.vector;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PolicyServiceTest {

    private static final String V1 = """
            Section 1 Reporting
            Cash deposits above ten thousand dollars must be reported to the compliance officer within one day.
            Section 2 Sanctions
            Payments to sanctioned jurisdictions are prohibited without written approval from legal.
            """;

    private static final String V2 = """
            Section 1 Reporting
            Cash deposits above ten thousand dollars must be reported to the compliance officer within one day.
            Section 3 High Risk Countries
            Transfers involving high risk countries require enhanced due diligence and senior management sign-off.
            """;

    private TestDatabase database;
    private JdbcPolicyDocumentStore documentStore;
    private JdbcDecisionStore decisionStore;
    private JdbcAuditRecordStore auditStore;
    private EmbeddingStoreRetrievalGateway retrievalGateway;
    private LangChain4jEmbeddingGateway embeddingGateway;
    private PolicyService service;

    @BeforeEach
    void setUp() {
        database = new TestDatabase();
        documentStore = new JdbcPolicyDocumentStore(database.jdbcTemplate(), database.transactionTemplate());
        decisionStore = new JdbcDecisionStore(database.jdbcTemplate(), Fixtures.objectMapper());
        auditStore = new JdbcAuditRecordStore(database.jdbcTemplate(), Fixtures.objectMapper());
        embeddingGateway = new LangChain4jEmbeddingGateway(new HashingEmbeddingModel(), Fixtures.fastRetry("embedding"));
        retrievalGateway = newIndex();
        service = newService(retrievalGateway);
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    private static EmbeddingStoreRetrievalGateway newIndex() {
        return new EmbeddingStoreRetrievalGateway(new InMemoryEmbeddingStore<>(), new InMemoryEmbeddingStore<>());
    }

    private PolicyService newService(EmbeddingStoreRetrievalGateway index) {
        PolicySentinel sentinel = new PolicySentinel(auditStore, decisionStore, ComplianceMetrics.NOOP,
                new PolicyLensProperties.Sentinel(), Fixtures.fixedClock());
        return new PolicyService(documentStore, PolicyChunker.withDefaults(), embeddingGateway, index, sentinel,
                new PlainTextDocumentExtractor(), Fixtures.fixedClock());
    }

    private static PolicyUpload upload(String version, String content) {
        return new PolicyUpload("AML Policy", PolicySource.INTERNAL, PolicyTopic.AML, version, content);
    }

    private void storeDecisionCiting(String decisionId, String docId) {
        PolicyCitation citation = new PolicyCitation(docId, "AML Policy", "Section 2 Sanctions", "excerpt", 0.8, "1.0");
        decisionStore.put(new StoredDecision(decisionId, "{}",
                decision("tx-" + decisionId, Verdict.FLAG, 0.9, List.of(citation)), NOW.minusSeconds(60)));
    }

    // =========================================================================
    //  Upload
    // =========================================================================

    @Nested
    @DisplayName("Uploading")
    class Upload {

        @Test
        @DisplayName("stores, chunks by section and indexes the document")
        void indexes() {
            PolicyIngestion ingestion = service.upload(upload("1.0", V1));

            assertThat(ingestion.docId()).startsWith("doc_").doesNotContain("-");
            assertThat(ingestion.chunkCount()).isEqualTo(2);
            assertThat(service.document(ingestion.docId())).get()
                    .satisfies(d -> {
                        assertThat(d.active()).isTrue();
                        assertThat(d.content()).isEqualTo(V1);
                        assertThat(d.validFrom()).isEqualTo(NOW);
                    });

            List<ScoredChunk> hits = retrievalGateway.searchPolicies(
                    vector("payments to sanctioned jurisdictions are prohibited"), 1, PolicyTopic.AML);
            assertThat(hits).singleElement()
                    .satisfies(hit -> assertThat(hit.chunk().section()).isEqualTo("Section 2 Sanctions"));
        }

        @Test
        @DisplayName("extracts text from an uploaded file")
        void fromFile() {
            PolicyIngestion ingestion = service.upload("AML Policy", PolicySource.INTERNAL, PolicyTopic.AML, "1.0",
                    V1.getBytes(StandardCharsets.UTF_8), "aml-policy.txt");

            assertThat(ingestion.chunkCount()).isEqualTo(2);
            assertThat(service.activeDocuments()).extracting(PolicyDocument::docId).containsExactly(ingestion.docId());
        }

        @Test
        @DisplayName("rejects a file type it cannot read")
        void unsupportedFile() {
            assertThatThrownBy(() -> service.upload("AML Policy", PolicySource.INTERNAL, PolicyTopic.AML, "1.0",
                    new byte[]{1, 2, 3}, "aml-policy.pdf"))
                    .isInstanceOf(ExtractionException.class);
            assertThat(service.activeDocuments()).isEmpty();
        }
    }

    // =========================================================================
    //  Update
    // =========================================================================

    @Nested
    @DisplayName("Updating")
    class Update {

        @Test
        @DisplayName("supersedes the old version and stops retrieving its chunks")
        void supersedes() {
            String oldId = service.upload(upload("1.0", V1)).docId();

            PolicyUpdateOutcome outcome = service.update(oldId, upload("2.0", V2));
            String newId = outcome.newVersion().docId();

            PolicyDocument old = service.document(oldId).orElseThrow();
            assertThat(old.active()).isFalse();
            assertThat(old.supersededBy()).isEqualTo(newId);
            assertThat(old.validTo()).isEqualTo(NOW);
            assertThat(service.activeDocuments()).extracting(PolicyDocument::docId).containsExactly(newId);

            List<ScoredChunk> hits = retrievalGateway.searchPolicies(vector(V1), 10, null);
            assertThat(hits).isNotEmpty().allSatisfy(hit -> assertThat(hit.chunk().docId()).isEqualTo(newId));
        }

        @Test
        @DisplayName("reports the change and queues re-evaluation of citing decisions")
        void queuesReevaluation() {
            String oldId = service.upload(upload("1.0", V1)).docId();
            storeDecisionCiting("d1", oldId);
            storeDecisionCiting("d2", "doc_unrelated");

            PolicyUpdateOutcome outcome = service.update(oldId, upload("2.0", V2));

            assertThat(outcome.change().classification()).isNotEqualTo(ChangeClassification.MINOR);
            assertThat(outcome.change().sectionsAffected())
                    .containsExactly("Added: Section 3 High Risk Countries", "Removed: Section 2 Sanctions");
            assertThat(outcome.report().affectedDecisionIds()).containsExactly("d1");
            assertThat(outcome.report().requiresReEvaluation()).isTrue();

            ReevaluationTicket ticket = outcome.reevaluationTicket().orElseThrow();
            assertThat(ticket.decisionIds()).containsExactly("d1");
            assertThat(auditStore.queuedTickets()).containsExactly(ticket);
            assertThat(auditStore.recentChanges(5)).containsExactly(outcome.change());
        }

        @Test
        @DisplayName("queues nothing when no decision cites the old version")
        void noImpact() {
            String oldId = service.upload(upload("1.0", V1)).docId();

            PolicyUpdateOutcome outcome = service.update(oldId, upload("2.0", V2));

            assertThat(outcome.report().decisionsAffected()).isZero();
            assertThat(outcome.reevaluationTicket()).isEmpty();
        }

        @Test
        @DisplayName("rejects unknown and already superseded documents")
        void rejects() {
            String oldId = service.upload(upload("1.0", V1)).docId();
            service.update(oldId, upload("2.0", V2));

            assertThatThrownBy(() -> service.update("doc_missing", upload("2.0", V2)))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> service.update(oldId, upload("3.0", V2)))
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    @Test
    @DisplayName("rebuilds an empty index from stored active chunks")
    void reindexActive() {
        String oldId = service.upload(upload("1.0", V1)).docId();
        String newId = service.update(oldId, upload("2.0", V2)).newVersion().docId();

        EmbeddingStoreRetrievalGateway fresh = newIndex();
        int indexed = newService(fresh).reindexActive();

        assertThat(indexed).isEqualTo(2);
        assertThat(fresh.searchPolicies(vector(V2), 10, null))
                .extracting(hit -> hit.chunk().docId())
                .containsOnly(newId);
    }
}
