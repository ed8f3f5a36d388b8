package com.eainde.policylens.engine;

import com.eainde.policylens.gateway.EmbeddingStoreRetrievalGateway;
import com.eainde.policylens.gateway.LangChain4jEmbeddingGateway;
import com.eainde.policylens.model.SimilarCase;
import com.eainde.policylens.model.StoredDecision;
import com.eainde.policylens.model.Transaction;
import com.eainde.policylens.model.TransactionDescriptor;
import com.eainde.policylens.model.Verdict;
import com.eainde.policylens.store.JdbcDecisionStore;
import com.eainde.policylens.support.Fixtures;
import com.eainde.policylens.support.HashingEmbeddingModel;
import com.eainde.policylens.support.TestDatabase;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static com.eainde.policylens.support.Fixtures.NOW;
import static com.eainde.policylens.support.Fixtures.citation;
import static com.eainde.policylens.support.Fixtures.decision;
import static com.eainde.policylens.support.Fixtures.transaction;
import static com.eainde.policylens.support.HashingEmbeddingModel.vector;
import static org.assertj.core.api.Assertions.assertThat;

class CaseMemoryRebuilderTest {

    private final ObjectMapper objectMapper = Fixtures.objectMapper();
    private TestDatabase database;
    private JdbcDecisionStore decisionStore;
    private EmbeddingStoreRetrievalGateway caseMemory;
    private CaseMemoryRebuilder rebuilder;

    @BeforeEach
    void setUp() {
        database = new TestDatabase();
        decisionStore = new JdbcDecisionStore(database.jdbcTemplate(), objectMapper);
        caseMemory = new EmbeddingStoreRetrievalGateway(new InMemoryEmbeddingStore<>(), new InMemoryEmbeddingStore<>());
        rebuilder = new CaseMemoryRebuilder(decisionStore,
                new LangChain4jEmbeddingGateway(new HashingEmbeddingModel(), Fixtures.fastRetry("embedding")),
                caseMemory, objectMapper, 2);
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    private void store(String id, String payload, Verdict verdict, int minutesAgo) {
        decisionStore.put(new StoredDecision(id, payload,
                decision("tx-" + id, verdict, verdict == Verdict.FLAG ? 0.9 : 0.1, List.of(citation("doc_1"))),
                NOW.minus(Duration.ofMinutes(minutesAgo))));
    }

    @Test
    @DisplayName("turns every usable stored decision into a retrievable case")
    void rebuild() throws Exception {
        Transaction sanctioned = transaction("tx-d0", "75000", "USA", "Iran");
        store("d0", objectMapper.writeValueAsString(sanctioned), Verdict.FLAG, 5);
        store("d1", objectMapper.writeValueAsString(transaction("tx-d1", "200", "UK", "France")), Verdict.ACCEPTABLE, 4);
        store("d2", "not json", Verdict.ACCEPTABLE, 3);
        store("d3", objectMapper.writeValueAsString(transaction("tx-d3", "900", "Spain", "Italy")), Verdict.ACCEPTABLE, 2);
        store("d4", objectMapper.writeValueAsString(transaction("tx-d4", "50", "USA", "Canada")), Verdict.ACCEPTABLE, 1);
        database.jdbcTemplate().update(
                "UPDATE compliance_decision SET decision_json = '{broken' WHERE decision_id = 'd4'");

        int written = rebuilder.rebuild();

        assertThat(written).isEqualTo(3);
        List<SimilarCase> hits = caseMemory.searchCases(vector(TransactionDescriptor.describe(sanctioned)), 10, null);
        assertThat(hits).extracting(SimilarCase::caseId).containsExactlyInAnyOrder("d0", "d1", "d3");
        SimilarCase top = hits.get(0);
        assertThat(top.caseId()).isEqualTo("d0");
        assertThat(top.transactionId()).isEqualTo("tx-d0");
        assertThat(top.verdict()).isEqualTo(Verdict.FLAG);
        assertThat(top.riskScore()).isEqualTo(0.9);
        assertThat(top.reasoning()).isEqualTo("reasoning for tx-d0");
    }

    @Test
    @DisplayName("keeps verdict filtering on rebuilt cases")
    void verdictFilter() throws Exception {
        store("d0", objectMapper.writeValueAsString(transaction("tx-d0", "75000", "USA", "Iran")), Verdict.FLAG, 2);
        store("d1", objectMapper.writeValueAsString(transaction("tx-d1", "200", "UK", "France")), Verdict.ACCEPTABLE, 1);

        rebuilder.rebuild();

        assertThat(caseMemory.searchCases(vector("anything"), 10, Set.of(Verdict.FLAG)))
                .extracting(SimilarCase::caseId)
                .containsExactly("d0");
    }

    @Test
    @DisplayName("writes nothing for an empty decision store")
    void empty() {
        assertThat(rebuilder.rebuild()).isZero();
    }
}
