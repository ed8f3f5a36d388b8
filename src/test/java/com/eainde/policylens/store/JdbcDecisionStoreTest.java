package com.eainde.policylens.store;

import com.eainde.policylens.model.StoredDecision;
import com.eainde.policylens.model.Verdict;
import com.eainde.policylens.support.Fixtures;
import com.eainde.policylens.support.TestDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.eainde.policylens.support.Fixtures.NOW;
import static com.eainde.policylens.support.Fixtures.citation;
import static com.eainde.policylens.support.Fixtures.decision;
import static org.assertj.core.api.Assertions.assertThat;

class JdbcDecisionStoreTest {

    private TestDatabase database;
    private JdbcDecisionStore store;

    @BeforeEach
    void setUp() {
        database = new TestDatabase();
        store = new JdbcDecisionStore(database.jdbcTemplate(), Fixtures.objectMapper());
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    private StoredDecision stored(String id, Verdict verdict, Instant storedAt) {
        return new StoredDecision(id, "{\"transaction_id\":\"tx-" + id + "\"}",
                decision("tx-" + id, verdict, 0.5, List.of(citation("doc_1"))), storedAt);
    }

    @Test
    @DisplayName("round-trips a decision with its payload and citations")
    void putAndGet() {
        StoredDecision original = stored("d1", Verdict.FLAG, NOW);
        store.put(original);

        StoredDecision loaded = store.get("d1").orElseThrow();

        assertThat(loaded).isEqualTo(original);
        assertThat(loaded.decision().cites("doc_1")).isTrue();
        assertThat(store.get("missing")).isEmpty();
    }

    @Test
    @DisplayName("pages in stored order and filters by verdict and time")
    void listAndCount() {
        for (int i = 0; i < 5; i++) {
            store.put(stored("d" + i, i % 2 == 0 ? Verdict.FLAG : Verdict.ACCEPTABLE,
                    NOW.plus(Duration.ofMinutes(i))));
        }

        assertThat(store.list(DecisionFilter.all(), 0, 2)).extracting(StoredDecision::decisionId)
                .containsExactly("d0", "d1");
        assertThat(store.list(DecisionFilter.all(), 2, 2)).extracting(StoredDecision::decisionId)
                .containsExactly("d4");
        assertThat(store.count(DecisionFilter.ofVerdict(Verdict.FLAG))).isEqualTo(3);

        DecisionFilter window = new DecisionFilter(null, NOW.plus(Duration.ofMinutes(1)),
                NOW.plus(Duration.ofMinutes(3)), null);
        assertThat(store.list(window, 0, 10)).extracting(StoredDecision::decisionId)
                .containsExactly("d1", "d2", "d3");

        DecisionFilter snapshot = DecisionFilter.all().withSnapshotAt(NOW.plus(Duration.ofMinutes(2)));
        assertThat(store.count(snapshot)).isEqualTo(3);
        assertThat(store.list(snapshot, 0, 10)).extracting(StoredDecision::decisionId)
                .containsExactly("d0", "d1", "d2");
    }

    @Test
    @DisplayName("keeps an unparsable transaction payload as-is")
    void keepsRawPayload() {
        store.put(new StoredDecision("bad", "not json {", decision("tx-bad", Verdict.ACCEPTABLE, 0.1, List.of()), NOW));

        assertThat(store.get("bad").orElseThrow().transactionPayload()).isEqualTo("not json {");
    }

    @Test
    @DisplayName("returns a row with unreadable decision JSON as unreadable instead of failing the page")
    void unreadableRow() {
        for (int i = 0; i < 3; i++) {
            store.put(stored("d" + i, Verdict.FLAG, NOW.plus(Duration.ofMinutes(i))));
        }
        database.jdbcTemplate().update(
                "UPDATE compliance_decision SET decision_json = '{broken' WHERE decision_id = 'd1'");

        List<StoredDecision> page = store.list(DecisionFilter.all(), 0, 10);

        assertThat(page).extracting(StoredDecision::decisionId).containsExactly("d0", "d1", "d2");
        assertThat(page).extracting(StoredDecision::isReadable).containsExactly(true, false, true);
        StoredDecision broken = store.get("d1").orElseThrow();
        assertThat(broken.decision()).isNull();
        assertThat(broken.transactionPayload()).isEqualTo("{\"transaction_id\":\"tx-d1\"}");
    }
}
