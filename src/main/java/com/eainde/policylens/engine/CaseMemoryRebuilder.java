package com.eainde.policylens.engine;

import com.eainde.policylens.gateway.CaseStore;
import com.eainde.policylens.gateway.EmbeddingGateway;
import com.eainde.policylens.model.ComplianceCase;
import com.eainde.policylens.model.ComplianceDecision;
import com.eainde.policylens.model.StoredDecision;
import com.eainde.policylens.model.Transaction;
import com.eainde.policylens.model.TransactionDescriptor;
import com.eainde.policylens.store.DecisionFilter;
import com.eainde.policylens.store.DecisionStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Refills the case memory from the decision store. The vector store holding cases does not
 * survive a restart, while every decision that produced a case does.
 *
 * <p>Each stored decision becomes one case keyed by its decision id, embedded from the
 * descriptor of its stored transaction. Unreadable records and unparsable payloads are
 * skipped.</p>
 */
@Slf4j
public class CaseMemoryRebuilder {

    private final DecisionStore decisionStore;
    private final EmbeddingGateway embeddingGateway;
    private final CaseStore caseStore;
    private final ObjectMapper objectMapper;
    private final int pageSize;

    public CaseMemoryRebuilder(DecisionStore decisionStore,
                               EmbeddingGateway embeddingGateway,
                               CaseStore caseStore,
                               ObjectMapper objectMapper,
                               int pageSize) {
        this.decisionStore = decisionStore;
        this.embeddingGateway = embeddingGateway;
        this.caseStore = caseStore;
        this.objectMapper = objectMapper;
        this.pageSize = pageSize;
    }

    /**
     * @return number of cases written
     * @throws com.eainde.policylens.exception.RetrievalException if embedding or the case store fails
     */
    public int rebuild() {
        int written = 0;
        int skipped = 0;

        int page = 0;
        List<StoredDecision> batch;
        do {
            batch = decisionStore.list(DecisionFilter.all(), page++, pageSize);

            List<StoredDecision> usable = new ArrayList<>(batch.size());
            List<String> descriptors = new ArrayList<>(batch.size());
            for (StoredDecision stored : batch) {
                Transaction transaction = transaction(stored);
                if (transaction == null) {
                    skipped++;
                    continue;
                }
                usable.add(stored);
                descriptors.add(TransactionDescriptor.describe(transaction));
            }
            if (usable.isEmpty()) continue;

            List<float[]> vectors = embeddingGateway.embedAll(descriptors);
            for (int i = 0; i < usable.size(); i++) {
                StoredDecision stored = usable.get(i);
                ComplianceDecision decision = stored.decision();
                caseStore.append(new ComplianceCase(
                        stored.decisionId(),
                        decision.transactionId(),
                        vectors.get(i),
                        decision.verdict(),
                        decision.riskScore(),
                        decision.reasoning(),
                        stored.storedAt()));
                written++;
            }
        } while (batch.size() == pageSize);

        log.info("Rebuilt case memory with {} cases ({} stored decisions skipped)", written, skipped);
        return written;
    }

    private Transaction transaction(StoredDecision stored) {
        if (!stored.isReadable()) {
            log.warn("Decision {} is unreadable, no case rebuilt", stored.decisionId());
            return null;
        }
        String payload = stored.transactionPayload();
        if (payload == null || payload.isBlank()) {
            log.warn("Decision {} has no transaction payload, no case rebuilt", stored.decisionId());
            return null;
        }
        try {
            return objectMapper.readValue(payload, Transaction.class);
        } catch (JsonProcessingException e) {
            log.warn("Decision {} has an unparsable payload, no case rebuilt: {}",
                    stored.decisionId(), e.getOriginalMessage());
            return null;
        }
    }
}
