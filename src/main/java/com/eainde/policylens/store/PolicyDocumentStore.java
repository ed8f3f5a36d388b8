package com.eainde.policylens.store;

import com.eainde.policylens.model.PolicyChunk;
import com.eainde.policylens.model.PolicyDocument;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Policy documents with their raw text snapshots and chunk sets.
 */
public interface PolicyDocumentStore {

    void save(PolicyDocument document, List<PolicyChunk> chunks);

    Optional<PolicyDocument> find(String docId);

    List<PolicyDocument> listActive();

    List<PolicyChunk> chunks(String docId);

    /**
     * Marks an active document inactive. A document that is already inactive is left alone;
     * there is no way back to active.
     *
     * @return true if the document was active before the call
     */
    boolean deactivate(String docId, String supersededBy, Instant validTo);
}
