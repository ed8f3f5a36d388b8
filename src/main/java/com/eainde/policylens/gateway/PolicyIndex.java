package com.eainde.policylens.gateway;

import com.eainde.policylens.model.PolicyChunk;

import java.util.List;

/**
 * Write side of policy retrieval.
 */
public interface PolicyIndex {

    /**
     * Indexes chunks with their vectors; {@code vectors.get(i)} belongs to {@code chunks.get(i)}.
     */
    void index(List<PolicyChunk> chunks, List<float[]> vectors);

    /**
     * Excludes every chunk of the document from all searches issued after this returns.
     */
    void deactivate(String docId);
}
