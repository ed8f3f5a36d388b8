package com.eainde.policylens.gateway;

import com.eainde.policylens.model.PolicyTopic;
import com.eainde.policylens.model.SimilarCase;
import com.eainde.policylens.model.Verdict;

import java.util.List;
import java.util.Set;

/**
 * Vector similarity search over active policy chunks and stored cases. Results are ordered
 * most similar first; scores are clamped to [0,1].
 */
public interface RetrievalGateway {

    /**
     * @param topic optional topic restriction, null for all topics
     */
    List<ScoredChunk> searchPolicies(float[] vector, int topK, PolicyTopic topic);

    /**
     * @param verdicts              optional verdict restriction, null or empty for all
     * @param excludeTransactionId  cases of this transaction are not returned, may be null
     */
    List<SimilarCase> searchCases(float[] vector, int topK, Set<Verdict> verdicts, String excludeTransactionId);

    default List<SimilarCase> searchCases(float[] vector, int topK, Set<Verdict> verdicts) {
        return searchCases(vector, topK, verdicts, null);
    }
}
