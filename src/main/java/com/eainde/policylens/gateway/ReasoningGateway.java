package com.eainde.policylens.gateway;

import com.eainde.policylens.model.SimilarCase;
import com.eainde.policylens.model.Transaction;

import java.util.List;

/**
 * Structured reasoning over a transaction and its retrieved context.
 */
public interface ReasoningGateway {

    /**
     * @throws com.eainde.policylens.exception.ReasoningUnavailableException when no model is
     *         configured or the model fails after retries
     */
    ReasoningResult reason(Transaction transaction, List<ScoredChunk> policies, List<SimilarCase> cases);

    /**
     * @throws com.eainde.policylens.exception.ReasoningUnavailableException as for {@link #reason}
     */
    PolicyAnswer answer(String question, List<ScoredChunk> policies);
}
