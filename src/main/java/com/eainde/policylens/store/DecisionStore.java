package com.eainde.policylens.store;

import com.eainde.policylens.model.StoredDecision;

import java.util.List;
import java.util.Optional;

/**
 * Durable keyed store of compliance decisions. Records are written once per evaluation and
 * listed in stored order.
 */
public interface DecisionStore {

    /**
     * Stores a decision under its decision id, overwriting any record with the same id.
     */
    void put(StoredDecision decision);

    Optional<StoredDecision> get(String decisionId);

    /**
     * One page of decisions matching the filter, ordered by stored time then id.
     *
     * @param page     zero-based page number
     * @param pageSize maximum records per page
     */
    List<StoredDecision> list(DecisionFilter filter, int page, int pageSize);

    long count(DecisionFilter filter);
}
