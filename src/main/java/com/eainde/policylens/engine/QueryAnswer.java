package com.eainde.policylens.engine;

import com.eainde.policylens.model.DecisionSource;
import com.eainde.policylens.model.PolicyCitation;

import java.util.List;

/**
 * @param answer     answer text
 * @param citations  the policy chunks the answer was built from
 * @param confidence in [0,1]
 * @param source     reasoning gateway or fallback excerpt summary
 */
public record QueryAnswer(String answer, List<PolicyCitation> citations, double confidence, DecisionSource source) {

    public QueryAnswer {
        citations = citations == null ? List.of() : List.copyOf(citations);
    }
}
