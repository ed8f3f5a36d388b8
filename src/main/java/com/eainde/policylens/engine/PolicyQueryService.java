package com.eainde.policylens.engine;

import com.eainde.policylens.config.PolicyLensProperties;
import com.eainde.policylens.exception.ReasoningUnavailableException;
import com.eainde.policylens.gateway.EmbeddingGateway;
import com.eainde.policylens.gateway.PolicyAnswer;
import com.eainde.policylens.gateway.ReasoningGateway;
import com.eainde.policylens.gateway.RetrievalGateway;
import com.eainde.policylens.gateway.ScoredChunk;
import com.eainde.policylens.model.DecisionSource;
import com.eainde.policylens.model.PolicyCitation;
import com.eainde.policylens.model.PolicyTopic;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Answers free-text compliance questions from active policy text.
 */
@Slf4j
public class PolicyQueryService {

    static final int FALLBACK_EXCERPTS = 3;
    static final double FALLBACK_MAX_CONFIDENCE = 0.7;
    static final String NO_POLICY_ANSWER = "No relevant policy text was found for this question.";

    private final EmbeddingGateway embeddingGateway;
    private final RetrievalGateway retrievalGateway;
    private final ReasoningGateway reasoningGateway;
    private final PolicyLensProperties.Evaluation settings;

    public PolicyQueryService(EmbeddingGateway embeddingGateway,
                              RetrievalGateway retrievalGateway,
                              ReasoningGateway reasoningGateway,
                              PolicyLensProperties.Evaluation settings) {
        this.embeddingGateway = embeddingGateway;
        this.retrievalGateway = retrievalGateway;
        this.reasoningGateway = reasoningGateway;
        this.settings = settings;
    }

    /**
     * @param topic optional topic restriction
     * @param topK  chunks to retrieve
     * @throws com.eainde.policylens.exception.RetrievalException if embedding or retrieval fails
     */
    public QueryAnswer answer(String question, PolicyTopic topic, int topK) {
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("question must not be blank");
        }

        float[] vector = embeddingGateway.embed(question);
        List<ScoredChunk> policies = retrievalGateway.searchPolicies(vector, topK, topic);
        List<PolicyCitation> citations = policies.stream().map(this::toCitation).collect(Collectors.toList());

        try {
            PolicyAnswer answer = reasoningGateway.answer(question, policies);
            return new QueryAnswer(answer.answer(), citations, answer.confidence(), DecisionSource.REASONING_GATEWAY);
        } catch (ReasoningUnavailableException e) {
            log.warn("Reasoning unavailable for policy query, answering from excerpts: {}", e.getMessage());
            return fallbackAnswer(policies, citations);
        }
    }

    private QueryAnswer fallbackAnswer(List<ScoredChunk> policies, List<PolicyCitation> citations) {
        if (policies.isEmpty()) {
            return new QueryAnswer(NO_POLICY_ANSWER, citations, 0.0, DecisionSource.FALLBACK_HEURISTIC);
        }

        StringBuilder sb = new StringBuilder("Relevant policy excerpts:\n");
        int n = Math.min(FALLBACK_EXCERPTS, policies.size());
        for (int i = 0; i < n; i++) {
            PolicyCitation c = citations.get(i);
            sb.append(i + 1).append(". ").append(c.docTitle());
            if (c.section() != null) sb.append(" (").append(c.section()).append(')');
            sb.append(": ").append(c.text()).append('\n');
        }
        double confidence = Math.min(FALLBACK_MAX_CONFIDENCE, policies.get(0).score());
        return new QueryAnswer(sb.toString().strip(), citations, confidence, DecisionSource.FALLBACK_HEURISTIC);
    }

    private PolicyCitation toCitation(ScoredChunk scored) {
        String text = scored.chunk().text();
        int limit = settings.getExcerptLength();
        return new PolicyCitation(
                scored.chunk().docId(),
                scored.chunk().docTitle(),
                scored.chunk().section(),
                text.length() > limit ? text.substring(0, limit) : text,
                scored.score(),
                scored.chunk().version());
    }
}
