package com.eainde.policylens.gateway;

import com.eainde.policylens.exception.RetrievalException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.stream.Collectors;

/**
 * {@link EmbeddingGateway} over a LangChain4j {@link EmbeddingModel}, with capped retries.
 */
@Slf4j
public class LangChain4jEmbeddingGateway implements EmbeddingGateway {

    private final EmbeddingModel embeddingModel;
    private final Retry retry;

    public LangChain4jEmbeddingGateway(EmbeddingModel embeddingModel, Retry retry) {
        this.embeddingModel = embeddingModel;
        this.retry = retry;
    }

    @Override
    public float[] embed(String text) {
        try {
            Embedding embedding = retry.executeSupplier(() -> embeddingModel.embed(text).content());
            return embedding.vector();
        } catch (RuntimeException e) {
            log.error("Embedding failed after {} attempts", retry.getRetryConfig().getMaxAttempts(), e);
            throw new RetrievalException("Embedding failed", e);
        }
    }

    @Override
    public List<float[]> embedAll(List<String> texts) {
        if (texts.isEmpty()) return List.of();
        List<TextSegment> segments = texts.stream().map(TextSegment::from).collect(Collectors.toList());
        try {
            List<Embedding> embeddings = retry.executeSupplier(() -> embeddingModel.embedAll(segments).content());
            return embeddings.stream().map(Embedding::vector).collect(Collectors.toList());
        } catch (RuntimeException e) {
            log.error("Batch embedding of {} texts failed", texts.size(), e);
            throw new RetrievalException("Batch embedding failed", e);
        }
    }
}
