package com.eainde.policylens.config;

import com.eainde.policylens.gateway.ChatModelReasoningGateway;
import com.eainde.policylens.gateway.EmbeddingGateway;
import com.eainde.policylens.gateway.EmbeddingStoreRetrievalGateway;
import com.eainde.policylens.gateway.LangChain4jEmbeddingGateway;
import com.eainde.policylens.gateway.LoggingChatModelListener;
import com.eainde.policylens.gateway.ReasoningResponseParser;
import com.eainde.policylens.metrics.ComplianceMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2.AllMiniLmL6V2EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.util.List;

/**
 * Embedding, retrieval and reasoning adapters.
 */
@Slf4j
@Configuration
public class GatewayConfig {

    @Bean
    public EmbeddingModel embeddingModel() {
        return new AllMiniLmL6V2EmbeddingModel();
    }

    @Bean
    public EmbeddingGateway embeddingGateway(EmbeddingModel embeddingModel,
                                             @Qualifier("embeddingRetry") Retry embeddingRetry) {
        return new LangChain4jEmbeddingGateway(embeddingModel, embeddingRetry);
    }

    @Bean
    public EmbeddingStoreRetrievalGateway retrievalGateway() {
        return new EmbeddingStoreRetrievalGateway(new InMemoryEmbeddingStore<>(), new InMemoryEmbeddingStore<>());
    }

    @Bean
    public LoggingChatModelListener loggingChatModelListener(ComplianceMetrics metrics) {
        return new LoggingChatModelListener(metrics);
    }

    @Bean
    public ChatModelReasoningGateway reasoningGateway(PolicyLensProperties properties,
                                                      LoggingChatModelListener listener,
                                                      @Qualifier("reasoningRetry") Retry reasoningRetry,
                                                      ObjectMapper objectMapper) {
        PolicyLensProperties.Reasoning reasoning = properties.getReasoning();
        ChatModel chatModel = null;
        if (StringUtils.hasText(reasoning.getApiKey())) {
            chatModel = OpenAiChatModel.builder()
                    .baseUrl(reasoning.getBaseUrl())
                    .apiKey(reasoning.getApiKey())
                    .modelName(reasoning.getModel())
                    .temperature(reasoning.getTemperature())
                    .maxTokens(reasoning.getMaxTokens())
                    .timeout(reasoning.getTimeout())
                    .logRequests(reasoning.isLogRequests())
                    .logResponses(reasoning.isLogRequests())
                    .listeners(List.of(listener))
                    .build();
            log.info("Reasoning model {} configured at {}", reasoning.getModel(), reasoning.getBaseUrl());
        } else {
            log.warn("No reasoning API key configured; evaluations will use the fallback heuristic");
        }
        return new ChatModelReasoningGateway(chatModel, reasoningRetry, new ReasoningResponseParser(objectMapper));
    }
}
