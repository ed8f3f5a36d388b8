package com.eainde.policylens.gateway;

import com.eainde.policylens.exception.ReasoningUnavailableException;
import com.eainde.policylens.model.SimilarCase;
import com.eainde.policylens.model.Transaction;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * {@link ReasoningGateway} over a LangChain4j {@link ChatModel} with JSON response format.
 * A null model means reasoning is not configured; every call then reports unavailability
 * and callers fall back.
 */
@Slf4j
public class ChatModelReasoningGateway implements ReasoningGateway {

    private final ChatModel chatModel;
    private final Retry retry;
    private final ReasoningResponseParser parser;

    public ChatModelReasoningGateway(ChatModel chatModel, Retry retry, ReasoningResponseParser parser) {
        this.chatModel = chatModel;
        this.retry = retry;
        this.parser = parser;
    }

    @Override
    public ReasoningResult reason(Transaction transaction, List<ScoredChunk> policies, List<SimilarCase> cases) {
        String raw = call(ReasoningPrompts.EVALUATION_SYSTEM,
                ReasoningPrompts.evaluation(transaction, policies, cases));
        return parser.parseEvaluation(raw);
    }

    @Override
    public PolicyAnswer answer(String question, List<ScoredChunk> policies) {
        String raw = call(ReasoningPrompts.QUERY_SYSTEM, ReasoningPrompts.question(question, policies));
        return parser.parseAnswer(raw);
    }

    public boolean isConfigured() {
        return chatModel != null;
    }

    private String call(String system, String user) {
        if (chatModel == null) {
            throw new ReasoningUnavailableException("No reasoning model configured");
        }

        ChatRequest request = ChatRequest.builder()
                .messages(SystemMessage.from(system), UserMessage.from(user))
                .responseFormat(ResponseFormat.JSON)
                .build();
        try {
            ChatResponse response = retry.executeSupplier(() -> chatModel.chat(request));
            String text = response.aiMessage() != null ? response.aiMessage().text() : null;
            if (text == null) {
                throw new ReasoningUnavailableException("Reasoning model returned no text");
            }
            return text;
        } catch (ReasoningUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Reasoning model failed after {} attempts: {}",
                    retry.getRetryConfig().getMaxAttempts(), e.getMessage());
            throw new ReasoningUnavailableException("Reasoning model call failed", e);
        }
    }
}
