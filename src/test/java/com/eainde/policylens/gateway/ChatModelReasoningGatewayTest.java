package com.eainde.policylens.gateway;

import com.eainde.policylens.exception.ReasoningUnavailableException;
import com.eainde.policylens.model.Verdict;
import com.eainde.policylens.support.Fixtures;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static com.eainde.policylens.support.Fixtures.chunk;
import static com.eainde.policylens.support.Fixtures.similarCase;
import static com.eainde.policylens.support.Fixtures.transaction;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChatModelReasoningGatewayTest {

    @Mock
    private ChatModel chatModel;

    private ChatModelReasoningGateway gateway(ChatModel model) {
        return new ChatModelReasoningGateway(model, Fixtures.fastRetry("test"),
                new ReasoningResponseParser(Fixtures.objectMapper()));
    }

    private static ChatResponse response(String text) {
        return ChatResponse.builder().aiMessage(AiMessage.from(text)).build();
    }

    @Test
    @DisplayName("sends a JSON-format request carrying the transaction and context")
    void sendsJsonRequest() {
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(response(
                "{\"verdict\":\"FLAG\",\"risk_level\":\"HIGH\",\"risk_score\":0.9,\"confidence\":0.8,\"reasoning\":\"r\"}"));

        ReasoningResult result = gateway(chatModel).reason(
                transaction("tx-1", "75000", "USA", "Iran"),
                List.of(new ScoredChunk(chunk("doc_1", 0, "sanctions rule text"), 0.9)),
                List.of(similarCase("c1", 0.8, Verdict.FLAG, 0.9)));

        assertThat(result.verdict()).isEqualTo(Verdict.FLAG);

        ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
        verify(chatModel).chat(captor.capture());
        ChatRequest request = captor.getValue();
        assertThat(request.responseFormat()).isEqualTo(ResponseFormat.JSON);
        assertThat(request.messages()).hasSize(2);
        assertThat(((UserMessage) request.messages().get(1)).singleText())
                .contains("tx-1")
                .contains("sanctions rule text")
                .contains("verdict=FLAG");
    }

    @Test
    @DisplayName("reports unavailability after the retries are exhausted")
    void retriesThenFails() {
        when(chatModel.chat(any(ChatRequest.class))).thenThrow(new RuntimeException("503"));

        assertThatThrownBy(() -> gateway(chatModel).answer("What is CTR?", List.of()))
                .isInstanceOf(ReasoningUnavailableException.class);
        verify(chatModel, times(3)).chat(any(ChatRequest.class));
    }

    @Test
    @DisplayName("reports unavailability immediately when no model is configured")
    void unconfigured() {
        ChatModelReasoningGateway gateway = gateway(null);

        assertThat(gateway.isConfigured()).isFalse();
        assertThatThrownBy(() -> gateway.reason(transaction("tx-1", "10", "USA", "USA"), List.of(), List.of()))
                .isInstanceOf(ReasoningUnavailableException.class)
                .hasMessageContaining("No reasoning model");
    }
}
