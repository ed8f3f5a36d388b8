package com.eainde.policylens.gateway;

import com.eainde.policylens.metrics.ComplianceMetrics;
import dev.langchain4j.model.chat.listener.ChatModelErrorContext;
import dev.langchain4j.model.chat.listener.ChatModelListener;
import dev.langchain4j.model.chat.listener.ChatModelRequestContext;
import dev.langchain4j.model.chat.listener.ChatModelResponseContext;
import dev.langchain4j.model.output.TokenUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Logs latency and token usage of every reasoning model call and records them as metrics.
 */
public class LoggingChatModelListener implements ChatModelListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingChatModelListener.class);

    private static final String START_TIME = "startTime";

    private final ComplianceMetrics metrics;

    public LoggingChatModelListener(ComplianceMetrics metrics) {
        this.metrics = metrics;
    }

    @Override
    public void onRequest(ChatModelRequestContext requestContext) {
        log.debug("Sending {} messages to reasoning model", requestContext.chatRequest().messages().size());
        requestContext.attributes().put(START_TIME, System.currentTimeMillis());
    }

    @Override
    public void onResponse(ChatModelResponseContext responseContext) {
        Duration duration = elapsed(responseContext.attributes().get(START_TIME));
        TokenUsage usage = responseContext.chatResponse().tokenUsage();

        if (usage != null) {
            log.info("Reasoning model responded in {}ms (tokens in={}, out={}, total={})",
                    duration.toMillis(),
                    usage.inputTokenCount(),
                    usage.outputTokenCount(),
                    usage.totalTokenCount());
        } else {
            log.info("Reasoning model responded in {}ms", duration.toMillis());
        }
        metrics.modelCall(duration, true);
    }

    @Override
    public void onError(ChatModelErrorContext errorContext) {
        metrics.modelCall(elapsed(errorContext.attributes().get(START_TIME)), false);
        log.error("Reasoning model call failed", errorContext.error());
    }

    private static Duration elapsed(Object startTime) {
        if (!(startTime instanceof Long)) return Duration.ZERO;
        return Duration.ofMillis(System.currentTimeMillis() - (Long) startTime);
    }
}
