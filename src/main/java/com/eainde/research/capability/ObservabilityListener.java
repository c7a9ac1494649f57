package com.eainde.research.capability;

import dev.langchain4j.model.chat.listener.ChatModelErrorContext;
import dev.langchain4j.model.chat.listener.ChatModelListener;
import dev.langchain4j.model.chat.listener.ChatModelRequestContext;
import dev.langchain4j.model.chat.listener.ChatModelResponseContext;
import dev.langchain4j.model.output.TokenUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs latency and token usage of every model call made by the research agents.
 */
public class ObservabilityListener implements ChatModelListener {

    private static final Logger log = LoggerFactory.getLogger(ObservabilityListener.class);
    private static final String START_TIME = "research.startTime";

    @Override
    public void onRequest(ChatModelRequestContext requestContext) {
        log.debug("Sending request to model with {} messages", requestContext.chatRequest().messages().size());
        requestContext.attributes().put(START_TIME, System.currentTimeMillis());
    }

    @Override
    public void onResponse(ChatModelResponseContext responseContext) {
        Object startTime = responseContext.attributes().get(START_TIME);
        long duration = startTime instanceof Long start ? System.currentTimeMillis() - start : -1;

        TokenUsage usage = responseContext.chatResponse().tokenUsage();
        if (usage == null) {
            log.info("Model responded in {}ms (no token usage reported)", duration);
            return;
        }
        log.info("Model responded in {}ms. Token usage - Input: {}, Output: {}, Total: {}",
                duration,
                usage.inputTokenCount(),
                usage.outputTokenCount(),
                usage.totalTokenCount());
    }

    @Override
    public void onError(ChatModelErrorContext errorContext) {
        log.error("LLM interaction failed", errorContext.error());
    }
}
