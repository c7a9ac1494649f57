package com.eainde.research.capability;

import com.eainde.research.ResearchException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.request.ResponseFormatType;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * {@link GenerationCapability} over LangChain4j chat models.
 *
 * <p>The system prompt comes from {@link PromptService}; agents with a schema are called
 * in JSON structured-output mode and their reply is parsed with Jackson into the
 * agent's output type. Each agent can be bound to its own model, otherwise the default
 * model is used.</p>
 */
@Slf4j
public class LangChain4jGenerationCapability implements GenerationCapability {

    private final ChatModel defaultModel;
    private final Map<String, ChatModel> modelsByAgent;
    private final StreamingChatModel streamingModel;
    private final PromptService promptService;
    private final JsonSchemaConverter schemaConverter;
    private final ObjectMapper objectMapper;

    public LangChain4jGenerationCapability(ChatModel defaultModel,
                                           Map<String, ChatModel> modelsByAgent,
                                           StreamingChatModel streamingModel,
                                           PromptService promptService,
                                           JsonSchemaConverter schemaConverter,
                                           ObjectMapper objectMapper) {
        this.defaultModel = defaultModel;
        this.modelsByAgent = Map.copyOf(modelsByAgent);
        this.streamingModel = streamingModel;
        this.promptService = promptService;
        this.schemaConverter = schemaConverter;
        this.objectMapper = objectMapper;
    }

    @Override
    public <T> T generate(AgentSpec<T> spec, String input) {
        ChatModel model = modelsByAgent.getOrDefault(spec.getAgentName(), defaultModel);
        log.debug("Calling agent {}: {}", spec, spec.getDescription());
        ChatResponse response = model.chat(buildRequest(spec, input));
        return parse(spec, response.aiMessage().text());
    }

    @Override
    public <T> GenerationStream<T> generateStreaming(AgentSpec<T> spec, String input) {
        if (!spec.isStreaming()) {
            throw new IllegalArgumentException("Agent " + spec.getAgentName() + " is not a streaming agent");
        }
        CompletableGenerationStream<T> stream = new CompletableGenerationStream<>();
        log.debug("Streaming agent {}: {}", spec, spec.getDescription());

        streamingModel.chat(buildRequest(spec, input), new StreamingChatResponseHandler() {
            @Override
            public void onPartialResponse(String partialResponse) {
                stream.onEvent();
            }

            @Override
            public void onCompleteResponse(ChatResponse completeResponse) {
                stream.closeEvents();
                try {
                    stream.complete(parse(spec, completeResponse.aiMessage().text()));
                } catch (RuntimeException e) {
                    stream.fail(e);
                }
            }

            @Override
            public void onError(Throwable error) {
                stream.failEvents(error);
                stream.fail(error);
            }
        });
        return stream;
    }

    private ChatRequest buildRequest(AgentSpec<?> spec, String input) {
        ChatRequest.Builder builder = ChatRequest.builder()
                .messages(
                        SystemMessage.from(promptService.getSystemPrompt(spec.getAgentName())),
                        UserMessage.from(input));
        if (spec.hasSchema()) {
            builder.responseFormat(ResponseFormat.builder()
                    .type(ResponseFormatType.JSON)
                    .jsonSchema(schemaConverter.fromResource(spec.getAgentName(), spec.getSchemaResource()))
                    .build());
        }
        return builder.build();
    }

    <T> T parse(AgentSpec<T> spec, String text) {
        if (spec.getOutputType() == String.class) {
            return spec.getOutputType().cast(text);
        }
        if (text == null || text.isBlank()) {
            throw new ResearchException("Agent " + spec.getAgentName() + " returned an empty response");
        }
        try {
            return objectMapper.readValue(cleanJson(text), spec.getOutputType());
        } catch (JsonProcessingException e) {
            throw new ResearchException("Agent " + spec.getAgentName() + " returned unparseable output: "
                    + e.getOriginalMessage(), e);
        }
    }

    static String cleanJson(String text) {
        return text.replace("```json", "")
                .replace("```", "")
                .trim();
    }
}
