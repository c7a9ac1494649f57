package com.eainde.research.capability;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.rag.content.retriever.ContentRetriever;
import dev.langchain4j.service.AiServices;
import dev.langchain4j.web.search.WebSearchEngine;
import dev.langchain4j.web.search.WebSearchTool;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link SearchCapability} backed by a tool-using LangChain4j agent.
 *
 * <p>The agent is offered {@code vector_search} when a {@link ContentRetriever} is
 * configured and {@code web_search} when a {@link WebSearchEngine} is configured. With
 * neither, it answers from the model alone.</p>
 */
@Slf4j
public class AgentSearchCapability implements SearchCapability {

    private final SearchAgent agent;

    public AgentSearchCapability(ChatModel chatModel,
                                 PromptService promptService,
                                 ContentRetriever contentRetriever,
                                 WebSearchEngine webSearchEngine) {
        this(buildAgent(chatModel, promptService, contentRetriever, webSearchEngine));
    }

    AgentSearchCapability(SearchAgent agent) {
        this.agent = agent;
    }

    @Override
    public String search(String request) {
        return agent.search(request);
    }

    private static SearchAgent buildAgent(ChatModel chatModel,
                                          PromptService promptService,
                                          ContentRetriever contentRetriever,
                                          WebSearchEngine webSearchEngine) {
        List<Object> tools = new ArrayList<>();
        if (contentRetriever != null) {
            tools.add(new VectorSearchTool(contentRetriever));
        } else {
            log.warn("No content retriever configured, vector_search is unavailable");
        }
        if (webSearchEngine != null) {
            tools.add(WebSearchTool.from(webSearchEngine));
        } else {
            log.warn("No web search engine configured, web_search is unavailable");
        }

        String systemPrompt = promptService.getSystemPrompt(ResearchAgents.SEARCHER.getAgentName());
        AiServices<SearchAgent> builder = AiServices.builder(SearchAgent.class)
                .chatModel(chatModel)
                .systemMessageProvider(memoryId -> systemPrompt);
        if (!tools.isEmpty()) {
            builder.tools(tools);
        }
        return builder.build();
    }
}
