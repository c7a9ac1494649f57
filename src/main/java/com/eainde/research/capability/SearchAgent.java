package com.eainde.research.capability;

import dev.langchain4j.service.UserMessage;

/**
 * LangChain4j AI service that researches one search request and summarizes what it
 * found. The system prompt is supplied at build time.
 */
public interface SearchAgent {

    String search(@UserMessage String request);
}
