package com.eainde.research.capability;

/**
 * Resolves the system prompt of an agent by its name.
 */
public interface PromptService {

    String getSystemPrompt(String agentName);
}
