package com.eainde.research.capability;

/**
 * Opaque text-generation capability used by the planner, evaluator and writer.
 *
 * <p>Implementations own retries. Errors surface as unchecked exceptions.</p>
 */
public interface GenerationCapability {

    /**
     * Single blocking call.
     *
     * @param spec  agent to run; its output type decides how the reply is parsed
     * @param input user input for the agent
     * @return the parsed reply
     */
    <T> T generate(AgentSpec<T> spec, String input);

    /**
     * Starts a streaming call. The returned stream may already be closed when the
     * underlying client streams synchronously.
     */
    <T> GenerationStream<T> generateStreaming(AgentSpec<T> spec, String input);
}
