package com.eainde.research.capability;

/**
 * Handle on an in-flight streaming generation.
 *
 * <p>{@link #awaitEvents()} and {@link #output()} fail independently: an error while
 * consuming intermediate events does not necessarily mean the final output is lost.</p>
 *
 * @param <T> type of the final structured output
 */
public interface GenerationStream<T> {

    /**
     * Blocks until the event stream closes.
     *
     * @throws RuntimeException if the stream failed while events were being consumed
     */
    void awaitEvents();

    /**
     * Blocks until the final output is available.
     *
     * @throws RuntimeException if the generation failed fatally
     */
    T output();

    /**
     * Number of intermediate events received so far.
     */
    int eventCount();
}
