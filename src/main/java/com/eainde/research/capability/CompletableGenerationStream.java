package com.eainde.research.capability;

import com.eainde.research.ResearchException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link GenerationStream} completed by callbacks, typically from a
 * streaming chat response handler.
 */
public class CompletableGenerationStream<T> implements GenerationStream<T> {

    private final CompletableFuture<Void> events = new CompletableFuture<>();
    private final CompletableFuture<T> output = new CompletableFuture<>();
    private final AtomicInteger eventCount = new AtomicInteger();

    public void onEvent() {
        eventCount.incrementAndGet();
    }

    public void closeEvents() {
        events.complete(null);
    }

    public void failEvents(Throwable error) {
        events.completeExceptionally(error);
    }

    public void complete(T value) {
        events.complete(null);
        output.complete(value);
    }

    public void fail(Throwable error) {
        output.completeExceptionally(error);
    }

    @Override
    public void awaitEvents() {
        await(events);
    }

    @Override
    public T output() {
        return await(output);
    }

    @Override
    public int eventCount() {
        return eventCount.get();
    }

    private static <V> V await(CompletableFuture<V> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ResearchException("Interrupted while waiting for streaming generation", e);
        } catch (ExecutionException e) {
            throw ResearchException.propagate(e);
        }
    }
}
