package com.eainde.research.nodes;

import com.eainde.research.state.ResearchState;
import org.bsc.langgraph4j.action.AsyncNodeAction;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Base for the research graph nodes. Nodes run synchronously and hand failures back
 * as a failed future.
 */
public abstract class ResearchNode implements AsyncNodeAction<ResearchState> {

    @Override
    public CompletableFuture<Map<String, Object>> apply(ResearchState state) {
        try {
            return CompletableFuture.completedFuture(run(state));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    protected abstract Map<String, Object> run(ResearchState state);
}
