package com.eainde.research.nodes;

import com.eainde.research.StageInstrumentation;
import com.eainde.research.model.SearchPlan;
import com.eainde.research.progress.ProgressKeys;
import com.eainde.research.search.SearchFanOutExecutor;
import com.eainde.research.state.ResearchState;

import java.util.List;
import java.util.Map;

/**
 * Runs the planned searches as one batch.
 */
public class SearchNode extends ResearchNode {

    private final SearchFanOutExecutor fanOut;
    private final StageInstrumentation instrumentation;

    public SearchNode(SearchFanOutExecutor fanOut, StageInstrumentation instrumentation) {
        this.fanOut = fanOut;
        this.instrumentation = instrumentation;
    }

    @Override
    protected Map<String, Object> run(ResearchState state) {
        SearchPlan plan = state.getPlan().orElseThrow(() -> new IllegalStateException("No search plan in state"));
        List<String> results = instrumentation.call("search",
                () -> fanOut.executeAll(plan.items(), ProgressKeys.SEARCHING, "Searching..."));
        return state.appendResults(results);
    }
}
