package com.eainde.research.nodes;

import com.eainde.research.StageInstrumentation;
import com.eainde.research.debug.ArtifactRecorder;
import com.eainde.research.model.Evaluation;
import com.eainde.research.model.SearchItem;
import com.eainde.research.progress.ProgressKeys;
import com.eainde.research.progress.ProgressSink;
import com.eainde.research.search.SearchFanOutExecutor;
import com.eainde.research.stage.FollowUpPlanner;
import com.eainde.research.state.ResearchState;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * One follow-up round: turns the latest evaluation's gaps into a fresh batch, searches
 * it and appends the results. Advances the iteration counter.
 */
public class FollowUpNode extends ResearchNode {

    private final SearchFanOutExecutor fanOut;
    private final ProgressSink progress;
    private final StageInstrumentation instrumentation;
    private final ArtifactRecorder recorder;

    public FollowUpNode(SearchFanOutExecutor fanOut, ProgressSink progress,
                        StageInstrumentation instrumentation, ArtifactRecorder recorder) {
        this.fanOut = fanOut;
        this.progress = progress;
        this.instrumentation = instrumentation;
        this.recorder = recorder;
    }

    @Override
    protected Map<String, Object> run(ResearchState state) {
        Evaluation evaluation = state.getEvaluation()
                .orElseThrow(() -> new IllegalStateException("No evaluation in state"));
        int iteration = state.getIteration();

        progress.update(ProgressKeys.FOLLOW_UP, "Identified " + evaluation.gaps().size()
                + " research gaps (iteration " + iteration + "/" + state.getMaxIterations() + ")");
        List<SearchItem> batch = FollowUpPlanner.derive(evaluation);
        recorder.record("follow_up_searches_iteration_" + iteration, batch);

        List<String> results = instrumentation.call("follow_up",
                () -> fanOut.executeAll(batch, ProgressKeys.FOLLOW_UP, "Follow-up research..."));

        Map<String, Object> update = new HashMap<>(state.appendResults(results));
        update.put(ResearchState.ITERATION, iteration + 1);
        update.put(ResearchState.FOLLOW_UP_ROUNDS, state.getFollowUpRounds() + 1);
        return update;
    }
}
