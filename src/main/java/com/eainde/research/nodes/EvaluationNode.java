package com.eainde.research.nodes;

import com.eainde.research.StageInstrumentation;
import com.eainde.research.debug.ArtifactRecorder;
import com.eainde.research.model.Evaluation;
import com.eainde.research.progress.ProgressKeys;
import com.eainde.research.progress.ProgressSink;
import com.eainde.research.stage.Evaluator;
import com.eainde.research.state.ResearchState;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Evaluates everything collected so far. When more research is wanted but the round
 * budget is spent, posts the cap notice; routing itself is left to
 * {@link com.eainde.research.edges.EvaluationRoutingEdge}.
 */
@Slf4j
public class EvaluationNode extends ResearchNode {

    private final Evaluator evaluator;
    private final ProgressSink progress;
    private final StageInstrumentation instrumentation;
    private final ArtifactRecorder recorder;

    public EvaluationNode(Evaluator evaluator, ProgressSink progress,
                          StageInstrumentation instrumentation, ArtifactRecorder recorder) {
        this.evaluator = evaluator;
        this.progress = progress;
        this.instrumentation = instrumentation;
        this.recorder = recorder;
    }

    @Override
    protected Map<String, Object> run(ResearchState state) {
        int iteration = state.getIteration();
        Evaluation evaluation = instrumentation.call("evaluate",
                () -> evaluator.evaluate(state.getQuery(), state.getAllResults(), iteration, state.getMaxIterations()));
        recorder.record("evaluation_iteration_" + iteration, evaluation);

        if (evaluation.needsMore() && state.isCapReached()) {
            log.info("Gaps remain after {} follow-up rounds, writing the report anyway", state.getFollowUpRounds());
            progress.complete(ProgressKeys.MAX_ITERATIONS,
                    "Reached maximum research iterations (" + state.getMaxIterations() + ")");
        }
        return Map.of(ResearchState.EVALUATION, evaluation);
    }
}
