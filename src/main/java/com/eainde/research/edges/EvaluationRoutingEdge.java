package com.eainde.research.edges;

import com.eainde.research.model.Evaluation;
import com.eainde.research.state.ResearchState;
import org.bsc.langgraph4j.action.AsyncEdgeAction;

import java.util.concurrent.CompletableFuture;

/**
 * Decides what follows an evaluation: another follow-up round, or the report.
 *
 * <p>The report is written when the evaluation asks for nothing more, or when the round
 * budget is spent. A spent budget is a normal ending, not an error.</p>
 */
public class EvaluationRoutingEdge implements AsyncEdgeAction<ResearchState> {

    public static final String FOLLOW_UP = "follow_up";
    public static final String WRITE = "write";

    @Override
    public CompletableFuture<String> apply(ResearchState state) {
        Evaluation evaluation = state.getEvaluation().orElse(null);

        String nextNode;
        if (evaluation == null || !evaluation.needsMore()) {
            nextNode = WRITE;
        } else if (state.isCapReached()) {
            nextNode = WRITE;
        } else {
            nextNode = FOLLOW_UP;
        }
        return CompletableFuture.completedFuture(nextNode);
    }
}
