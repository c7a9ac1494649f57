package com.eainde.research.edges;

import com.eainde.research.model.Evaluation;
import com.eainde.research.model.ResearchGap;
import com.eainde.research.state.ResearchState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class EvaluationRoutingEdgeTest {

    private final EvaluationRoutingEdge edge = new EvaluationRoutingEdge();

    private static ResearchState state(int iteration, boolean needsMore) {
        Map<String, Object> data = new HashMap<>(ResearchState.initial("q", "run", 3));
        data.put(ResearchState.ITERATION, iteration);
        data.put(ResearchState.EVALUATION, new Evaluation(5, 5, "", "",
                List.of(new ResearchGap("t", "r", List.of("a"))), needsMore));
        return new ResearchState(data);
    }

    @Test
    @DisplayName("satisfied evaluation goes to write")
    void satisfied() {
        assertThat(edge.apply(state(1, false)).join()).isEqualTo(EvaluationRoutingEdge.WRITE);
    }

    @Test
    @DisplayName("needs more within budget goes to follow_up, including the last budgeted iteration")
    void withinBudget() {
        assertThat(edge.apply(state(1, true)).join()).isEqualTo(EvaluationRoutingEdge.FOLLOW_UP);
        assertThat(edge.apply(state(3, true)).join()).isEqualTo(EvaluationRoutingEdge.FOLLOW_UP);
    }

    @Test
    @DisplayName("needs more past the budget goes to write")
    void budgetSpent() {
        assertThat(edge.apply(state(4, true)).join()).isEqualTo(EvaluationRoutingEdge.WRITE);
    }
}
