package com.eainde.research.state;

import com.eainde.research.model.Evaluation;
import com.eainde.research.model.Report;
import com.eainde.research.model.SearchPlan;
import org.bsc.langgraph4j.state.AgentState;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Graph state of one research run.
 *
 * <p>Every key uses last-value-wins semantics. {@link #ALL_RESULTS} is only ever
 * written through {@link #appendResults(List)}, which returns the previous list plus
 * the new results, so it never shrinks.</p>
 */
public class ResearchState extends AgentState {

    public static final String QUERY = "query";
    public static final String RUN_ID = "runId";
    public static final String ITERATION = "iteration";
    public static final String MAX_ITERATIONS = "maxIterations";
    public static final String ALL_RESULTS = "allResults";
    public static final String FOLLOW_UP_ROUNDS = "followUpRounds";
    public static final String PLAN = "plan";
    public static final String EVALUATION = "evaluation";
    public static final String REPORT = "report";

    public ResearchState(Map<String, Object> initData) {
        super(initData);
    }

    public static Map<String, Object> initial(String query, String runId, int maxIterations) {
        Map<String, Object> init = new HashMap<>();
        init.put(QUERY, query);
        init.put(RUN_ID, runId);
        init.put(ITERATION, 1);
        init.put(MAX_ITERATIONS, maxIterations);
        init.put(ALL_RESULTS, List.<String>of());
        init.put(FOLLOW_UP_ROUNDS, 0);
        return init;
    }

    public String getQuery() { return this.<String>value(QUERY).orElseThrow(); }
    public String getRunId() { return this.<String>value(RUN_ID).orElse(""); }
    public int getIteration() { return this.<Integer>value(ITERATION).orElse(1); }
    public int getMaxIterations() { return this.<Integer>value(MAX_ITERATIONS).orElse(3); }
    public int getFollowUpRounds() { return this.<Integer>value(FOLLOW_UP_ROUNDS).orElse(0); }
    public List<String> getAllResults() { return this.<List<String>>value(ALL_RESULTS).orElse(List.of()); }
    public Optional<SearchPlan> getPlan() { return value(PLAN); }
    public Optional<Evaluation> getEvaluation() { return value(EVALUATION); }
    public Optional<Report> getReport() { return value(REPORT); }

    /**
     * True once the follow-up round budget is spent; the evaluation at this point is the
     * last one.
     */
    public boolean isCapReached() {
        return getIteration() > getMaxIterations();
    }

    /**
     * Update for {@link #ALL_RESULTS}: the current results followed by {@code newResults}.
     */
    public Map<String, Object> appendResults(List<String> newResults) {
        List<String> merged = new ArrayList<>(getAllResults());
        merged.addAll(newResults);
        return Map.of(ALL_RESULTS, List.copyOf(merged));
    }
}
