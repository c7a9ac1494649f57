package com.eainde.research.nodes;

import com.eainde.research.StageInstrumentation;
import com.eainde.research.debug.ArtifactRecorder;
import com.eainde.research.model.SearchPlan;
import com.eainde.research.stage.Planner;
import com.eainde.research.state.ResearchState;

import java.util.Map;

public class PlanningNode extends ResearchNode {

    private final Planner planner;
    private final StageInstrumentation instrumentation;
    private final ArtifactRecorder recorder;

    public PlanningNode(Planner planner, StageInstrumentation instrumentation, ArtifactRecorder recorder) {
        this.planner = planner;
        this.instrumentation = instrumentation;
        this.recorder = recorder;
    }

    @Override
    protected Map<String, Object> run(ResearchState state) {
        SearchPlan plan = instrumentation.call("plan", () -> planner.plan(state.getQuery()));
        recorder.record("search_plan", plan);
        return Map.of(ResearchState.PLAN, plan);
    }
}
