package com.eainde.research.stage;

import com.eainde.research.capability.GenerationCapability;
import com.eainde.research.capability.ResearchAgents;
import com.eainde.research.model.SearchPlan;
import com.eainde.research.progress.ProgressKeys;
import com.eainde.research.progress.ProgressSink;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns the research query into a {@link SearchPlan} with one generation call.
 * Generation errors propagate as-is; retrying is the capability's concern.
 */
@Slf4j
public class Planner {

    private final GenerationCapability generation;
    private final ProgressSink progress;

    public Planner(GenerationCapability generation, ProgressSink progress) {
        this.generation = generation;
        this.progress = progress;
    }

    public SearchPlan plan(String query) {
        progress.update(ProgressKeys.PLANNING, "Planning comprehensive research strategy...");

        SearchPlan plan = generation.generate(ResearchAgents.PLANNER, "Query: " + query);

        log.info("Planned {} searches across {} topics", plan.items().size(), plan.mainTopics().size());
        progress.complete(ProgressKeys.PLANNING, "Research plan created with " + plan.items().size()
                + " searches across " + plan.mainTopics().size() + " main topics");
        return plan;
    }
}
