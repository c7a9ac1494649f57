package com.eainde.research.capability;

import com.eainde.research.model.Evaluation;
import com.eainde.research.model.Report;
import com.eainde.research.model.SearchPlan;

/**
 * The four agents of the research pipeline. Names double as prompt keys.
 *
 * <pre>
 *   research-planner   query           → SearchPlan
 *   research-searcher  search request  → summary text   (one call per search item)
 *   research-evaluator query + results → Evaluation     (once per iteration)
 *   research-writer    query + results → Report         (streaming)
 * </pre>
 */
public final class ResearchAgents {

    private ResearchAgents() {}

    public static final String PLANNER_NAME = "research-planner";
    public static final String SEARCHER_NAME = "research-searcher";
    public static final String EVALUATOR_NAME = "research-evaluator";
    public static final String WRITER_NAME = "research-writer";

    public static final AgentSpec<SearchPlan> PLANNER = AgentSpec
            .of(PLANNER_NAME, "Breaks a query into topics and prioritized searches", SearchPlan.class)
            .schema("schemas/search-plan.json")
            .build();

    public static final AgentSpec<String> SEARCHER = AgentSpec
            .of(SEARCHER_NAME, "Searches and summarizes results for one search term", String.class)
            .build();

    public static final AgentSpec<Evaluation> EVALUATOR = AgentSpec
            .of(EVALUATOR_NAME, "Scores the collected results and identifies gaps", Evaluation.class)
            .schema("schemas/evaluation.json")
            .build();

    public static final AgentSpec<Report> WRITER = AgentSpec
            .of(WRITER_NAME, "Synthesizes the final research report", Report.class)
            .schema("schemas/report.json")
            .streaming(true)
            .build();
}
