package com.eainde.research.workflow;

import com.eainde.research.edges.EvaluationRoutingEdge;
import com.eainde.research.nodes.EvaluationNode;
import com.eainde.research.nodes.FollowUpNode;
import com.eainde.research.nodes.PlanningNode;
import com.eainde.research.nodes.SearchNode;
import com.eainde.research.nodes.WritingNode;
import com.eainde.research.state.ResearchState;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;

import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;

/**
 * The research state machine as a LangGraph4j graph.
 *
 * <pre>
 *   START → plan → search → evaluate ──write──→ write → END
 *                              ↑   └─follow_up─→ follow_up
 *                              └──────────────────┘
 * </pre>
 */
public class ResearchWorkflowGraph {

    public static final String PLAN = "plan";
    public static final String SEARCH = "search";
    public static final String EVALUATE = "evaluate";
    public static final String FOLLOW_UP = "follow_up";
    public static final String WRITE = "write";

    private final PlanningNode planningNode;
    private final SearchNode searchNode;
    private final EvaluationNode evaluationNode;
    private final FollowUpNode followUpNode;
    private final WritingNode writingNode;
    private final EvaluationRoutingEdge routingEdge;

    public ResearchWorkflowGraph(PlanningNode planningNode,
                                 SearchNode searchNode,
                                 EvaluationNode evaluationNode,
                                 FollowUpNode followUpNode,
                                 WritingNode writingNode,
                                 EvaluationRoutingEdge routingEdge) {
        this.planningNode = planningNode;
        this.searchNode = searchNode;
        this.evaluationNode = evaluationNode;
        this.followUpNode = followUpNode;
        this.writingNode = writingNode;
        this.routingEdge = routingEdge;
    }

    /**
     * @param maxIterations follow-up round cap; sizes the graph's own step limit so a
     *                      capped run always reaches {@code write}
     */
    public CompiledGraph<ResearchState> build(int maxIterations) throws GraphStateException {
        StateGraph<ResearchState> workflow = new StateGraph<>(ResearchState::new);

        workflow.addNode(PLAN, planningNode);
        workflow.addNode(SEARCH, searchNode);
        workflow.addNode(EVALUATE, evaluationNode);
        workflow.addNode(FOLLOW_UP, followUpNode);
        workflow.addNode(WRITE, writingNode);

        workflow.addEdge(START, PLAN);
        workflow.addEdge(PLAN, SEARCH);
        workflow.addEdge(SEARCH, EVALUATE);

        workflow.addConditionalEdges(
                EVALUATE,
                routingEdge,
                Map.of(
                        EvaluationRoutingEdge.FOLLOW_UP, FOLLOW_UP,
                        EvaluationRoutingEdge.WRITE, WRITE
                )
        );

        workflow.addEdge(FOLLOW_UP, EVALUATE);
        workflow.addEdge(WRITE, END);

        CompiledGraph<ResearchState> compiled = workflow.compile();
        compiled.setMaxIterations(maxSteps(maxIterations));
        return compiled;
    }

    /**
     * plan + search + (maxIterations + 1) evaluations + maxIterations follow-ups + write,
     * with headroom.
     */
    static int maxSteps(int maxIterations) {
        return 2 * maxIterations + 4 + 5;
    }
}
