package com.eainde.research;

import com.eainde.research.debug.ArtifactRecorder;
import com.eainde.research.model.Report;
import com.eainde.research.progress.ProgressKeys;
import com.eainde.research.progress.ProgressSink;
import com.eainde.research.state.ResearchState;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * Entry point of the research engine: runs one query through plan, search, the
 * refinement loop and report writing, and returns the report.
 *
 * <p>The whole run sits behind a single failure boundary. Any stage failure is posted
 * once to the progress sink as {@code error} and then rethrown unchanged (checked causes
 * wrapped in {@link ResearchException}). Nothing is retried here.</p>
 *
 * <p>Runs share no state, but the progress sink is shared, so concurrent runs on one
 * instance would interleave their progress lines.</p>
 */
@Slf4j
public class ResearchOrchestrator {

    public static final String MDC_RUN_ID = "runId";

    private final CompiledGraph<ResearchState> workflow;
    private final ProgressSink progress;
    private final ArtifactRecorder recorder;
    private final int maxIterations;

    public ResearchOrchestrator(CompiledGraph<ResearchState> workflow,
                                ProgressSink progress,
                                ArtifactRecorder recorder,
                                int maxIterations) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1: " + maxIterations);
        }
        this.workflow = workflow;
        this.progress = progress;
        this.recorder = recorder;
        this.maxIterations = maxIterations;
    }

    public Report run(String query) {
        return execute(query).getReport()
                .orElseThrow(() -> new ResearchException("Research run finished without a report"));
    }

    /**
     * Same as {@link #run(String)} but returns the final graph state, which also carries
     * the collected results and the number of follow-up rounds.
     */
    public ResearchState execute(String query) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }

        String runId = UUID.randomUUID().toString();
        MDC.put(MDC_RUN_ID, runId);
        try {
            progress.upsert(ProgressKeys.TRACE_ID, "Trace ID: " + runId, true, true);
            progress.upsert(ProgressKeys.STARTING, "Starting research...", true, true);
            log.info("Research run started for query: {}", query);

            RunnableConfig config = RunnableConfig.builder()
                    .threadId(runId)
                    .build();
            ResearchState finalState = workflow.invoke(ResearchState.initial(query, runId, maxIterations), config)
                    .orElseThrow(() -> new ResearchException("Research workflow produced no final state"));
            Report report = finalState.getReport()
                    .orElseThrow(() -> new ResearchException("Research workflow ended without a report"));

            progress.complete(ProgressKeys.FINAL_REPORT, "Report summary\n\n" + report.shortSummary());
            log.info("Research run {} finished: {} results, {} follow-up rounds", finalState.getRunId(),
                    finalState.getAllResults().size(), finalState.getFollowUpRounds());
            return finalState;
        } catch (RuntimeException e) {
            RuntimeException failure = originalFailure(e);
            log.error("Research run failed", failure);
            progress.complete(ProgressKeys.ERROR, "Error occurred during research: " + describe(failure));
            recorder.recordFailure("research_run", failure);
            throw failure;
        } finally {
            MDC.remove(MDC_RUN_ID);
        }
    }

    static String describe(Throwable failure) {
        return failure.getMessage() != null ? failure.getMessage() : failure.toString();
    }

    /**
     * Peels the workflow runtime's wrappers off a failure. A stage failure yields the
     * exception the stage itself threw.
     */
    static RuntimeException originalFailure(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof StageFailedException stageFailure) {
                return ResearchException.propagate(stageFailure.getCause());
            }
        }
        return ResearchException.propagate(error);
    }
}
