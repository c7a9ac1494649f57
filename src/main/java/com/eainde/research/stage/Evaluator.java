package com.eainde.research.stage;

import com.eainde.research.capability.GenerationCapability;
import com.eainde.research.capability.ResearchAgents;
import com.eainde.research.model.Evaluation;
import com.eainde.research.progress.ProgressKeys;
import com.eainde.research.progress.ProgressSink;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Scores the accumulated results and identifies gaps, one generation call per
 * iteration.
 *
 * <p>Results are numbered by their position at call time, so the same result may carry
 * a different number in a later iteration.</p>
 */
@Slf4j
public class Evaluator {

    private final GenerationCapability generation;
    private final ProgressSink progress;

    public Evaluator(GenerationCapability generation, ProgressSink progress) {
        this.generation = generation;
        this.progress = progress;
    }

    /**
     * @param iteration     current iteration, starting at 1
     * @param maxIterations follow-up round cap; an iteration beyond it is the final evaluation
     */
    public Evaluation evaluate(String query, List<String> results, int iteration, int maxIterations) {
        String round = iteration > maxIterations
                ? "final evaluation"
                : "iteration " + iteration + "/" + maxIterations;
        progress.update(ProgressKeys.EVALUATION, "Evaluating research quality (" + round + ")...");

        Evaluation evaluation = generation.generate(ResearchAgents.EVALUATOR, buildInput(query, results));

        log.info("Evaluation ({}): quality={}, completeness={}, gaps={}, needsMore={}", round,
                evaluation.qualityScore(), evaluation.completenessScore(),
                evaluation.gaps().size(), evaluation.needsMore());
        progress.complete(ProgressKeys.EVALUATION, "Research evaluation complete: Quality score "
                + evaluation.qualityScore() + "/10, Completeness score " + evaluation.completenessScore()
                + "/10 (" + round + ")");
        return evaluation;
    }

    static String buildInput(String query, List<String> results) {
        StringBuilder sb = new StringBuilder();
        sb.append("Original Query: ").append(query).append("\n\nSearch Results:\n");
        for (int i = 0; i < results.size(); i++) {
            if (i > 0) {
                sb.append("\n\n");
            }
            sb.append("Search Result ").append(i + 1).append(": ").append(results.get(i));
        }
        return sb.toString();
    }
}
