package com.eainde.research.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Output of the evaluator agent.
 *
 * <p>Scores range from 1 to 10. {@link #needsMore()} drives the refinement loop; the
 * scores are informational.</p>
 *
 * @param completenessScore how well the results cover every aspect of the query
 * @param qualityScore      quality and relevance of the gathered information
 * @param strengthAnalysis  strongest aspects of the research so far
 * @param gapAnalysis       overall view of what is missing
 * @param gaps              gaps to address with follow-up searches
 * @param needsMore         whether another search round is recommended before writing
 */
public record Evaluation(
        @JsonProperty("completeness_score")        int completenessScore,
        @JsonProperty("quality_score")             int qualityScore,
        @JsonProperty("strength_analysis")         String strengthAnalysis,
        @JsonProperty("gap_analysis")              String gapAnalysis,
        @JsonProperty("identified_gaps")           List<ResearchGap> gaps,
        @JsonProperty("needs_additional_research") boolean needsMore
) implements Serializable {

    public Evaluation {
        gaps = gaps != null ? List.copyOf(gaps) : List.of();
    }

    /**
     * Total number of follow-up searches this evaluation suggests.
     */
    public int suggestedQueryCount() {
        return gaps.stream().mapToInt(g -> g.suggestedQueries().size()).sum();
    }
}
