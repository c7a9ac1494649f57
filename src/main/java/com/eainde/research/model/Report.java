package com.eainde.research.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Final artifact of a research run. Exactly one is produced per successful run.
 *
 * @param shortSummary 3-5 sentence executive summary
 * @param outline      structure of the report
 * @param fullReport   complete report in markdown
 * @param limitations  caveats and areas of uncertainty
 * @param followUps    questions for further research
 */
public record Report(
        @JsonProperty("short_summary")       String shortSummary,
        @JsonProperty("outline")             String outline,
        @JsonProperty("markdown_report")     String fullReport,
        @JsonProperty("limitations")         List<String> limitations,
        @JsonProperty("follow_up_questions") List<String> followUps
) implements Serializable {

    public Report {
        limitations = limitations != null ? List.copyOf(limitations) : List.of();
        followUps = followUps != null ? List.copyOf(followUps) : List.of();
    }
}
