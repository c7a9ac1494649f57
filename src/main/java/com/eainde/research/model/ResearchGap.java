package com.eainde.research.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * A gap the evaluator found in the collected results.
 *
 * @param topic            area that needs more information
 * @param reason           why the area needs more research
 * @param suggestedQueries searches that would close the gap, most useful first
 */
public record ResearchGap(
        @JsonProperty("topic")             String topic,
        @JsonProperty("reason")            String reason,
        @JsonProperty("suggested_queries") List<String> suggestedQueries
) implements Serializable {

    public ResearchGap {
        suggestedQueries = suggestedQueries != null ? List.copyOf(suggestedQueries) : List.of();
    }
}
