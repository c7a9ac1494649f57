package com.eainde.research.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Output of the planner agent.
 *
 * <p>The planner is asked for 8 to 20 searches but nothing downstream relies on that range.</p>
 *
 * @param mainTopics subtopics of the query that need coverage
 * @param items      searches to run in the first round
 */
public record SearchPlan(
        @JsonProperty("main_topics") List<String> mainTopics,
        @JsonProperty("searches")    List<SearchItem> items
) implements Serializable {

    public SearchPlan {
        mainTopics = mainTopics != null ? List.copyOf(mainTopics) : List.of();
        items = items != null ? List.copyOf(items) : List.of();
    }
}
