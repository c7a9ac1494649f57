package com.eainde.research.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * A single search the engine should run.
 *
 * @param query    the search term
 * @param reason   why this search matters to the research query
 * @param priority 1 is the most important; advisory only, used to order logging
 */
public record SearchItem(
        @JsonProperty("query")    String query,
        @JsonProperty("reason")   String reason,
        @JsonProperty("priority") int priority
) implements Serializable {

    /**
     * Text handed to the search capability for this item.
     */
    public String toSearchInput() {
        return "Search term: " + query
                + "\nReason for searching: " + reason
                + "\nPriority: " + priority;
    }
}
