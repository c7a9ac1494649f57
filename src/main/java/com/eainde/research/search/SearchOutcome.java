package com.eainde.research.search;

import com.eainde.research.model.SearchItem;

/**
 * Result of a single search task: either the summary text or the failure that
 * prevented it. Tasks return outcomes rather than throwing across the thread boundary.
 */
public record SearchOutcome(
        SearchItem item,
        String summary,
        String errorMessage,
        long durationMs
) {

    public static SearchOutcome success(SearchItem item, String summary, long durationMs) {
        return new SearchOutcome(item, summary, null, durationMs);
    }

    public static SearchOutcome failure(SearchItem item, String errorMessage, long durationMs) {
        return new SearchOutcome(item, null, errorMessage, durationMs);
    }

    public boolean isSuccess() {
        return errorMessage == null && summary != null;
    }
}
