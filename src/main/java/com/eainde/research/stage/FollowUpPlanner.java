package com.eainde.research.stage;

import com.eainde.research.model.Evaluation;
import com.eainde.research.model.ResearchGap;
import com.eainde.research.model.SearchItem;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives the follow-up search batch from the gaps of an evaluation.
 *
 * <p>Each suggested query becomes one item. Priority is the query's 1-based position
 * within its own gap, so it restarts at 1 for every gap.</p>
 */
public final class FollowUpPlanner {

    private FollowUpPlanner() {}

    public static List<SearchItem> derive(Evaluation evaluation) {
        List<SearchItem> items = new ArrayList<>(evaluation.suggestedQueryCount());
        for (ResearchGap gap : evaluation.gaps()) {
            String reason = "To address gap: " + gap.topic() + ". " + gap.reason();
            List<String> queries = gap.suggestedQueries();
            for (int i = 0; i < queries.size(); i++) {
                items.add(new SearchItem(queries.get(i), reason, i + 1));
            }
        }
        return List.copyOf(items);
    }
}
