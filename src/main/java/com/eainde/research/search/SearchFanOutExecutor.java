package com.eainde.research.search;

import com.eainde.research.ResearchException;
import com.eainde.research.capability.SearchCapability;
import com.eainde.research.model.SearchItem;
import com.eainde.research.progress.ProgressSink;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorCompletionService;

/**
 * Runs one batch of search items concurrently against the {@link SearchCapability}.
 *
 * <p>Every item is submitted at once. Results are collected in completion order and a
 * failed item is dropped from the returned list without affecting its siblings. The
 * progress line under the given key shows {@code k/n completed} after each settled
 * task and is marked done once the batch is finished.</p>
 */
@Slf4j
public class SearchFanOutExecutor {

    private static final Comparator<SearchItem> BY_PRIORITY = Comparator.comparingInt(SearchItem::priority);

    private final SearchCapability searchCapability;
    private final Executor executor;
    private final ProgressSink progress;

    public SearchFanOutExecutor(SearchCapability searchCapability, Executor executor, ProgressSink progress) {
        this.searchCapability = searchCapability;
        this.executor = executor;
        this.progress = progress;
    }

    /**
     * @param items       batch to run; consumed entirely by this call
     * @param progressKey progress line to update, e.g. {@code searching}
     * @param label       message prefix, e.g. {@code Searching...}
     * @return summaries of the successful searches, in completion order
     */
    public List<String> executeAll(List<SearchItem> items, String progressKey, String label) {
        int total = items.size();
        if (total == 0) {
            progress.complete(progressKey, label + " 0/0 completed");
            return List.of();
        }

        // List.sort is stable, so equal priorities keep their planned order
        List<SearchItem> ordered = new ArrayList<>(items);
        ordered.sort(BY_PRIORITY);
        log.info("Launching {} searches: {}", total,
                ordered.stream().map(i -> "[" + i.priority() + "] " + i.query()).toList());

        progress.update(progressKey, label);
        CompletionService<SearchOutcome> completion = new ExecutorCompletionService<>(executor);
        for (SearchItem item : ordered) {
            completion.submit(() -> runOne(item));
        }

        List<String> results = new ArrayList<>(total);
        int failed = 0;
        for (int completed = 1; completed <= total; completed++) {
            SearchOutcome outcome = take(completion);
            if (outcome.isSuccess()) {
                results.add(outcome.summary());
            } else {
                failed++;
                log.debug("Dropped search [{}] {} ({} ms): {}", outcome.item().priority(), outcome.item().query(),
                        outcome.durationMs(), outcome.errorMessage());
            }
            progress.update(progressKey, label + " " + completed + "/" + total + " completed");
        }

        progress.markDone(progressKey);
        log.info("Search batch finished: {} succeeded, {} failed", results.size(), failed);
        return results;
    }

    private SearchOutcome runOne(SearchItem item) {
        long start = System.nanoTime();
        try {
            String summary = searchCapability.search(item.toSearchInput());
            long elapsed = elapsedMs(start);
            if (summary == null || summary.isBlank()) {
                log.warn("Search '{}' returned an empty summary after {} ms, dropping it", item.query(), elapsed);
                return SearchOutcome.failure(item, "empty summary", elapsed);
            }
            log.debug("Search '{}' completed in {} ms", item.query(), elapsed);
            return SearchOutcome.success(item, summary, elapsed);
        } catch (Exception e) {
            long elapsed = elapsedMs(start);
            log.warn("Search '{}' failed after {} ms, dropping it: {}", item.query(), elapsed, e.getMessage());
            return SearchOutcome.failure(item, e.getClass().getSimpleName() + ": " + e.getMessage(), elapsed);
        }
    }

    private static SearchOutcome take(CompletionService<SearchOutcome> completion) {
        try {
            return completion.take().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ResearchException("Interrupted while waiting for search results", e);
        } catch (ExecutionException e) {
            // runOne never throws; only an Error thrown inside the task lands here
            throw ResearchException.propagate(e);
        }
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
