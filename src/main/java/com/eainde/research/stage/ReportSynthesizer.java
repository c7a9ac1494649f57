package com.eainde.research.stage;

import com.eainde.research.capability.GenerationCapability;
import com.eainde.research.capability.GenerationStream;
import com.eainde.research.capability.ResearchAgents;
import com.eainde.research.model.Report;
import com.eainde.research.progress.ProgressKeys;
import com.eainde.research.progress.ProgressSink;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Writes the final report with a single streaming generation call.
 *
 * <p>While the call is open a ticker posts the next phase label every narration
 * interval until the labels run out. The labels are cosmetic only. An error on the
 * event stream is logged and the final output is still awaited; only a failure of the
 * output itself propagates.</p>
 */
@Slf4j
public class ReportSynthesizer {

    static final String INITIAL_LABEL = "Thinking about report...";

    static final List<String> PHASE_LABELS = List.of(
            "Thinking about report...",
            "Planning report structure...",
            "Creating detailed outline...",
            "Synthesizing research findings...",
            "Writing main sections...",
            "Adding supporting evidence...",
            "Refining arguments and conclusions...",
            "Finalizing report...");

    private final GenerationCapability generation;
    private final ProgressSink progress;
    private final Duration narrationInterval;

    public ReportSynthesizer(GenerationCapability generation, ProgressSink progress, Duration narrationInterval) {
        if (narrationInterval.isNegative() || narrationInterval.isZero()) {
            throw new IllegalArgumentException("narrationInterval must be positive: " + narrationInterval);
        }
        this.generation = generation;
        this.progress = progress;
        this.narrationInterval = narrationInterval;
    }

    public Report write(String query, List<String> results) {
        String input = "Original query: " + query + "\nSummarized search results: " + results;

        progress.update(ProgressKeys.WRITING, INITIAL_LABEL);
        Narration narration = new Narration(progress);
        ScheduledExecutorService ticker = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "report-narration");
            thread.setDaemon(true);
            return thread;
        });
        long intervalMs = narrationInterval.toMillis();
        ticker.scheduleAtFixedRate(narration, intervalMs, intervalMs, TimeUnit.MILLISECONDS);

        Report report;
        try {
            GenerationStream<Report> stream = generation.generateStreaming(ResearchAgents.WRITER, input);
            try {
                stream.awaitEvents();
            } catch (RuntimeException e) {
                log.error("Report stream failed after {} events, waiting for final output", stream.eventCount(), e);
            }
            report = stream.output();
        } finally {
            narration.stop();
            ticker.shutdownNow();
        }

        progress.markDone(ProgressKeys.WRITING);
        log.info("Report written: {} limitations, {} follow-up questions",
                report.limitations().size(), report.followUps().size());
        return report;
    }

    /** Posts one label per tick until the labels run out or the stream closes. */
    private static final class Narration implements Runnable {

        private final ProgressSink progress;
        private final Iterator<String> labels = PHASE_LABELS.iterator();
        private boolean stopped;

        Narration(ProgressSink progress) {
            this.progress = progress;
        }

        @Override
        public synchronized void run() {
            if (!stopped && labels.hasNext()) {
                progress.update(ProgressKeys.WRITING, labels.next());
            }
        }

        synchronized void stop() {
            stopped = true;
        }
    }
}
