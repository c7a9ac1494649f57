package com.eainde.research.stage;

import com.eainde.research.capability.AgentSpec;
import com.eainde.research.capability.CompletableGenerationStream;
import com.eainde.research.capability.GenerationCapability;
import com.eainde.research.capability.GenerationStream;
import com.eainde.research.capability.ResearchAgents;
import com.eainde.research.model.Report;
import com.eainde.research.progress.RecordingProgressSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReportSynthesizerTest {

    private static final Report REPORT = new Report("Short summary", "1. Intro", "# Report",
            List.of("small sample"), List.of("What next?"));

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    /**
     * Streaming-only generation whose stream is driven by {@code script} after
     * {@code delayMs}.
     */
    private GenerationCapability streaming(long delayMs, Consumer<CompletableGenerationStream<Report>> script) {
        return new GenerationCapability() {
            @Override
            public <T> T generate(AgentSpec<T> spec, String input) {
                throw new UnsupportedOperationException();
            }

            @Override
            @SuppressWarnings("unchecked")
            public <T> GenerationStream<T> generateStreaming(AgentSpec<T> spec, String input) {
                assertThat(spec).isSameAs(ResearchAgents.WRITER);
                assertThat(input).startsWith("Original query: q\nSummarized search results: ");
                CompletableGenerationStream<Report> stream = new CompletableGenerationStream<>();
                scheduler.schedule(() -> script.accept(stream), delayMs, TimeUnit.MILLISECONDS);
                return (GenerationStream<T>) stream;
            }
        };
    }

    @Nested
    @DisplayName("narration")
    class Narration {

        @Test
        @DisplayName("posts phase labels in order while the stream is open")
        void labelsInOrder() {
            RecordingProgressSink progress = new RecordingProgressSink();
            ReportSynthesizer synthesizer = new ReportSynthesizer(
                    streaming(350, stream -> stream.complete(REPORT)), progress, Duration.ofMillis(100));

            Report report = synthesizer.write("q", List.of("a", "b"));

            assertThat(report).isEqualTo(REPORT);
            List<String> messages = progress.messages("writing");
            assertThat(messages).first().isEqualTo(ReportSynthesizer.INITIAL_LABEL);
            List<String> labels = messages.subList(1, messages.size());
            assertThat(labels).hasSizeBetween(1, ReportSynthesizer.PHASE_LABELS.size());
            assertThat(labels).isEqualTo(ReportSynthesizer.PHASE_LABELS.subList(0, labels.size()));
            assertThat(progress.last("writing").done()).isTrue();
        }

        @Test
        @DisplayName("ticks walk all eight labels after the initial message, and no further")
        void boundedByLabelCount() {
            RecordingProgressSink progress = new RecordingProgressSink();
            ReportSynthesizer synthesizer = new ReportSynthesizer(
                    streaming(400, stream -> stream.complete(REPORT)), progress, Duration.ofMillis(10));

            synthesizer.write("q", List.of());

            List<String> messages = progress.messages("writing");
            assertThat(messages).hasSize(1 + ReportSynthesizer.PHASE_LABELS.size());
            assertThat(messages.get(0)).isEqualTo(ReportSynthesizer.INITIAL_LABEL);
            assertThat(messages.subList(1, messages.size())).isEqualTo(ReportSynthesizer.PHASE_LABELS);
        }

        @Test
        @DisplayName("no label is posted after the writing line is marked done")
        void silentAfterDone() throws InterruptedException {
            RecordingProgressSink progress = new RecordingProgressSink();
            ReportSynthesizer synthesizer = new ReportSynthesizer(
                    streaming(0, stream -> stream.complete(REPORT)), progress, Duration.ofMillis(20));

            synthesizer.write("q", List.of());
            Thread.sleep(100);

            assertThat(progress.last("writing").done()).isTrue();
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("a failure on the event stream is logged and the final output still returned")
        void eventFailureTolerated() {
            RecordingProgressSink progress = new RecordingProgressSink();
            ReportSynthesizer synthesizer = new ReportSynthesizer(streaming(50, stream -> {
                stream.onEvent();
                stream.failEvents(new IllegalStateException("connection reset"));
                stream.complete(REPORT);
            }), progress, Duration.ofSeconds(5));

            assertThat(synthesizer.write("q", List.of("a"))).isEqualTo(REPORT);
        }

        @Test
        @DisplayName("a fatal generation failure propagates")
        void fatalFailurePropagates() {
            RecordingProgressSink progress = new RecordingProgressSink();
            ReportSynthesizer synthesizer = new ReportSynthesizer(streaming(50, stream -> {
                IllegalStateException failure = new IllegalStateException("model crashed");
                stream.failEvents(failure);
                stream.fail(failure);
            }), progress, Duration.ofSeconds(5));

            assertThatThrownBy(() -> synthesizer.write("q", List.of("a")))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("model crashed");
            assertThat(progress.last("writing").done()).isFalse();
        }

        @Test
        @DisplayName("rejects a non-positive narration interval")
        void rejectsZeroInterval() {
            assertThatThrownBy(() -> new ReportSynthesizer(streaming(0, s -> {}), new RecordingProgressSink(), Duration.ZERO))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
