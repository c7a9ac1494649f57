package com.eainde.research.debug;

import com.eainde.research.model.SearchItem;
import com.eainde.research.model.SearchPlan;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.MDC;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class JsonFileArtifactRecorderTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    private List<Path> files(Path dir) throws IOException {
        try (Stream<Path> listing = Files.list(dir)) {
            return listing.sorted().toList();
        }
    }

    @Test
    void record_shouldWriteTimestampedJsonWithSnakeCasePayload() throws IOException {
        Path dir = tempDir.resolve("debug_logs");
        JsonFileArtifactRecorder recorder = new JsonFileArtifactRecorder(dir, mapper);
        MDC.put("runId", "run-1");

        recorder.record("search_plan", new SearchPlan(List.of("topic"), List.of(new SearchItem("q", "r", 1))));

        List<Path> written = files(dir);
        assertThat(written).singleElement()
                .satisfies(p -> assertThat(p.getFileName().toString()).matches("\\d{8}_\\d{6}_\\d{3}_001_search_plan\\.json"));
        JsonNode json = mapper.readTree(written.get(0).toFile());
        assertThat(json.path("kind").asText()).isEqualTo("search_plan");
        assertThat(json.path("run_id").asText()).isEqualTo("run-1");
        assertThat(json.path("payload").path("main_topics").get(0).asText()).isEqualTo("topic");
        assertThat(json.path("payload").path("searches").get(0).path("query").asText()).isEqualTo("q");
    }

    @Test
    void recordFailure_shouldCaptureTypeMessageAndStackTrace() throws IOException {
        JsonFileArtifactRecorder recorder = new JsonFileArtifactRecorder(tempDir, mapper);

        recorder.recordFailure("research_run", new IllegalStateException("planner down"));

        JsonNode json = mapper.readTree(files(tempDir).get(0).toFile());
        assertThat(json.path("context").asText()).isEqualTo("research_run");
        assertThat(json.path("error_type").asText()).isEqualTo("java.lang.IllegalStateException");
        assertThat(json.path("error_message").asText()).isEqualTo("planner down");
        assertThat(json.path("stack_trace").asText()).contains("JsonFileArtifactRecorderTest");
    }

    @Test
    void record_shouldKeepWriteOrderInFileNames() throws IOException {
        JsonFileArtifactRecorder recorder = new JsonFileArtifactRecorder(tempDir, mapper);

        recorder.record("evaluation_iteration_1", "a");
        recorder.record("evaluation_iteration_2", "b");

        assertThat(files(tempDir)).extracting(p -> p.getFileName().toString())
                .anySatisfy(name -> assertThat(name).contains("_001_evaluation_iteration_1"))
                .anySatisfy(name -> assertThat(name).contains("_002_evaluation_iteration_2"));
    }

    @Test
    void record_shouldNotThrowWhenDirectoryCannotBeCreated() throws IOException {
        Path blocker = Files.writeString(tempDir.resolve("not-a-dir"), "x");
        JsonFileArtifactRecorder recorder = new JsonFileArtifactRecorder(blocker.resolve("sub"), mapper);

        assertThatCode(() -> recorder.record("final_report", "payload")).doesNotThrowAnyException();
    }
}
