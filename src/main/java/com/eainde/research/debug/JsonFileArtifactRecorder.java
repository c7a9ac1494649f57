package com.eainde.research.debug;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Writes each artifact as a pretty-printed JSON file into a debug directory.
 * <p>
 * File names are {@code <timestamp>_<seq>_<kind>.json}; the sequence keeps artifacts of
 * the same millisecond in write order. The run id from the MDC, when present, is
 * stored inside every file.
 * <p>
 * Write failures are logged at WARN and otherwise ignored: debug output must never
 * break a run.
 */
public class JsonFileArtifactRecorder implements ArtifactRecorder {

    private static final Logger log = LoggerFactory.getLogger(JsonFileArtifactRecorder.class);
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");

    private final Path directory;
    private final ObjectMapper objectMapper;
    private final AtomicInteger sequence = new AtomicInteger();

    public JsonFileArtifactRecorder(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
    }

    @Override
    public void record(String kind, Object payload) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("kind", kind);
        document.put("run_id", MDC.get("runId"));
        document.put("timestamp", Instant.now().toString());
        document.put("payload", payload);
        write(kind, document);
    }

    @Override
    public void recordFailure(String context, Throwable error) {
        StringWriter stackTrace = new StringWriter();
        error.printStackTrace(new PrintWriter(stackTrace));

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("context", context);
        document.put("run_id", MDC.get("runId"));
        document.put("timestamp", Instant.now().toString());
        document.put("error_type", error.getClass().getName());
        document.put("error_message", error.getMessage());
        document.put("stack_trace", stackTrace.toString());
        write("error_" + context, document);
    }

    private void write(String kind, Map<String, Object> document) {
        String fileName = LocalDateTime.now().format(TIMESTAMP)
                + "_" + String.format("%03d", sequence.incrementAndGet())
                + "_" + kind + ".json";
        Path target = directory.resolve(fileName);
        try {
            Files.createDirectories(directory);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), document);
            log.debug("Debug artifact written: {}", target);
        } catch (IOException e) {
            log.warn("Failed to write debug artifact {}", target, e);
        }
    }
}
