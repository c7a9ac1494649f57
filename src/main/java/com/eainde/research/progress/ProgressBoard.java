package com.eainde.research.progress;

import lombok.extern.slf4j.Slf4j;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory {@link ProgressSink} that keeps one line per key in first-insertion order
 * and optionally echoes every change to a console stream.
 */
@Slf4j
public class ProgressBoard implements ProgressSink {

    private final Map<String, ProgressItem> items = new LinkedHashMap<>();
    private final PrintStream out;

    public ProgressBoard() {
        this(null);
    }

    /**
     * @param out console to render each change to, or {@code null} to stay silent
     */
    public ProgressBoard(PrintStream out) {
        this.out = out;
    }

    @Override
    public void upsert(String key, String message, boolean done, boolean hideIndicator) {
        ProgressItem item = new ProgressItem(key, message, done, hideIndicator);
        synchronized (items) {
            items.put(key, item);
        }
        render(item);
    }

    @Override
    public void markDone(String key) {
        ProgressItem item;
        synchronized (items) {
            ProgressItem current = items.get(key);
            if (current == null) {
                log.debug("markDone for unknown progress key '{}'", key);
                return;
            }
            item = current.withDone();
            items.put(key, item);
        }
        render(item);
    }

    public Optional<ProgressItem> get(String key) {
        synchronized (items) {
            return Optional.ofNullable(items.get(key));
        }
    }

    /**
     * Copy of every line in insertion order.
     */
    public List<ProgressItem> snapshot() {
        synchronized (items) {
            return new ArrayList<>(items.values());
        }
    }

    private void render(ProgressItem item) {
        if (out == null) {
            return;
        }
        synchronized (out) {
            out.println(item.render());
        }
    }
}
