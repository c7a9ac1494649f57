package com.eainde.research.progress;

/**
 * Keyed status board observed while a research run is in flight.
 *
 * <p>A sink is purely an observer: implementations must never throw into the engine and
 * must accept calls from several threads at once (the search fan-out reports from
 * worker threads).</p>
 */
public interface ProgressSink {

    /**
     * Creates or replaces the line for {@code key}.
     *
     * @param key           short stable key, see {@link ProgressKeys}
     * @param message       human readable status
     * @param done          whether the work item is finished
     * @param hideIndicator suppress the done/pending indicator when rendering
     */
    void upsert(String key, String message, boolean done, boolean hideIndicator);

    /**
     * Marks an existing line as done, keeping its last message.
     */
    void markDone(String key);

    default void update(String key, String message) {
        upsert(key, message, false, false);
    }

    default void complete(String key, String message) {
        upsert(key, message, true, false);
    }

    /** Sink that ignores every update. */
    static ProgressSink noop() {
        return new ProgressSink() {
            @Override
            public void upsert(String key, String message, boolean done, boolean hideIndicator) {
            }

            @Override
            public void markDone(String key) {
            }
        };
    }
}
