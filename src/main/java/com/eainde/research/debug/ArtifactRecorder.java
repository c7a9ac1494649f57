package com.eainde.research.debug;

/**
 * Receives the intermediate artifacts of a run for offline inspection.
 * Implementations must not throw.
 */
public interface ArtifactRecorder {

    void record(String kind, Object payload);

    void recordFailure(String context, Throwable error);

    static ArtifactRecorder noop() {
        return new ArtifactRecorder() {
            @Override
            public void record(String kind, Object payload) {
            }

            @Override
            public void recordFailure(String context, Throwable error) {
            }
        };
    }
}
