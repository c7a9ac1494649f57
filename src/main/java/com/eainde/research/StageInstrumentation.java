package com.eainde.research;

import lombok.extern.slf4j.Slf4j;

import java.util.function.Supplier;

/**
 * Uniform timing and failure logging around every stage of a run.
 */
@Slf4j
public class StageInstrumentation {

    /**
     * Runs {@code body} as the named stage.
     *
     * @throws StageFailedException wrapping whatever {@code body} threw
     */
    public <T> T call(String stage, Supplier<T> body) {
        log.info("Stage '{}' started", stage);
        long start = System.nanoTime();
        try {
            T result = body.get();
            log.info("Stage '{}' finished in {} ms", stage, elapsedMs(start));
            return result;
        } catch (RuntimeException e) {
            log.error("Stage '{}' failed after {} ms: {}", stage, elapsedMs(start), e.toString());
            throw new StageFailedException(stage, e);
        }
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
