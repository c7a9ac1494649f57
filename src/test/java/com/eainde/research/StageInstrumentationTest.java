package com.eainde.research;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StageInstrumentationTest {

    private final StageInstrumentation instrumentation = new StageInstrumentation();

    @Test
    void call_shouldReturnTheStageResult() {
        assertThat(instrumentation.call("plan", () -> 42)).isEqualTo(42);
    }

    @Test
    void call_shouldTagFailuresWithTheStageAndKeepTheCause() {
        IllegalStateException failure = new IllegalStateException("boom");

        assertThatThrownBy(() -> instrumentation.call("evaluate", () -> {
            throw failure;
        }))
                .isInstanceOfSatisfying(StageFailedException.class, e -> assertThat(e.getStage()).isEqualTo("evaluate"))
                .hasCause(failure);
    }
}
