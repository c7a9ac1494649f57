package com.eainde.research;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ResearchBotApplicationTest {

    @Test
    void translateArgs_shouldMapDebugFlagToDebugArtifacts() {
        assertThat(ResearchBotApplication.translateArgs(new String[]{"--debug", "what", "is", "X"}))
                .containsExactly("--research.debug.enabled=true", "what", "is", "X");
    }
}
