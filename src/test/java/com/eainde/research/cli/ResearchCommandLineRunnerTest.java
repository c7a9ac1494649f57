package com.eainde.research.cli;

import com.eainde.research.ResearchOrchestrator;
import com.eainde.research.model.Report;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ResearchCommandLineRunnerTest {

    @Mock private ResearchOrchestrator orchestrator;

    private static final Report REPORT = new Report("summary", "outline", "# full",
            List.of("few sources", "old data"), List.of("why?"));

    @Test
    void queryFromArgs_shouldJoinNonOptionArguments() {
        assertThat(ResearchCommandLineRunner.queryFromArgs("--research.debug.enabled=true", "impact", "of", "AI"))
                .isEqualTo("impact of AI");
        assertThat(ResearchCommandLineRunner.queryFromArgs()).isEmpty();
    }

    @Test
    void render_shouldPrintEverySectionWithBullets() {
        String text = ResearchCommandLineRunner.render(REPORT);

        assertThat(text)
                .containsSubsequence("REPORT SUMMARY", "summary",
                        "REPORT OUTLINE", "outline",
                        "FULL REPORT", "# full",
                        "RESEARCH LIMITATIONS", "- few sources\n- old data",
                        "FOLLOW UP QUESTIONS", "- why?");
    }

    @Test
    void run_shouldResearchTheQueryFromArguments() throws Exception {
        when(orchestrator.run("impact of AI")).thenReturn(REPORT);

        new ResearchCommandLineRunner(orchestrator).run("impact", "of", "AI");

        verify(orchestrator).run("impact of AI");
    }
}
