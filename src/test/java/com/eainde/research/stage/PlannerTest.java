package com.eainde.research.stage;

import com.eainde.research.capability.GenerationCapability;
import com.eainde.research.capability.ResearchAgents;
import com.eainde.research.model.SearchItem;
import com.eainde.research.model.SearchPlan;
import com.eainde.research.progress.ProgressBoard;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PlannerTest {

    @Mock private GenerationCapability generation;

    @Test
    @DisplayName("one generation call; progress done with item and topic counts")
    void plansOnce() {
        SearchPlan plan = new SearchPlan(List.of("history", "economics"), List.of(
                new SearchItem("a", "r", 1),
                new SearchItem("b", "r", 2),
                new SearchItem("c", "r", 1)));
        when(generation.generate(ResearchAgents.PLANNER, "Query: What is X?")).thenReturn(plan);
        ProgressBoard board = new ProgressBoard();

        SearchPlan result = new Planner(generation, board).plan("What is X?");

        assertThat(result).isSameAs(plan);
        verify(generation, times(1)).generate(ResearchAgents.PLANNER, "Query: What is X?");
        assertThat(board.get("planning")).hasValueSatisfying(item -> {
            assertThat(item.done()).isTrue();
            assertThat(item.message()).isEqualTo("Research plan created with 3 searches across 2 main topics");
        });
    }

    @Test
    @DisplayName("generation errors propagate unmodified")
    void errorsPropagate() {
        IllegalStateException failure = new IllegalStateException("quota exceeded");
        when(generation.generate(ResearchAgents.PLANNER, "Query: q")).thenThrow(failure);

        assertThatThrownBy(() -> new Planner(generation, new ProgressBoard()).plan("q")).isSameAs(failure);
    }
}
