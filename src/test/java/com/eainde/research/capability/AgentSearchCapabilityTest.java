package com.eainde.research.capability;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AgentSearchCapabilityTest {

    @Mock private SearchAgent agent;

    @Test
    void search_shouldDelegateRequestToAgent() {
        when(agent.search("Search term: x")).thenReturn("summary of x");

        assertThat(new AgentSearchCapability(agent).search("Search term: x")).isEqualTo("summary of x");
    }

    @Test
    void search_shouldLetAgentErrorsThrough() {
        when(agent.search("Search term: x")).thenThrow(new IllegalStateException("tool failure"));

        assertThatThrownBy(() -> new AgentSearchCapability(agent).search("Search term: x"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("tool failure");
    }
}
