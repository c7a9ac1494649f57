package com.eainde.research.capability;

import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.rag.content.Content;
import dev.langchain4j.rag.content.retriever.ContentRetriever;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class VectorSearchToolTest {

    private static Content judgment(int n) {
        return Content.from(TextSegment.from("holding " + n,
                Metadata.from(Map.of("title", "Case " + n, "date", "2024-01-0" + n))));
    }

    @Test
    @DisplayName("formats matches as Title/Date/Summary blocks")
    void formatsMatches() {
        ContentRetriever retriever = query -> List.of(judgment(1), judgment(2));

        String result = new VectorSearchTool(retriever).vectorSearch("contract law", 5);

        assertThat(result).isEqualTo("Title: Case 1\nDate: 2024-01-01\nSummary: holding 1"
                + "\n\nTitle: Case 2\nDate: 2024-01-02\nSummary: holding 2");
    }

    @Test
    @DisplayName("limits to the requested count and defaults to 5")
    void limitsMatches() {
        ContentRetriever retriever = query -> IntStream.rangeClosed(1, 8).mapToObj(VectorSearchToolTest::judgment).toList();
        VectorSearchTool tool = new VectorSearchTool(retriever);

        assertThat(tool.vectorSearch("q", 2).split("Title: ", -1)).hasSize(3);
        assertThat(tool.vectorSearch("q", 0).split("Title: ", -1)).hasSize(VectorSearchTool.DEFAULT_MATCH_COUNT + 1);
    }

    @Test
    @DisplayName("missing metadata is shown as Unknown")
    void missingMetadata() {
        ContentRetriever retriever = query -> List.of(Content.from(TextSegment.from("text only")));

        assertThat(new VectorSearchTool(retriever).vectorSearch("q", 5))
                .isEqualTo("Title: Unknown\nDate: Unknown\nSummary: text only");
    }

    @Test
    @DisplayName("store errors are reported back to the model as text")
    void storeError() {
        ContentRetriever retriever = query -> {
            throw new IllegalStateException("connection refused");
        };

        assertThat(new VectorSearchTool(retriever).vectorSearch("q", 5))
                .isEqualTo("Error searching vector store: connection refused");
    }

    @Test
    @DisplayName("no matches says so")
    void noMatches() {
        assertThat(new VectorSearchTool(query -> List.of()).vectorSearch("q", 5))
                .isEqualTo("No matching documents found.");
    }
}
