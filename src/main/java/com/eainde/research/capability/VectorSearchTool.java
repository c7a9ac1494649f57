package com.eainde.research.capability;

import dev.langchain4j.agent.tool.P;
import dev.langchain4j.agent.tool.Tool;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.rag.content.Content;
import dev.langchain4j.rag.content.retriever.ContentRetriever;
import dev.langchain4j.rag.query.Query;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.stream.Collectors;

/**
 * {@code vector_search} tool exposed to the search agent: looks the query up in the
 * document store and returns the best matches as Title/Date/Summary blocks.
 */
@Slf4j
public class VectorSearchTool {

    static final int DEFAULT_MATCH_COUNT = 5;

    private final ContentRetriever retriever;

    public VectorSearchTool(ContentRetriever retriever) {
        this.retriever = retriever;
    }

    @Tool(name = "vector_search", value = "Searches the internal document store for content similar to the query")
    public String vectorSearch(@P("the text to search for") String query,
                               @P("maximum number of matches to return, 5 if unsure") int matchCount) {
        int limit = matchCount > 0 ? matchCount : DEFAULT_MATCH_COUNT;
        try {
            List<Content> contents = retriever.retrieve(Query.from(query));
            if (contents.isEmpty()) {
                return "No matching documents found.";
            }
            return contents.stream()
                    .limit(limit)
                    .map(VectorSearchTool::format)
                    .collect(Collectors.joining("\n\n"));
        } catch (RuntimeException e) {
            // reported back to the model as the tool result; the agent can fall back to web_search
            log.warn("vector_search failed for '{}': {}", query, e.getMessage());
            return "Error searching vector store: " + e.getMessage();
        }
    }

    static String format(Content content) {
        Metadata metadata = content.textSegment().metadata();
        return "Title: " + orUnknown(metadata.getString("title"))
                + "\nDate: " + orUnknown(metadata.getString("date"))
                + "\nSummary: " + content.textSegment().text();
    }

    private static String orUnknown(String value) {
        return value != null ? value : "Unknown";
    }
}
