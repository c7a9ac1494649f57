package com.eainde.research.config;

import com.eainde.research.ResearchOrchestrator;
import com.eainde.research.StageInstrumentation;
import com.eainde.research.capability.AgentSearchCapability;
import com.eainde.research.capability.ClasspathPromptService;
import com.eainde.research.capability.GenerationCapability;
import com.eainde.research.capability.JsonSchemaConverter;
import com.eainde.research.capability.LangChain4jGenerationCapability;
import com.eainde.research.capability.ObservabilityListener;
import com.eainde.research.capability.PromptService;
import com.eainde.research.capability.ResearchAgents;
import com.eainde.research.capability.SearchCapability;
import com.eainde.research.debug.ArtifactRecorder;
import com.eainde.research.debug.JsonFileArtifactRecorder;
import com.eainde.research.edges.EvaluationRoutingEdge;
import com.eainde.research.nodes.EvaluationNode;
import com.eainde.research.nodes.FollowUpNode;
import com.eainde.research.nodes.PlanningNode;
import com.eainde.research.nodes.SearchNode;
import com.eainde.research.nodes.WritingNode;
import com.eainde.research.progress.ProgressBoard;
import com.eainde.research.progress.ProgressSink;
import com.eainde.research.search.SearchFanOutExecutor;
import com.eainde.research.stage.Evaluator;
import com.eainde.research.stage.Planner;
import com.eainde.research.stage.ReportSynthesizer;
import com.eainde.research.state.ResearchState;
import com.eainde.research.thread.MdcAwareExecutor;
import com.eainde.research.workflow.ResearchWorkflowGraph;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.listener.ChatModelListener;
import dev.langchain4j.model.vertexai.VertexAiGeminiChatModel;
import dev.langchain4j.model.vertexai.VertexAiGeminiStreamingChatModel;
import dev.langchain4j.rag.content.retriever.ContentRetriever;
import dev.langchain4j.web.search.WebSearchEngine;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Wires the research engine: Vertex AI Gemini models per agent, the capabilities over
 * them, the stages, the workflow graph and the orchestrator.
 *
 * <p>A {@link ContentRetriever} or {@link WebSearchEngine} bean, when one is defined,
 * is offered to the search agent as a tool.</p>
 */
@Slf4j
@Configuration
public class ResearchConfig {

    static final int MAX_ITERATIONS_LIMIT = 10;

    @Value("${research.model.project:}")
    private String project;

    @Value("${research.model.location:us-central1}")
    private String location;

    @Value("${research.model.temperature:0.2}")
    private float temperature;

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Bean
    public ProgressSink progressSink() {
        return new ProgressBoard(System.out);
    }

    @Bean
    public ChatModelListener observabilityListener() {
        return new ObservabilityListener();
    }

    @Bean
    public PromptService promptService() {
        return new ClasspathPromptService();
    }

    @Bean
    public GenerationCapability generationCapability(
            @Value("${research.model.planner:gemini-2.5-pro}") String plannerModel,
            @Value("${research.model.evaluator:gemini-2.5-flash}") String evaluatorModel,
            @Value("${research.model.writer:gemini-2.5-pro}") String writerModel,
            ChatModelListener listener,
            PromptService promptService,
            ObjectMapper objectMapper) {
        ChatModel evaluator = gemini(evaluatorModel, listener);
        Map<String, ChatModel> models = Map.of(
                ResearchAgents.PLANNER_NAME, gemini(plannerModel, listener),
                ResearchAgents.EVALUATOR_NAME, evaluator);

        StreamingChatModel writer = VertexAiGeminiStreamingChatModel.builder()
                .project(project)
                .location(location)
                .modelName(writerModel)
                .temperature(temperature)
                .listeners(List.of(listener))
                .build();

        return new LangChain4jGenerationCapability(evaluator, models, writer, promptService,
                new JsonSchemaConverter(objectMapper), objectMapper);
    }

    @Bean
    public SearchCapability searchCapability(
            @Value("${research.model.search:gemini-2.5-flash}") String searchModel,
            ChatModelListener listener,
            PromptService promptService,
            ObjectProvider<ContentRetriever> contentRetriever,
            ObjectProvider<WebSearchEngine> webSearchEngine) {
        return new AgentSearchCapability(gemini(searchModel, listener), promptService,
                contentRetriever.getIfAvailable(), webSearchEngine.getIfAvailable());
    }

    @Bean
    public MdcAwareExecutor searchExecutor(@Value("${research.search.max-concurrency:0}") int maxConcurrency) {
        return new MdcAwareExecutor("research-search", maxConcurrency);
    }

    @Bean
    public ArtifactRecorder artifactRecorder(@Value("${research.debug.enabled:false}") boolean debugEnabled,
                                             @Value("${research.debug.dir:debug_logs}") String debugDir,
                                             ObjectMapper objectMapper) {
        if (!debugEnabled) {
            return ArtifactRecorder.noop();
        }
        log.info("Debug artifacts will be written to {}", Path.of(debugDir).toAbsolutePath());
        return new JsonFileArtifactRecorder(Path.of(debugDir), objectMapper);
    }

    @Bean
    public StageInstrumentation stageInstrumentation() {
        return new StageInstrumentation();
    }

    @Bean
    public SearchFanOutExecutor searchFanOutExecutor(SearchCapability searchCapability,
                                                     MdcAwareExecutor searchExecutor,
                                                     ProgressSink progressSink) {
        return new SearchFanOutExecutor(searchCapability, searchExecutor, progressSink);
    }

    @Bean
    public ResearchWorkflowGraph researchWorkflowGraph(
            GenerationCapability generation,
            SearchFanOutExecutor fanOut,
            ProgressSink progress,
            StageInstrumentation instrumentation,
            ArtifactRecorder recorder,
            @Value("${research.writer.narration-interval:5s}") Duration narrationInterval) {
        return new ResearchWorkflowGraph(
                new PlanningNode(new Planner(generation, progress), instrumentation, recorder),
                new SearchNode(fanOut, instrumentation),
                new EvaluationNode(new Evaluator(generation, progress), progress, instrumentation, recorder),
                new FollowUpNode(fanOut, progress, instrumentation, recorder),
                new WritingNode(new ReportSynthesizer(generation, progress, narrationInterval), instrumentation, recorder),
                new EvaluationRoutingEdge());
    }

    @Bean
    public ResearchOrchestrator researchOrchestrator(
            ResearchWorkflowGraph graph,
            ProgressSink progress,
            ArtifactRecorder recorder,
            @Value("${research.max-iterations:3}") int maxIterations) throws GraphStateException {
        if (maxIterations < 1 || maxIterations > MAX_ITERATIONS_LIMIT) {
            throw new IllegalArgumentException("research.max-iterations must be between 1 and "
                    + MAX_ITERATIONS_LIMIT + ": " + maxIterations);
        }
        CompiledGraph<ResearchState> workflow = graph.build(maxIterations);
        return new ResearchOrchestrator(workflow, progress, recorder, maxIterations);
    }

    private ChatModel gemini(String modelName, ChatModelListener listener) {
        return VertexAiGeminiChatModel.builder()
                .project(project)
                .location(location)
                .modelName(modelName)
                .temperature(temperature)
                .listeners(List.of(listener))
                .build();
    }
}
