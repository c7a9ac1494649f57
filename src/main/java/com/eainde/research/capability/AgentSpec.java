package com.eainde.research.capability;

import java.util.Objects;

/**
 * Declarative description of one research agent.
 *
 * <p>The system prompt is resolved by {@link PromptService} from {@link #getAgentName()}.
 * When {@link #getSchemaResource()} is set, the agent is called in structured-output
 * mode and its reply is parsed into {@link #getOutputType()}.</p>
 *
 * <pre>
 * AgentSpec.of("research-planner", "Plans the searches for a query", SearchPlan.class)
 *          .schema("schemas/search-plan.json")
 *          .build();
 * </pre>
 *
 * @param <T> type the agent's reply is parsed into
 */
public final class AgentSpec<T> {

    private final String agentName;
    private final String description;
    private final Class<T> outputType;
    private final String schemaResource;
    private final boolean streaming;

    private AgentSpec(Builder<T> builder) {
        this.agentName = builder.agentName;
        this.description = builder.description;
        this.outputType = builder.outputType;
        this.schemaResource = builder.schemaResource;
        this.streaming = builder.streaming;
    }

    public static <T> Builder<T> of(String agentName, String description, Class<T> outputType) {
        return new Builder<>(agentName, description, outputType);
    }

    public String getAgentName() { return agentName; }
    public String getDescription() { return description; }
    public Class<T> getOutputType() { return outputType; }
    public String getSchemaResource() { return schemaResource; }
    public boolean hasSchema() { return schemaResource != null; }
    public boolean isStreaming() { return streaming; }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(agentName);
        sb.append(" → ").append(outputType.getSimpleName());
        if (hasSchema()) sb.append(" schema=").append(schemaResource);
        if (streaming) sb.append(" [streaming]");
        return sb.toString();
    }

    public static class Builder<T> {
        private final String agentName;
        private final String description;
        private final Class<T> outputType;
        private String schemaResource;
        private boolean streaming;

        private Builder(String agentName, String description, Class<T> outputType) {
            this.agentName = Objects.requireNonNull(agentName, "agentName");
            this.description = description;
            this.outputType = Objects.requireNonNull(outputType, "outputType");
        }

        public Builder<T> schema(String schemaResource) {
            this.schemaResource = schemaResource;
            return this;
        }

        public Builder<T> streaming(boolean streaming) {
            this.streaming = streaming;
            return this;
        }

        public AgentSpec<T> build() {
            return new AgentSpec<>(this);
        }
    }
}
