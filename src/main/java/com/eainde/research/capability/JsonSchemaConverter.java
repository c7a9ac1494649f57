package com.eainde.research.capability;

import com.eainde.research.ResearchException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns the JSON-schema documents under {@code schemas/} into LangChain4j
 * {@link JsonSchema}s for structured-output requests.
 *
 * <p>Only the subset the research agents use is understood: object, array, string
 * (with enum), integer, number and boolean. Unknown types fall back to string.</p>
 */
public class JsonSchemaConverter {

    private final ObjectMapper objectMapper;
    private final Map<String, JsonSchema> cache = new ConcurrentHashMap<>();

    public JsonSchemaConverter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Loads and converts a classpath schema, caching it by resource path.
     *
     * @param name         schema name sent to the model
     * @param resourcePath classpath location, e.g. {@code schemas/evaluation.json}
     */
    public JsonSchema fromResource(String name, String resourcePath) {
        return cache.computeIfAbsent(resourcePath, path -> toLangChainSchema(name, readResource(path)));
    }

    public JsonSchema toLangChainSchema(String name, String jsonSchemaString) {
        JsonNode rootNode;
        try {
            rootNode = objectMapper.readTree(jsonSchemaString);
        } catch (IOException e) {
            throw new ResearchException("Failed to parse JSON Schema '" + name + "'", e);
        }
        return JsonSchema.builder()
                .name(name != null ? name : "Schema")
                .rootElement(parseElement(rootNode))
                .build();
    }

    private String readResource(String path) {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new ResearchException("Schema resource not found: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ResearchException("Failed to read schema resource: " + path, e);
        }
    }

    private JsonSchemaElement parseElement(JsonNode node) {
        String type = node.path("type").asText(node.has("properties") ? "object" : "string");
        return switch (type) {
            case "object" -> parseObject(node);
            case "array" -> parseArray(node);
            case "integer" -> JsonIntegerSchema.builder().description(description(node)).build();
            case "number" -> JsonNumberSchema.builder().description(description(node)).build();
            case "boolean" -> JsonBooleanSchema.builder().description(description(node)).build();
            default -> parseString(node);
        };
    }

    private JsonObjectSchema parseObject(JsonNode node) {
        JsonObjectSchema.Builder builder = JsonObjectSchema.builder().description(description(node));

        Iterator<Map.Entry<String, JsonNode>> fields = node.path("properties").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            builder.addProperty(field.getKey(), parseElement(field.getValue()));
        }

        List<String> required = textList(node.path("required"));
        if (!required.isEmpty()) {
            builder.required(required);
        }
        return builder.build();
    }

    private JsonArraySchema parseArray(JsonNode node) {
        JsonArraySchema.Builder builder = JsonArraySchema.builder().description(description(node));
        if (node.has("items")) {
            builder.items(parseElement(node.get("items")));
        }
        return builder.build();
    }

    private JsonSchemaElement parseString(JsonNode node) {
        if (node.has("enum")) {
            return JsonEnumSchema.builder()
                    .description(description(node))
                    .enumValues(textList(node.get("enum")))
                    .build();
        }
        return JsonStringSchema.builder().description(description(node)).build();
    }

    private static String description(JsonNode node) {
        return node.has("description") ? node.get("description").asText() : null;
    }

    private static List<String> textList(JsonNode array) {
        List<String> values = new ArrayList<>();
        if (array != null && array.isArray()) {
            array.forEach(n -> values.add(n.asText()));
        }
        return values;
    }
}
