package com.eainde.research.capability;

import com.eainde.research.ResearchException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reads system prompts from {@code prompts/<agent-name>.txt} on the classpath.
 */
@Slf4j
public class ClasspathPromptService implements PromptService {

    private final String baseDir;
    private final Map<String, String> cache = new ConcurrentHashMap<>();

    public ClasspathPromptService() {
        this("prompts");
    }

    public ClasspathPromptService(String baseDir) {
        this.baseDir = baseDir;
    }

    @Override
    public String getSystemPrompt(String agentName) {
        return cache.computeIfAbsent(agentName, this::load);
    }

    private String load(String agentName) {
        String path = baseDir + "/" + agentName + ".txt";
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new ResearchException("No prompt found for agent '" + agentName + "' at " + path);
            }
            String prompt = new String(in.readAllBytes(), StandardCharsets.UTF_8).strip();
            log.debug("Loaded prompt for {} ({} chars)", agentName, prompt.length());
            return prompt;
        } catch (IOException e) {
            throw new ResearchException("Failed to read prompt " + path, e);
        }
    }
}
