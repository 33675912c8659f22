package com.zzf.miniagent.agent;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Kind specific system prompts, loaded from {@code prompts/agent/<kind>.txt}.
 * Unknown kinds get the dynamic prompt.
 */
@Slf4j
public class AgentPrompts {

    public static final String DEFAULT_KIND = "dynamic";
    public static final Set<String> KINDS = Set.of("code", "test", "doc", "analysis", DEFAULT_KIND);

    private final ResourceLoader resourceLoader;
    private final Map<String, String> cache = new ConcurrentHashMap<>();

    public AgentPrompts(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
    }

    public static String normalizeKind(String kind) {
        String normalized = kind == null ? "" : kind.trim().toLowerCase(Locale.ROOT);
        return KINDS.contains(normalized) ? normalized : DEFAULT_KIND;
    }

    /**
     * @throws AgentSpawnException if the prompt resource cannot be read
     */
    public String promptFor(String kind) {
        String normalized = normalizeKind(kind);
        return cache.computeIfAbsent(normalized, this::load);
    }

    private String load(String kind) {
        String location = "classpath:prompts/agent/" + kind + ".txt";
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new AgentSpawnException("Prompt not found: " + location);
        }
        try {
            return StreamUtils.copyToString(resource.getInputStream(), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            log.error("Failed to load agent prompt {}", location, e);
            throw new AgentSpawnException("Failed to load prompt " + location, e);
        }
    }
}
