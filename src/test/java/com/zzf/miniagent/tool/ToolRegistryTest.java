package com.zzf.miniagent.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolRegistryTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static Tool named(String id) {
        return new Tool() {
            @Override
            public String getId() {
                return id;
            }

            @Override
            public String getDescription() {
                return "desc of " + id;
            }

            @Override
            public JsonNode getParametersSchema() {
                return MAPPER.createObjectNode().put("type", "object");
            }

            @Override
            public CompletableFuture<String> execute(JsonNode args) {
                return CompletableFuture.completedFuture(id);
            }
        };
    }

    @Test
    void registerAndLookup() {
        ToolRegistry registry = new ToolRegistry();
        Tool bash = named("bash");
        registry.register(bash);
        registry.register(null);
        registry.register(named(" "));

        assertSame(bash, registry.get("bash"));
        assertNull(registry.get("missing"));
        assertNull(registry.get(null));
        assertEquals(1, registry.size());
    }

    @Test
    void listIsSortedByName() {
        ToolRegistry registry = new ToolRegistry();
        registry.register(named("subagent"));
        registry.register(named("bash"));
        registry.register(named("mcp.fs.read"));

        List<String> names = registry.list().stream().map(Tool::getId).collect(Collectors.toList());
        assertEquals(List.of("bash", "mcp.fs.read", "subagent"), names);
    }

    @Test
    void laterRegistrationReplacesSameName() {
        ToolRegistry registry = new ToolRegistry();
        registry.register(named("bash"));
        Tool replacement = named("bash");
        registry.register(replacement);
        assertSame(replacement, registry.get("bash"));
    }

    @Test
    void instructionsEmbedEveryToolSchema() {
        ToolRegistry registry = new ToolRegistry();
        registry.register(named("bash"));

        String instructions = registry.generateToolInstructions();
        assertTrue(instructions.startsWith("You have access to the following tools:\n\n"));
        assertTrue(instructions.contains("## bash: desc of bash\nSchema: {\"type\":\"object\"}\n\n"));
        assertTrue(instructions.contains("<tool_code>"));

        String prompt = registry.generateSystemPrompt();
        assertTrue(prompt.startsWith("You are a helpful coding agent."));
        assertTrue(prompt.contains("<final>...</final>"));
        assertTrue(prompt.endsWith(instructions));
    }
}
