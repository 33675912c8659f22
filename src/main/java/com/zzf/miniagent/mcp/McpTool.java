package com.zzf.miniagent.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.miniagent.tool.Tool;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.spec.McpSchema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * A tool exposed by an MCP server, registered as {@code mcp.<server>.<tool>}.
 */
public class McpTool implements Tool {

    private static final TypeReference<Map<String, Object>> ARGUMENTS = new TypeReference<>() {
    };

    private final McpSyncClient client;
    private final McpSchema.Tool definition;
    private final ObjectMapper objectMapper;
    private final Executor executor;
    private final String id;
    private final String description;
    private final JsonNode schema;

    public McpTool(String serverName, McpSyncClient client, McpSchema.Tool definition, ObjectMapper objectMapper,
                   Executor executor) {
        this.client = client;
        this.definition = definition;
        this.objectMapper = objectMapper;
        this.executor = executor;
        this.id = "mcp." + serverName + "." + definition.name();
        this.description = "[MCP:" + serverName + "] " + (definition.description() == null ? "" : definition.description());
        this.schema = definition.inputSchema() == null ? emptySchema() : objectMapper.valueToTree(definition.inputSchema());
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getDescription() {
        return description;
    }

    @Override
    public JsonNode getParametersSchema() {
        return schema;
    }

    @Override
    public CompletableFuture<String> execute(JsonNode args) {
        Map<String, Object> arguments = args != null && args.isObject()
                ? objectMapper.convertValue(args, ARGUMENTS)
                : Collections.emptyMap();
        return CompletableFuture.supplyAsync(
                () -> render(client.callTool(new McpSchema.CallToolRequest(definition.name(), arguments))), executor);
    }

    /**
     * @return the text content items joined by newlines, or the whole result as JSON when there are none
     * @throws McpException if the server flagged the call as an error
     */
    String render(McpSchema.CallToolResult result) {
        List<String> texts = new ArrayList<>();
        if (result.content() != null) {
            for (McpSchema.Content content : result.content()) {
                if (content instanceof McpSchema.TextContent) {
                    texts.add(((McpSchema.TextContent) content).text());
                }
            }
        }
        String joined;
        if (texts.isEmpty()) {
            try {
                joined = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result);
            } catch (JsonProcessingException e) {
                throw new McpException("Failed to render result of " + id, e);
            }
        } else {
            joined = String.join("\n", texts);
        }
        if (Boolean.TRUE.equals(result.isError())) {
            throw new McpException("MCP tool error: " + joined);
        }
        return joined;
    }

    private ObjectNode emptySchema() {
        ObjectNode fallback = objectMapper.createObjectNode();
        fallback.put("type", "object");
        fallback.putObject("properties");
        return fallback;
    }
}
