package com.zzf.miniagent.tool;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.concurrent.CompletableFuture;

/**
 * A named capability the model can call through a {@code <tool_code>} block.
 * Implementations report failures through the returned future.
 */
public interface Tool {

    String getId();

    String getDescription();

    /**
     * JSON schema of the arguments. Only embedded into the prompt, never validated.
     */
    JsonNode getParametersSchema();

    CompletableFuture<String> execute(JsonNode args);
}
