package com.zzf.miniagent.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.miniagent.agent.SubAgentOrchestrator;
import com.zzf.miniagent.directive.SubTaskSpec;
import com.zzf.miniagent.interrupt.InterruptChannel;
import com.zzf.miniagent.interrupt.InterruptSubscription;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Delegates a task to a single sub-agent and returns its outcome as text.
 */
@Slf4j
public class SubAgentTool implements Tool {

    private final SubAgentOrchestrator orchestrator;
    private final InterruptChannel interruptChannel;
    private final ObjectMapper objectMapper;
    private final ExecutorService executor;

    public SubAgentTool(SubAgentOrchestrator orchestrator, InterruptChannel interruptChannel,
                        ObjectMapper objectMapper, ExecutorService executor) {
        this.orchestrator = orchestrator;
        this.interruptChannel = interruptChannel;
        this.objectMapper = objectMapper;
        this.executor = executor;
    }

    @Override
    public String getId() {
        return "subagent";
    }

    @Override
    public String getDescription() {
        return "Spawn a new subagent to handle a specific task (parallel execution supported)";
    }

    @Override
    public JsonNode getParametersSchema() {
        ObjectNode schema = objectMapper.createObjectNode();
        schema.put("type", "object");
        ObjectNode properties = schema.putObject("properties");
        properties.putObject("task").put("type", "string").put("description", "The task description for the subagent");
        properties.putObject("type").put("type", "string")
                .put("description", "SubAgent type: code, test, doc, analysis, or dynamic (default)");
        properties.putObject("max_loops").put("type", "integer")
                .put("description", "Maximum loop iterations (default: 20)");
        schema.putArray("required").add("task");
        return schema;
    }

    @Override
    public CompletableFuture<String> execute(JsonNode args) {
        JsonNode taskNode = args == null ? null : args.get("task");
        if (taskNode == null || !taskNode.isTextual()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Missing 'task' argument"));
        }
        String task = taskNode.asText();
        JsonNode typeNode = args.get("type");
        String kind = typeNode != null && typeNode.isTextual() ? typeNode.asText() : SubTaskSpec.DEFAULT_KIND;
        JsonNode loopsNode = args.get("max_loops");
        int maxLoops = loopsNode != null && loopsNode.isIntegralNumber() && loopsNode.canConvertToInt()
                && loopsNode.asInt() >= 0 ? loopsNode.asInt() : SubTaskSpec.DEFAULT_MAX_ITERATIONS;

        // Pinned before scheduling so an interrupt that lands while the task is queued still reaches the child.
        InterruptSubscription interrupt = interruptChannel.subscribe();
        log.info("tool.subagent.start kind={} maxLoops={} generation={}", kind, maxLoops, interrupt.seenGeneration());
        return CompletableFuture.supplyAsync(() -> orchestrator.runSingle(task, kind, maxLoops, interrupt), executor);
    }
}
