package com.zzf.miniagent.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.miniagent.shell.ShellService;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Executes a shell command. A non-zero exit is reported as tool output, not as a failure.
 */
@Slf4j
public class BashTool implements Tool {

    private final ObjectMapper objectMapper;
    private final ExecutorService executor;
    private final BashCommandExecutor commandExecutor;
    private final long timeoutMs;

    public BashTool(ShellService shellService, ObjectMapper objectMapper, ExecutorService executor, long timeoutMs) {
        this.objectMapper = objectMapper;
        this.executor = executor;
        this.commandExecutor = new BashCommandExecutor(shellService, executor);
        this.timeoutMs = timeoutMs;
    }

    @Override
    public String getId() {
        return "bash";
    }

    @Override
    public String getDescription() {
        return "Execute a bash command";
    }

    @Override
    public JsonNode getParametersSchema() {
        ObjectNode schema = objectMapper.createObjectNode();
        schema.put("type", "object");
        schema.putObject("properties")
                .putObject("command")
                .put("type", "string")
                .put("description", "The command to execute");
        schema.putArray("required").add("command");
        return schema;
    }

    @Override
    public CompletableFuture<String> execute(JsonNode args) {
        JsonNode commandNode = args == null ? null : args.get("command");
        if (commandNode == null || !commandNode.isTextual()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Missing command argument"));
        }
        String command = commandNode.asText();
        return CompletableFuture.supplyAsync(() -> {
            log.debug("tool.bash.start command={}", command);
            BashCommandExecutor.ExecutionResult result;
            try {
                result = commandExecutor.execute(command, timeoutMs);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CompletionException(e);
            }
            log.debug("tool.bash.done exit={} timedOut={} durationMs={}",
                    result.exitCode, result.timedOut, result.durationMs);
            if (result.success()) {
                return result.stdout;
            }
            return "Error: " + result.stderr + "\nStdout: " + result.stdout;
        }, executor);
    }

    /**
     * Stops commands abandoned by an interrupted turn.
     */
    public int killRunning() {
        return commandExecutor.killAll();
    }
}
