package com.zzf.miniagent.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.miniagent.tool.ToolRegistry;
import io.modelcontextprotocol.client.McpClient;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.client.transport.ServerParameters;
import io.modelcontextprotocol.client.transport.StdioClientTransport;
import io.modelcontextprotocol.spec.McpSchema;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Starts the servers listed in the MCP config and registers their tools. A server that
 * fails to start or list its tools is logged and skipped.
 */
@Slf4j
public class McpToolLoader implements Closeable {

    static final String CLIENT_NAME = "mini-agent";
    static final String CLIENT_VERSION = "0.1.0";

    private final ObjectMapper objectMapper;
    private final Executor executor;
    private final ServerLauncher launcher;

    /** Server name to connected client. */
    private final Map<String, McpSyncClient> clients = new ConcurrentHashMap<>();

    @FunctionalInterface
    public interface ServerLauncher {
        McpSyncClient launch(McpServerConfig config);
    }

    public McpToolLoader(ObjectMapper objectMapper, Executor executor, Duration requestTimeout) {
        this(objectMapper, executor, config -> launchStdio(config, objectMapper, requestTimeout));
    }

    public McpToolLoader(ObjectMapper objectMapper, Executor executor, ServerLauncher launcher) {
        this.objectMapper = objectMapper;
        this.executor = executor;
        this.launcher = launcher;
    }

    /**
     * Client over the server's stdio. The process starts on {@code initialize()}; every request,
     * the handshake included, fails after {@code requestTimeout}.
     */
    public static McpSyncClient launchStdio(McpServerConfig config, ObjectMapper objectMapper, Duration requestTimeout) {
        if (config.getCommand() == null || config.getCommand().isBlank()) {
            throw new McpException("MCP server '" + config.getName() + "' has no command");
        }
        ServerParameters parameters = ServerParameters.builder(config.getCommand())
                .args(config.getArgs() == null ? List.of() : config.getArgs())
                .env(config.getEnv() == null ? Map.of() : config.getEnv())
                .build();
        return McpClient.sync(new StdioClientTransport(parameters, objectMapper))
                .requestTimeout(requestTimeout)
                .initializationTimeout(requestTimeout)
                .clientInfo(new McpSchema.Implementation(CLIENT_NAME, CLIENT_VERSION))
                .build();
    }

    /**
     * @return number of tools registered
     * @throws IOException if the config file exists but cannot be read or parsed
     */
    public int registerAll(ToolRegistry registry, Path configPath) throws IOException {
        if (configPath == null || !Files.exists(configPath)) {
            log.info("MCP config not found at {}", configPath);
            return 0;
        }
        McpConfig config;
        try {
            config = objectMapper.readValue(configPath.toFile(), McpConfig.class);
        } catch (IOException e) {
            throw new IOException("Invalid MCP config JSON: " + configPath, e);
        }

        int registered = 0;
        for (McpServerConfig server : config.getServers()) {
            String name = server.getName();
            McpSyncClient client = null;
            try {
                client = launcher.launch(server);
                client.initialize();
                McpSchema.ListToolsResult listed = client.listTools();
                if (listed == null || listed.tools() == null) {
                    throw new McpException("MCP tools/list response missing tools");
                }
                int count = 0;
                for (McpSchema.Tool tool : listed.tools()) {
                    if (tool.name() == null || tool.name().isBlank()) {
                        continue;
                    }
                    registry.register(new McpTool(name, client, tool, objectMapper, executor));
                    log.debug("mcp.tool name={} server={}", tool.name(), name);
                    count++;
                }
                McpSyncClient previous = clients.put(name, client);
                if (previous != null) {
                    closeQuietly(name, previous);
                }
                registered += count;
                log.info("mcp.server.ready name={} tools={}", name, count);
            } catch (RuntimeException e) {
                log.error("MCP server '{}' failed: {}", name, e.getMessage());
                closeQuietly(name, client);
            }
        }
        return registered;
    }

    public int serverCount() {
        return clients.size();
    }

    @Override
    public void close() {
        clients.forEach(McpToolLoader::closeQuietly);
        clients.clear();
    }

    private static void closeQuietly(String name, McpSyncClient client) {
        if (client == null) {
            return;
        }
        try {
            if (client.closeGracefully()) {
                log.info("mcp.server.stop name={}", name);
            } else {
                log.debug("mcp.server.stop_timeout name={}", name);
            }
        } catch (RuntimeException e) {
            log.debug("mcp.server.close_failed name={} err={}", name, e.getMessage());
        }
    }
}
