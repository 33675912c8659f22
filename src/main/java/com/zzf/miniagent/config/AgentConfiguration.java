package com.zzf.miniagent.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.miniagent.agent.AgentLoop;
import com.zzf.miniagent.agent.AgentPrompts;
import com.zzf.miniagent.agent.SubAgentOrchestrator;
import com.zzf.miniagent.context.ConversationStore;
import com.zzf.miniagent.directive.DirectiveParser;
import com.zzf.miniagent.interrupt.InterruptChannel;
import com.zzf.miniagent.llm.LLMClient;
import com.zzf.miniagent.llm.LLMClientFactory;
import com.zzf.miniagent.mcp.McpToolLoader;
import com.zzf.miniagent.session.SessionManager;
import com.zzf.miniagent.shell.ShellService;
import com.zzf.miniagent.storage.StorageService;
import com.zzf.miniagent.tool.BashTool;
import com.zzf.miniagent.tool.SubAgentTool;
import com.zzf.miniagent.tool.ToolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Slf4j
@Configuration
public class AgentConfiguration {

    @Bean
    public InterruptChannel interruptChannel() {
        return new InterruptChannel();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService agentExecutor() {
        return Executors.newCachedThreadPool();
    }

    @Bean
    public ShellService shellService() {
        return new ShellService();
    }

    @Bean
    public LLMClient llmClient(AgentProperties properties, ObjectMapper objectMapper) {
        String apiKey = LLMClientFactory.resolveApiKey(properties.getProvider(), properties.getApiKey(), System::getenv);
        log.info("llm.client provider={} model={}", properties.getProvider(), properties.getModel());
        return LLMClientFactory.create(properties.getProvider(), properties.getModel(), apiKey,
                properties.getApiUrl(), objectMapper);
    }

    @Bean
    public DirectiveParser directiveParser(ObjectMapper objectMapper) {
        return new DirectiveParser(objectMapper);
    }

    @Bean
    public BashTool bashTool(ShellService shellService, ObjectMapper objectMapper, ExecutorService agentExecutor,
                             AgentProperties properties) {
        return new BashTool(shellService, objectMapper, agentExecutor, properties.getBashTimeoutMs());
    }

    @Bean
    public ToolRegistry toolRegistry(BashTool bashTool) {
        ToolRegistry registry = new ToolRegistry();
        registry.register(bashTool);
        return registry;
    }

    @Bean
    public AgentPrompts agentPrompts(ResourceLoader resourceLoader) {
        return new AgentPrompts(resourceLoader);
    }

    @Bean
    public SubAgentOrchestrator subAgentOrchestrator(LLMClient llmClient, ToolRegistry toolRegistry,
                                                     DirectiveParser directiveParser, AgentPrompts agentPrompts,
                                                     ExecutorService agentExecutor, AgentProperties properties) {
        return new SubAgentOrchestrator(llmClient, toolRegistry, directiveParser, agentPrompts, agentExecutor,
                properties.getSubagentMaxTokens());
    }

    @Bean
    public SubAgentTool subAgentTool(SubAgentOrchestrator orchestrator, InterruptChannel interruptChannel,
                                     ObjectMapper objectMapper, ExecutorService agentExecutor,
                                     ToolRegistry toolRegistry) {
        SubAgentTool tool = new SubAgentTool(orchestrator, interruptChannel, objectMapper, agentExecutor);
        toolRegistry.register(tool);
        return tool;
    }

    @Bean(destroyMethod = "close")
    public McpToolLoader mcpToolLoader(ObjectMapper objectMapper, ExecutorService agentExecutor,
                                       ToolRegistry toolRegistry, AgentProperties properties) {
        McpToolLoader loader = new McpToolLoader(objectMapper, agentExecutor,
                Duration.ofMillis(properties.getMcpRequestTimeoutMs()));
        if (properties.isDisableMcp()) {
            log.info("mcp.disabled");
            return loader;
        }
        try {
            int count = loader.registerAll(toolRegistry, Paths.get(properties.getMcpConfig()));
            log.info("mcp.tools.registered count={}", count);
        } catch (IOException e) {
            log.error("MCP tool registration failed: {}", e.getMessage());
        }
        return loader;
    }

    @Bean
    public StorageService storageService(AgentProperties properties, ObjectMapper objectMapper) {
        return new StorageService(Paths.get(properties.getSessionDir()), objectMapper);
    }

    @Bean
    public SessionManager sessionManager(StorageService storageService) {
        return new SessionManager(storageService);
    }

    @Bean
    public ConversationStore mainConversation(AgentProperties properties) {
        return new ConversationStore(properties.getMaxTokens());
    }

    @Bean
    public AgentLoop mainAgentLoop(LLMClient llmClient, ToolRegistry toolRegistry, DirectiveParser directiveParser,
                                   SubAgentOrchestrator orchestrator) {
        return new AgentLoop(llmClient, toolRegistry, directiveParser, orchestrator);
    }
}
