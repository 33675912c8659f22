package com.zzf.miniagent.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "miniagent")
public class AgentProperties {
    private String provider = "minimax";
    private String model = "MiniMax-M2.1";
    private String apiKey;
    private String apiUrl;
    private String sessionDir = "__sessions";
    private int maxLoops = 50;
    private int maxTokens = 8192;
    private int subagentMaxTokens = 8192;
    private String mcpConfig = "mcp.json";
    private boolean disableMcp;
    private long mcpRequestTimeoutMs = 60_000L;
    private long bashTimeoutMs = 600_000L;
    private final Shell shell = new Shell();

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getApiUrl() {
        return apiUrl;
    }

    public void setApiUrl(String apiUrl) {
        this.apiUrl = apiUrl;
    }

    public String getSessionDir() {
        return sessionDir;
    }

    public void setSessionDir(String sessionDir) {
        this.sessionDir = sessionDir;
    }

    public int getMaxLoops() {
        return maxLoops;
    }

    public void setMaxLoops(int maxLoops) {
        this.maxLoops = maxLoops;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public void setMaxTokens(int maxTokens) {
        this.maxTokens = maxTokens;
    }

    public int getSubagentMaxTokens() {
        return subagentMaxTokens;
    }

    public void setSubagentMaxTokens(int subagentMaxTokens) {
        this.subagentMaxTokens = subagentMaxTokens;
    }

    public String getMcpConfig() {
        return mcpConfig;
    }

    public void setMcpConfig(String mcpConfig) {
        this.mcpConfig = mcpConfig;
    }

    public boolean isDisableMcp() {
        return disableMcp;
    }

    public void setDisableMcp(boolean disableMcp) {
        this.disableMcp = disableMcp;
    }

    public long getMcpRequestTimeoutMs() {
        return mcpRequestTimeoutMs;
    }

    public void setMcpRequestTimeoutMs(long mcpRequestTimeoutMs) {
        this.mcpRequestTimeoutMs = mcpRequestTimeoutMs;
    }

    public long getBashTimeoutMs() {
        return bashTimeoutMs;
    }

    public void setBashTimeoutMs(long bashTimeoutMs) {
        this.bashTimeoutMs = bashTimeoutMs;
    }

    public Shell getShell() {
        return shell;
    }

    public static class Shell {
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
