package com.zzf.miniagent.mcp;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Contents of the MCP config file: {@code {"servers": [{"name", "command", "args", "env"}]}}.
 */
@Data
public class McpConfig {
    private List<McpServerConfig> servers = new ArrayList<>();
}
