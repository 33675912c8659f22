package com.zzf.miniagent.agent;

import java.util.List;

/**
 * Progress hooks for a running loop. Sub-agents run with the no-op default.
 */
public interface AgentLoopListener {

    AgentLoopListener NONE = new AgentLoopListener() {
    };

    default void onResponse(String agentId, int iteration, String response) {
    }

    default void onToolCall(String agentId, String toolName, String args) {
    }

    default void onToolOutput(String agentId, String toolName, String output) {
    }

    default void onParallelResults(String agentId, List<String> results) {
    }
}
