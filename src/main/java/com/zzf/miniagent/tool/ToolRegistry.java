package com.zzf.miniagent.tool;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public final class ToolRegistry {

    public static final String FINAL_INSTRUCTIONS = "When you are finished, wrap the final answer in <final>...</final>.\n"
            + "If you need more steps and no tool call is required, continue until you are ready to finalize.\n\n";

    static final String BASE_PROMPT = "You are a helpful coding agent.\n\n" + FINAL_INSTRUCTIONS;

    static final String CALL_FORMAT = "To use a tool, ONLY output a JSON block wrapped in <tool_code> tags. "
            + "The JSON must be valid and directly deserializable. "
            + "Do not double-encode JSON strings or escape quotes inside JSON values.\n"
            + "Example:\n<tool_code>\n{\n  \"name\": \"bash\",\n  \"args\": {\n    \"command\": \"ls -la\"\n  }\n}\n</tool_code>\n"
            + "After the tool execution, you will receive the output. "
            + "Then you can continue to answer the user's question.\n";

    private final Map<String, Tool> tools = new ConcurrentHashMap<>();

    public void register(Tool tool) {
        if (tool == null || tool.getId() == null || tool.getId().isBlank()) {
            return;
        }
        tools.put(tool.getId(), tool);
    }

    public Tool get(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        return tools.get(name);
    }

    public List<Tool> list() {
        List<Tool> out = new ArrayList<>(tools.values());
        out.sort(Comparator.comparing(Tool::getId));
        return out;
    }

    public int size() {
        return tools.size();
    }

    public String generateSystemPrompt() {
        return BASE_PROMPT + generateToolInstructions();
    }

    public String generateToolInstructions() {
        StringBuilder prompt = new StringBuilder("You have access to the following tools:\n\n");
        for (Tool tool : list()) {
            prompt.append("## ").append(tool.getId()).append(": ").append(tool.getDescription()).append("\n");
            prompt.append("Schema: ").append(tool.getParametersSchema()).append("\n\n");
        }
        prompt.append(CALL_FORMAT);
        return prompt.toString();
    }
}
