package com.zzf.miniagent.directive;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the {@code <tool_code>}, {@code <parallel>} and {@code <final>} tags from model output.
 * Parsing never throws: malformed payloads are logged and read as {@link Directive#none()}.
 */
@Slf4j
public final class DirectiveParser {

    private static final Pattern TOOL_CODE = Pattern.compile("(?s)<tool_code>\\s*(.*?)\\s*</tool_code>");
    private static final Pattern PARALLEL = Pattern.compile("(?s)<parallel>\\s*(.*?)\\s*</parallel>");
    private static final Pattern FINAL = Pattern.compile("(?s)<final>\\s*(.*?)\\s*</final>");

    private final ObjectMapper objectMapper;

    public DirectiveParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Directive parse(String text) {
        if (text == null || text.isEmpty()) {
            return Directive.none();
        }
        Matcher toolMatcher = TOOL_CODE.matcher(text);
        if (toolMatcher.find()) {
            ToolCall call = parseToolCall(toolMatcher.group(1));
            if (call != null) {
                return Directive.toolCall(call, parseParallel(text));
            }
        }
        Matcher finalMatcher = FINAL.matcher(text);
        if (finalMatcher.find()) {
            String answer = finalMatcher.group(1).trim();
            if (!answer.isEmpty()) {
                return Directive.finalAnswer(answer);
            }
        }
        return Directive.none();
    }

    ToolCall parseToolCall(String payload) {
        JsonNode node;
        try {
            node = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.warn("directive.tool_code.invalid err={} payload={}", e.getOriginalMessage(), abbreviate(payload));
            return null;
        }
        if (node == null || !node.isObject()) {
            log.warn("directive.tool_code.not_object payload={}", abbreviate(payload));
            return null;
        }
        JsonNode name = node.get("name");
        if (name == null || !name.isTextual()) {
            log.warn("directive.tool_code.missing_name payload={}", abbreviate(payload));
            return null;
        }
        if (!node.has("args")) {
            log.warn("directive.tool_code.missing_args name={}", name.asText());
            return null;
        }
        return new ToolCall(name.asText(), node.get("args"));
    }

    /**
     * Reads every balanced JSON object inside the first {@code <parallel>} region.
     * Objects may nest; braces inside strings are ignored.
     */
    public List<SubTaskSpec> parseParallel(String text) {
        List<SubTaskSpec> tasks = new ArrayList<>();
        if (text == null) {
            return tasks;
        }
        Matcher matcher = PARALLEL.matcher(text);
        if (!matcher.find()) {
            return tasks;
        }
        for (String object : balancedObjects(matcher.group(1))) {
            JsonNode node;
            try {
                node = objectMapper.readTree(object);
            } catch (JsonProcessingException e) {
                log.warn("directive.parallel.invalid err={} payload={}", e.getOriginalMessage(), abbreviate(object));
                continue;
            }
            JsonNode task = node.get("task");
            if (task == null || !task.isTextual()) {
                log.debug("directive.parallel.skip reason=missing_task payload={}", abbreviate(object));
                continue;
            }
            JsonNode type = node.get("type");
            JsonNode maxLoops = node.get("max_loops");
            tasks.add(SubTaskSpec.builder()
                    .task(task.asText())
                    .agentKind(type != null && type.isTextual() ? type.asText() : SubTaskSpec.DEFAULT_KIND)
                    .maxIterations(maxLoops != null && maxLoops.canConvertToInt() && maxLoops.isIntegralNumber()
                            && maxLoops.asInt() >= 0 ? maxLoops.asInt() : SubTaskSpec.DEFAULT_MAX_ITERATIONS)
                    .build());
        }
        return tasks;
    }

    static List<String> balancedObjects(String text) {
        List<String> objects = new ArrayList<>();
        int depth = 0;
        int start = -1;
        boolean inString = false;
        boolean escaped = false;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (ch == '\\') {
                    escaped = true;
                } else if (ch == '"') {
                    inString = false;
                }
                continue;
            }
            if (ch == '"') {
                if (depth > 0) {
                    inString = true;
                }
                continue;
            }
            if (ch == '{') {
                if (depth == 0) {
                    start = i;
                }
                depth++;
            } else if (ch == '}' && depth > 0) {
                depth--;
                if (depth == 0) {
                    objects.add(text.substring(start, i + 1));
                }
            }
        }
        return objects;
    }

    private static String abbreviate(String value) {
        if (value == null) {
            return "";
        }
        return value.length() <= 200 ? value : value.substring(0, 200) + "...";
    }
}
