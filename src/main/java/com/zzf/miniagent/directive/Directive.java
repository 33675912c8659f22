package com.zzf.miniagent.directive;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/**
 * Action extracted from a completion. A tool call may carry a parallel batch found in the same text.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Directive {

    public enum Type {
        TOOL_CALL,
        FINAL_ANSWER,
        NONE
    }

    private static final Directive NONE = new Directive(Type.NONE, null, List.of(), null);

    Type type;
    ToolCall toolCall;
    List<SubTaskSpec> parallelTasks;
    String finalText;

    public static Directive toolCall(ToolCall call, List<SubTaskSpec> parallelTasks) {
        return new Directive(Type.TOOL_CALL, call, parallelTasks == null ? List.of() : List.copyOf(parallelTasks), null);
    }

    public static Directive finalAnswer(String text) {
        return new Directive(Type.FINAL_ANSWER, null, List.of(), text);
    }

    public static Directive none() {
        return NONE;
    }

    public boolean hasParallelTasks() {
        return !parallelTasks.isEmpty();
    }
}
