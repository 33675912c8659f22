package com.zzf.miniagent.cli;

import com.zzf.miniagent.agent.AgentLoopListener;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.Help.Ansi.IStyle;
import picocli.CommandLine.Help.Ansi.Style;

import java.io.PrintStream;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Prints each turn of the top level agent: thinking in blue, tool calls in yellow.
 */
public class ResponsePrinter implements AgentLoopListener {

    private static final Pattern HIGHLIGHT = Pattern.compile("(?s)(<thinking>.*?</thinking>)|(<tool_code>.*?</tool_code>)");

    private final PrintStream out;
    private final Ansi ansi;

    public ResponsePrinter(PrintStream out, Ansi ansi) {
        this.out = out;
        this.ansi = ansi;
    }

    public String format(String response) {
        StringBuilder sb = new StringBuilder();
        Matcher matcher = HIGHLIGHT.matcher(response);
        int last = 0;
        while (matcher.find()) {
            if (matcher.start() > last) {
                sb.append(response, last, matcher.start()).append("\n");
            }
            String matched = matcher.group();
            if (matched.startsWith("<thinking>")) {
                sb.append(color(matched, Style.fg_blue)).append("\n");
            } else {
                sb.append(color(matched, Style.fg_yellow)).append("\n\n");
            }
            last = matcher.end();
        }
        if (last < response.length()) {
            sb.append(response.substring(last)).append("\n");
        }
        return sb.toString();
    }

    String color(String text, IStyle style) {
        if (!ansi.enabled()) {
            return text;
        }
        return style.on() + text + style.off();
    }

    @Override
    public void onResponse(String agentId, int iteration, String response) {
        out.println(format(response));
    }

    @Override
    public void onToolCall(String agentId, String toolName, String args) {
        out.println(">> Executing tool: " + toolName + "...");
    }

    @Override
    public void onToolOutput(String agentId, String toolName, String output) {
        out.println(">> Tool Output:\n" + output.trim());
    }

    @Override
    public void onParallelResults(String agentId, List<String> results) {
        out.println(">> Parallel tasks finished: " + results.size());
    }
}
