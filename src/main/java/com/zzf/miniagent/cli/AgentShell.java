package com.zzf.miniagent.cli;

import com.zzf.miniagent.agent.AgentCancelledException;
import com.zzf.miniagent.agent.AgentLoop;
import com.zzf.miniagent.agent.AgentRecord;
import com.zzf.miniagent.agent.MaxIterationsException;
import com.zzf.miniagent.config.AgentProperties;
import com.zzf.miniagent.context.ConversationStore;
import com.zzf.miniagent.interrupt.InterruptChannel;
import com.zzf.miniagent.interrupt.InterruptSignalHandler;
import com.zzf.miniagent.interrupt.InterruptSubscription;
import com.zzf.miniagent.mcp.McpToolLoader;
import com.zzf.miniagent.session.SessionManager;
import com.zzf.miniagent.tool.BashTool;
import com.zzf.miniagent.tool.ToolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Help.Ansi;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Interactive read-eval loop. Each line is either a slash command or one agent turn
 * over the shared top level conversation.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "miniagent.shell", name = "enabled", havingValue = "true", matchIfMissing = true)
public class AgentShell implements CommandLineRunner {

    static final String PROMPT = ">> ";

    private final AgentProperties properties;
    private final ConversationStore conversation;
    private final AgentLoop agentLoop;
    private final ToolRegistry toolRegistry;
    private final InterruptChannel interruptChannel;
    private final SessionManager sessionManager;
    private final BashTool bashTool;
    private final McpToolLoader mcpToolLoader;
    private int turns;

    public AgentShell(AgentProperties properties, ConversationStore conversation, AgentLoop agentLoop,
                      ToolRegistry toolRegistry, InterruptChannel interruptChannel, SessionManager sessionManager,
                      BashTool bashTool, McpToolLoader mcpToolLoader) {
        this.properties = properties;
        this.conversation = conversation;
        this.agentLoop = agentLoop;
        this.toolRegistry = toolRegistry;
        this.interruptChannel = interruptChannel;
        this.sessionManager = sessionManager;
        this.bashTool = bashTool;
        this.mcpToolLoader = mcpToolLoader;
    }

    @Override
    public void run(String... args) throws IOException {
        InterruptSignalHandler.install(interruptChannel);
        repl(System.in, System.out, Ansi.AUTO);
    }

    void repl(InputStream in, PrintStream out, Ansi ansi) throws IOException {
        conversation.injectSystem(toolRegistry.generateSystemPrompt());
        ShellCommandHandler commands = new ShellCommandHandler(sessionManager, conversation, toolRegistry, out);
        ResponsePrinter printer = new ResponsePrinter(out, ansi);
        log.info("shell.start tools={} mcpServers={}", toolRegistry.size(), mcpToolLoader.serverCount());

        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        while (true) {
            out.print(PROMPT);
            out.flush();
            String line = reader.readLine();
            if (line == null) {
                out.println("CTRL-D");
                break;
            }
            String input = line.trim();
            if (input.isEmpty()) {
                continue;
            }
            if (ShellCommandHandler.isCommand(input)) {
                if (commands.handle(input) == ShellCommandHandler.Outcome.EXIT) {
                    break;
                }
                continue;
            }
            runTurn(input, out, printer);
        }
        log.info("shell.exit turns={}", turns);
    }

    void runTurn(String input, PrintStream out, ResponsePrinter printer) {
        InterruptSubscription interrupt = interruptChannel.subscribe();
        AgentRecord turn = new AgentRecord("main-" + (++turns), input, "main", conversation, properties.getMaxLoops());
        try {
            agentLoop.run(turn, interrupt, printer);
        } catch (AgentCancelledException e) {
            out.println("CTRL-C");
            int killed = bashTool.killRunning();
            log.info("shell.turn.cancelled turn={} killedCommands={}", turn.getId(), killed);
        } catch (MaxIterationsException e) {
            out.println("Error: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("shell.turn.failed turn={}", turn.getId(), e);
            out.println("Error: " + e.getMessage());
        }
    }
}
