package com.zzf.miniagent.cli;

import com.zzf.miniagent.context.ConversationStore;
import com.zzf.miniagent.session.SessionManager;
import com.zzf.miniagent.tool.Tool;
import com.zzf.miniagent.tool.ToolRegistry;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.PrintStream;

/**
 * Slash commands of the interactive shell. They never reach the model.
 */
@Slf4j
public class ShellCommandHandler {

    public enum Outcome {
        CONTINUE,
        EXIT
    }

    private final SessionManager sessionManager;
    private final ConversationStore conversation;
    private final ToolRegistry toolRegistry;
    private final PrintStream out;

    public ShellCommandHandler(SessionManager sessionManager, ConversationStore conversation,
                               ToolRegistry toolRegistry, PrintStream out) {
        this.sessionManager = sessionManager;
        this.conversation = conversation;
        this.toolRegistry = toolRegistry;
        this.out = out;
    }

    public static boolean isCommand(String input) {
        return input != null && input.startsWith("/");
    }

    public Outcome handle(String input) {
        String[] parts = input.trim().split("\\s+");
        String argument = parts.length > 1 ? parts[1] : null;
        switch (parts[0]) {
            case "/quit":
            case "/exit":
                return Outcome.EXIT;
            case "/help":
                out.println("Commands:");
                out.println("  /save <name> - Save session");
                out.println("  /load <name> - Load session");
                out.println("  /list - List sessions");
                out.println("  /clear - Clear context");
                out.println("  /tools - List tools");
                out.println("  /quit - Exit");
                break;
            case "/save":
                save(argument);
                break;
            case "/load":
                load(argument);
                break;
            case "/list":
                try {
                    out.println("Sessions: " + sessionManager.list());
                } catch (IOException e) {
                    out.println("Error listing sessions: " + e.getMessage());
                }
                break;
            case "/clear":
                conversation.reset();
                conversation.injectSystem(toolRegistry.generateSystemPrompt());
                out.println("Context cleared");
                break;
            case "/tools":
                for (Tool tool : toolRegistry.list()) {
                    out.println("- " + tool.getId() + ": " + tool.getDescription());
                }
                break;
            default:
                out.println("Unknown command. Type /help");
                break;
        }
        return Outcome.CONTINUE;
    }

    private void save(String name) {
        if (name == null) {
            out.println("Usage: /save <name>");
            return;
        }
        try {
            sessionManager.save(name, conversation);
            out.println("Session saved as: " + name);
        } catch (IOException | IllegalArgumentException e) {
            log.warn("session.save.failed name={} err={}", name, e.getMessage());
            out.println("Error saving session: " + e.getMessage());
        }
    }

    private void load(String name) {
        if (name == null) {
            out.println("Usage: /load <name>");
            return;
        }
        try {
            sessionManager.load(name, conversation);
            conversation.injectSystem(toolRegistry.generateSystemPrompt());
            out.println("Session loaded");
        } catch (IOException | IllegalArgumentException e) {
            log.warn("session.load.failed name={} err={}", name, e.getMessage());
            out.println("Error loading session: " + e.getMessage());
        }
    }
}
