package com.zzf.miniagent.agent;

import com.zzf.miniagent.context.ConversationStore;
import com.zzf.miniagent.directive.DirectiveParser;
import com.zzf.miniagent.directive.SubTaskSpec;
import com.zzf.miniagent.interrupt.InterruptSubscription;
import com.zzf.miniagent.llm.LLMClient;
import com.zzf.miniagent.tool.ToolRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Registry of sub-agents. Spawns them, runs them alone or as a parallel batch, and cancels them.
 * No lock is held while waiting on an agent, so agents may spawn nested batches.
 */
@Slf4j
public class SubAgentOrchestrator implements ParallelTaskRunner {

    private final Map<String, AgentRecord> agents = new ConcurrentHashMap<>();
    private final AgentPrompts prompts;
    private final ToolRegistry toolRegistry;
    private final ExecutorService executor;
    private final AgentLoop agentLoop;
    private final int conversationMaxTokens;

    public SubAgentOrchestrator(LLMClient llmClient, ToolRegistry toolRegistry, DirectiveParser directiveParser,
                                AgentPrompts prompts, ExecutorService executor, int conversationMaxTokens) {
        this.prompts = prompts;
        this.toolRegistry = toolRegistry;
        this.executor = executor;
        this.conversationMaxTokens = conversationMaxTokens;
        this.agentLoop = new AgentLoop(llmClient, toolRegistry, directiveParser, this);
    }

    public String spawn(SubTaskSpec spec) {
        return spawn(spec.getTask(), spec.getAgentKind(), spec.getMaxIterations());
    }

    /**
     * Registers a PENDING agent primed with its kind prompt and the tool instructions.
     *
     * @return the new agent id
     * @throws AgentSpawnException on an empty task, a non-positive cap or a missing prompt
     */
    public String spawn(String task, String agentKind, int maxIterations) {
        if (task == null || task.isBlank()) {
            throw new AgentSpawnException("task must not be empty");
        }
        if (maxIterations <= 0) {
            throw new AgentSpawnException("max iterations must be positive, got " + maxIterations);
        }
        String kind = agentKind == null || agentKind.isBlank() ? AgentPrompts.DEFAULT_KIND : agentKind;

        ConversationStore conversation = new ConversationStore(conversationMaxTokens);
        conversation.injectSystem(prompts.promptFor(kind) + "\n\n"
                + ToolRegistry.FINAL_INSTRUCTIONS + toolRegistry.generateToolInstructions());

        while (true) {
            String id = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
            AgentRecord record = new AgentRecord(id, task, kind, conversation, maxIterations);
            if (agents.putIfAbsent(id, record) == null) {
                log.info("subagent.spawn id={} kind={} maxIterations={}", id, kind, maxIterations);
                return id;
            }
        }
    }

    public Optional<AgentRecord> get(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(agents.get(id));
    }

    public List<AgentRecord> list() {
        List<AgentRecord> out = new ArrayList<>(agents.values());
        out.sort(Comparator.comparing(AgentRecord::getId));
        return out;
    }

    /**
     * Fails a PENDING or RUNNING agent. No-op for unknown or finished agents.
     */
    public boolean cancel(String id, String reason) {
        AgentRecord record = agents.get(id);
        if (record == null) {
            return false;
        }
        boolean cancelled = record.cancel(reason);
        if (cancelled) {
            log.info("subagent.cancel id={} reason={}", id, reason);
        }
        return cancelled;
    }

    public CompletableFuture<String> start(String id, InterruptSubscription interrupt) {
        AgentRecord record = agents.get(id);
        if (record == null) {
            return CompletableFuture.failedFuture(new AgentException("SubAgent " + id + " not found"));
        }
        return CompletableFuture.supplyAsync(() -> agentLoop.run(record, interrupt), executor);
    }

    /**
     * Runs one sub-agent and renders its outcome as tool output.
     */
    public String runSingle(String task, String agentKind, int maxIterations, InterruptSubscription interrupt) {
        String id;
        try {
            id = spawn(task, agentKind, maxIterations);
        } catch (AgentSpawnException e) {
            return "SubAgent [" + agentKind + "] failed to spawn: " + e.getMessage();
        }
        CompletableFuture<String> future = start(id, interrupt == null ? null : interrupt.fork());
        try {
            String result = interrupt != null ? interrupt.race(future) : future.join();
            return "SubAgent [" + agentKind + "] completed:\n" + result;
        } catch (CancellationException e) {
            future.cancel(true);
            cancel(id, AgentLoop.CANCELLED_REASON);
            return "SubAgent [" + agentKind + "] cancelled by user";
        } catch (CompletionException e) {
            Throwable cause = unwrap(e);
            if (cause instanceof AgentCancelledException) {
                return "SubAgent [" + agentKind + "] cancelled by user";
            }
            return "SubAgent [" + agentKind + "] failed: " + cause.getMessage();
        }
    }

    /**
     * Runs every spec concurrently. Spawn failures become ERROR lines; on interrupt the
     * outstanding agents are cancelled and reported as CANCELLED.
     *
     * @return one line per spec, in completion order
     */
    @Override
    public List<String> runParallel(List<SubTaskSpec> batch, InterruptSubscription interrupt) {
        List<String> results = new ArrayList<>();
        if (batch == null || batch.isEmpty()) {
            return results;
        }
        log.info("subagent.parallel.start tasks={}", batch.size());

        Map<String, AgentRecord> outstanding = new LinkedHashMap<>();
        Map<String, CompletableFuture<String>> futures = new LinkedHashMap<>();
        BlockingQueue<Outcome> outcomes = new LinkedBlockingQueue<>();

        for (SubTaskSpec spec : batch) {
            String id;
            try {
                id = spawn(spec);
            } catch (AgentSpawnException e) {
                log.warn("subagent.parallel.spawn_failed kind={} err={}", spec.getAgentKind(), e.getMessage());
                results.add("[" + spec.getAgentKind() + "] ERROR: " + spec.getTask() + " - " + e.getMessage());
                continue;
            }
            outstanding.put(id, agents.get(id));
        }
        for (AgentRecord record : outstanding.values()) {
            CompletableFuture<String> future = start(record.getId(), interrupt == null ? null : interrupt.fork());
            futures.put(record.getId(), future);
            future.whenComplete((value, error) -> outcomes.add(new Outcome(record, value, error)));
        }

        CompletableFuture<Long> interrupted = interrupt != null ? interrupt.changed() : new CompletableFuture<>();
        interrupted.thenRun(() -> outcomes.add(Outcome.INTERRUPTED));
        try {
            while (!outstanding.isEmpty()) {
                Outcome outcome;
                try {
                    outcome = outcomes.take();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    outcome = Outcome.INTERRUPTED;
                }
                if (outcome == Outcome.INTERRUPTED) {
                    for (AgentRecord record : outstanding.values()) {
                        futures.get(record.getId()).cancel(true);
                        cancel(record.getId(), AgentLoop.CANCELLED_REASON);
                        results.add("[" + record.getAgentKind() + "] CANCELLED: " + record.getTask());
                    }
                    outstanding.clear();
                    break;
                }
                if (outstanding.remove(outcome.record.getId()) != null) {
                    results.add(outcome.render());
                }
            }
        } finally {
            if (interrupt != null) {
                interrupt.release(interrupted);
            }
        }
        log.info("subagent.parallel.done results={}", results.size());
        return results;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static final class Outcome {
        static final Outcome INTERRUPTED = new Outcome(null, null, null);

        final AgentRecord record;
        final String value;
        final Throwable error;

        Outcome(AgentRecord record, String value, Throwable error) {
            this.record = record;
            this.value = value;
            this.error = error;
        }

        String render() {
            String kind = record.getAgentKind();
            if (error == null) {
                return "[" + kind + "] Task: " + record.getTask() + "\nResult: " + value;
            }
            Throwable cause = unwrap(error);
            if (cause instanceof AgentCancelledException || cause instanceof CancellationException) {
                return "[" + kind + "] CANCELLED: " + record.getTask();
            }
            return "[" + kind + "] ERROR: " + record.getTask() + " - " + cause.getMessage();
        }
    }
}
