package com.zzf.miniagent.agent;

import com.zzf.miniagent.context.ConversationStore;
import com.zzf.miniagent.directive.Directive;
import com.zzf.miniagent.directive.DirectiveParser;
import com.zzf.miniagent.directive.ToolCall;
import com.zzf.miniagent.interrupt.InterruptSubscription;
import com.zzf.miniagent.llm.LLMClient;
import com.zzf.miniagent.llm.Message;
import com.zzf.miniagent.tool.Tool;
import com.zzf.miniagent.tool.ToolRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Drives one {@link AgentRecord}: complete, parse, execute, append, until a final answer,
 * the iteration cap or an interrupt. Model and tool waits are raced against the interrupt.
 */
@Slf4j
public class AgentLoop {

    public static final String CONTINUE_NUDGE = "Continue. If finished, wrap the final answer in <final>...</final>.";
    public static final String CANCELLED_REASON = "cancelled by user";
    public static final String MAX_ITERATIONS_REASON = "max iterations reached";

    private final LLMClient llmClient;
    private final ToolRegistry toolRegistry;
    private final DirectiveParser directiveParser;
    private final ParallelTaskRunner parallelRunner;

    public AgentLoop(LLMClient llmClient, ToolRegistry toolRegistry, DirectiveParser directiveParser,
                     ParallelTaskRunner parallelRunner) {
        this.llmClient = llmClient;
        this.toolRegistry = toolRegistry;
        this.directiveParser = directiveParser;
        this.parallelRunner = parallelRunner;
    }

    public String run(AgentRecord record, InterruptSubscription interrupt) {
        return run(record, interrupt, AgentLoopListener.NONE);
    }

    /**
     * @return the final answer
     * @throws AgentCancelledException if the interrupt fired
     * @throws MaxIterationsException if no final answer came within the cap
     */
    public String run(AgentRecord record, InterruptSubscription interrupt, AgentLoopListener listener) {
        ConversationStore conversation = record.getConversation();
        if (record.markRunning()) {
            conversation.append(Message.user(record.getTask()));
            log.info("agent.start id={} kind={} maxIterations={}",
                    record.getId(), record.getAgentKind(), record.getMaxIterations());
        }

        while (true) {
            if (record.getStatus().isTerminal() || isInterrupted(interrupt)) {
                throw cancelled(record);
            }
            int iteration = record.nextIteration();
            log.debug("agent.iteration id={} iteration={}/{}", record.getId(), iteration, record.getMaxIterations());

            String response;
            try {
                response = await(llmClient.complete(conversation.snapshot()), interrupt);
            } catch (CancellationException e) {
                throw cancelled(record);
            } catch (ExecutionException e) {
                String error = messageOf(e.getCause());
                log.warn("agent.llm.error id={} iteration={} err={}", record.getId(), iteration, error);
                conversation.append(Message.user("Error: " + error));
                checkIterationCap(record, iteration);
                compact(record, interrupt);
                continue;
            }

            conversation.append(Message.assistant(response));
            listener.onResponse(record.getId(), iteration, response);

            Directive directive = directiveParser.parse(response);
            switch (directive.getType()) {
                case TOOL_CALL:
                    runTool(record, directive, interrupt, listener);
                    break;
                case FINAL_ANSWER:
                    String answer = directive.getFinalText();
                    conversation.append(Message.assistant(answer));
                    if (!record.complete(answer)) {
                        throw cancelled(record);
                    }
                    log.info("agent.completed id={} iterations={}", record.getId(), iteration);
                    return answer;
                default:
                    checkIterationCap(record, iteration);
                    conversation.append(Message.user(CONTINUE_NUDGE));
                    break;
            }
            compact(record, interrupt);
        }
    }

    private void runTool(AgentRecord record, Directive directive, InterruptSubscription interrupt,
                         AgentLoopListener listener) {
        ToolCall call = directive.getToolCall();
        listener.onToolCall(record.getId(), call.getName(), String.valueOf(call.getArgs()));
        log.info("agent.tool.call id={} tool={}", record.getId(), call.getName());

        String output;
        Tool tool = toolRegistry.get(call.getName());
        if (tool == null) {
            output = "Error: Tool '" + call.getName() + "' not found";
        } else {
            if (isInterrupted(interrupt)) {
                throw cancelled(record);
            }
            try {
                output = await(invoke(tool, call), interrupt);
            } catch (CancellationException e) {
                throw cancelled(record);
            } catch (ExecutionException e) {
                output = "Error: " + messageOf(e.getCause());
                log.warn("agent.tool.error id={} tool={} err={}", record.getId(), call.getName(), output);
            }
        }
        record.getConversation().append(Message.user("Tool '" + call.getName() + "' output:\n" + output));
        listener.onToolOutput(record.getId(), call.getName(), output);

        if (directive.hasParallelTasks() && parallelRunner != null) {
            log.info("agent.parallel.start id={} tasks={}", record.getId(), directive.getParallelTasks().size());
            List<String> results = parallelRunner.runParallel(directive.getParallelTasks(), interrupt);
            record.getConversation().append(Message.user("Parallel tasks results:\n" + String.join("\n---\n", results)));
            listener.onParallelResults(record.getId(), results);
        }
    }

    private static CompletableFuture<String> invoke(Tool tool, ToolCall call) {
        try {
            CompletableFuture<String> future = tool.execute(call.getArgs());
            return future != null ? future : CompletableFuture.completedFuture("");
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static String await(CompletableFuture<String> operation, InterruptSubscription interrupt)
            throws ExecutionException {
        try {
            String value = interrupt != null ? interrupt.race(operation) : operation.join();
            return value == null ? "" : value;
        } catch (CompletionException e) {
            throw new ExecutionException(e.getCause() != null ? e.getCause() : e);
        }
    }

    private static void checkIterationCap(AgentRecord record, int iteration) {
        if (iteration >= record.getMaxIterations()) {
            record.fail(MAX_ITERATIONS_REASON);
            log.warn("agent.failed id={} reason={}", record.getId(), MAX_ITERATIONS_REASON);
            throw new MaxIterationsException(record.getMaxIterations());
        }
    }

    private static boolean isInterrupted(InterruptSubscription interrupt) {
        return interrupt != null && interrupt.isInterrupted();
    }

    private void compact(AgentRecord record, InterruptSubscription interrupt) {
        try {
            record.getConversation().compact(llmClient, interrupt);
        } catch (RuntimeException e) {
            log.debug("agent.compact.failed id={} err={}", record.getId(), e.getMessage());
        }
    }

    private static AgentCancelledException cancelled(AgentRecord record) {
        record.cancel(CANCELLED_REASON);
        log.warn("agent.cancelled id={}", record.getId());
        return new AgentCancelledException("Agent " + record.getId() + " " + CANCELLED_REASON);
    }

    private static String messageOf(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
