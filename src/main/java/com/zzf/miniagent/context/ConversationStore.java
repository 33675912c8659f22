package com.zzf.miniagent.context;

import com.zzf.miniagent.interrupt.InterruptSubscription;
import com.zzf.miniagent.llm.LLMClient;
import com.zzf.miniagent.llm.Message;
import com.zzf.miniagent.llm.Role;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Ordered message log of one agent, with lossy compaction once the estimated
 * token count passes the configured threshold.
 * <p>
 * At most one System message exists and, if present, it is at index 0. The summary
 * written by {@link #compact(LLMClient)} is the only other System entry allowed.
 */
@Slf4j
public class ConversationStore {

    public static final String SUMMARY_PREFIX = "Previous conversation summary: ";
    public static final String SUMMARY_FAILED = "... Conversation compressed (summary failed) ...";
    public static final String SUMMARY_UNAVAILABLE = "... Old conversation compressed ...";
    static final String SUMMARY_REQUEST =
            "Summarize the following conversation history into a single paragraph. Ignore system messages if any.\n\n";
    static final int KEEP_TAIL = 4;
    static final int MIN_MESSAGES = 5;

    private final List<Message> messages = new ArrayList<>();
    private final int maxTokens;

    public ConversationStore(int maxTokens) {
        this.maxTokens = maxTokens;
    }

    public synchronized void append(Message message) {
        if (message == null) {
            return;
        }
        messages.add(message);
    }

    public synchronized List<Message> snapshot() {
        return Collections.unmodifiableList(new ArrayList<>(messages));
    }

    public synchronized int size() {
        return messages.size();
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    /**
     * Drops every message. Callers re-inject the system prompt afterwards.
     */
    public synchronized void reset() {
        messages.clear();
    }

    /**
     * Replaces the whole log, e.g. with a restored session.
     */
    public synchronized void load(List<Message> restored) {
        messages.clear();
        if (restored != null) {
            for (Message message : restored) {
                if (message != null) {
                    messages.add(message);
                }
            }
        }
    }

    public synchronized void injectSystem(String text) {
        Message system = Message.system(text);
        if (!messages.isEmpty() && messages.get(0).getRole() == Role.SYSTEM) {
            messages.set(0, system);
        } else {
            messages.add(0, system);
        }
    }

    public synchronized int estimateTokens() {
        long chars = 0;
        for (Message message : messages) {
            chars += message.getContent().length();
        }
        return (int) Math.min(Integer.MAX_VALUE, chars / 4);
    }

    public boolean compact(LLMClient summarizer) {
        return compact(summarizer, null);
    }

    /**
     * Summarizes everything between the leading system prompt and the last four messages.
     * Blocks on the summarizer, raced against {@code interrupt} when one is given. A failed
     * summary is replaced by a placeholder; an interrupted one leaves the log untouched.
     *
     * @param summarizer completion capability used for the summary, may be null
     * @param interrupt subscription that abandons the summary call, may be null
     * @return true if the log was rewritten
     */
    public boolean compact(LLMClient summarizer, InterruptSubscription interrupt) {
        Message system;
        List<Message> middle;
        List<Message> tail;
        int before;
        synchronized (this) {
            before = estimateTokens();
            if (before <= maxTokens || messages.size() <= MIN_MESSAGES) {
                return false;
            }
            boolean hasSystem = messages.get(0).getRole() == Role.SYSTEM;
            int start = hasSystem ? 1 : 0;
            int tailStart = messages.size() - KEEP_TAIL;
            if (tailStart <= start) {
                return false;
            }
            system = hasSystem ? messages.get(0) : null;
            middle = new ArrayList<>(messages.subList(start, tailStart));
            tail = new ArrayList<>(messages.subList(tailStart, messages.size()));
        }

        String summary;
        try {
            summary = summarize(summarizer, middle, interrupt);
        } catch (CancellationException e) {
            log.info("context.compact.interrupted messages={}", middle.size());
            return false;
        }

        synchronized (this) {
            messages.clear();
            if (system != null) {
                messages.add(system);
            }
            messages.add(Message.system(SUMMARY_PREFIX + summary));
            messages.addAll(tail);
            log.info("context.compact.done summarized={} tokensBefore={} tokensAfter={}",
                    middle.size(), before, estimateTokens());
        }
        return true;
    }

    private String summarize(LLMClient summarizer, List<Message> middle, InterruptSubscription interrupt) {
        if (summarizer == null) {
            return SUMMARY_UNAVAILABLE;
        }
        StringBuilder transcript = new StringBuilder();
        for (Message message : middle) {
            transcript.append(message.getRole().label()).append(": ").append(message.getContent()).append("\n");
        }
        try {
            CompletableFuture<String> request = summarizer.complete(List.of(Message.user(SUMMARY_REQUEST + transcript)));
            String summary = interrupt != null ? interrupt.race(request) : request.join();
            return summary == null ? "" : summary.trim();
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
            log.warn("context.compact.summary_failed err={}", cause.getMessage());
            return SUMMARY_FAILED;
        }
    }
}
