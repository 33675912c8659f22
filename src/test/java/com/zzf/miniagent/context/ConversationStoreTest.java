package com.zzf.miniagent.context;

import com.zzf.miniagent.interrupt.InterruptChannel;
import com.zzf.miniagent.interrupt.InterruptSubscription;
import com.zzf.miniagent.llm.LLMClient;
import com.zzf.miniagent.llm.LLMException;
import com.zzf.miniagent.llm.Message;
import com.zzf.miniagent.llm.Role;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConversationStoreTest {

    private static final String LONG = "x".repeat(400);

    @Test
    void injectSystemInsertsAtHeadAndReplacesExisting() {
        ConversationStore store = new ConversationStore(1000);
        store.append(Message.user("hi"));

        store.injectSystem("first");
        store.injectSystem("second");

        List<Message> messages = store.snapshot();
        assertEquals(2, messages.size());
        assertEquals(Message.system("second"), messages.get(0));
        assertEquals(Message.user("hi"), messages.get(1));
    }

    @Test
    void snapshotIsReadOnlyCopy() {
        ConversationStore store = new ConversationStore(1000);
        store.append(Message.user("a"));
        List<Message> snapshot = store.snapshot();
        store.append(Message.user("b"));

        assertEquals(1, snapshot.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(Message.user("c")));
    }

    @Test
    void resetClearsEverything() {
        ConversationStore store = new ConversationStore(1000);
        store.injectSystem("sys");
        store.append(Message.user("a"));
        store.reset();
        assertEquals(0, store.size());
    }

    @Test
    void compactIsNoOpAtOrBelowThreshold() {
        ConversationStore store = new ConversationStore(100);
        for (int i = 0; i < 10; i++) {
            store.append(Message.user("y".repeat(40)));
        }
        assertEquals(100, store.estimateTokens());

        assertFalse(store.compact(failOnCall()));
        assertEquals(10, store.size());
    }

    @Test
    void compactIsNoOpWithFiveOrFewerMessages() {
        ConversationStore store = new ConversationStore(10);
        store.injectSystem(LONG);
        for (int i = 0; i < 4; i++) {
            store.append(Message.user(LONG));
        }
        assertFalse(store.compact(failOnCall()));
        assertEquals(5, store.size());
    }

    @Test
    void compactKeepsSystemSummaryAndLastFour() {
        ConversationStore store = new ConversationStore(10);
        store.injectSystem("system prompt");
        List<Message> sent = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            store.append(i % 2 == 0 ? Message.user("u" + i + LONG) : Message.assistant("a" + i + LONG));
        }
        List<Message> tail = store.snapshot().subList(5, 9);

        boolean compacted = store.compact(messages -> {
            sent.addAll(messages);
            return CompletableFuture.completedFuture("  short summary  ");
        });

        assertTrue(compacted);
        List<Message> after = store.snapshot();
        assertEquals(6, after.size());
        assertEquals(Message.system("system prompt"), after.get(0));
        assertEquals(Message.system(ConversationStore.SUMMARY_PREFIX + "short summary"), after.get(1));
        assertEquals(tail, after.subList(2, 6));

        assertEquals(1, sent.size());
        assertEquals(Role.USER, sent.get(0).getRole());
        assertTrue(sent.get(0).getContent().startsWith(ConversationStore.SUMMARY_REQUEST));
        assertTrue(sent.get(0).getContent().contains("User: u0"));
        assertTrue(sent.get(0).getContent().contains("Assistant: a3"));
        assertFalse(sent.get(0).getContent().contains("system prompt"));
    }

    @Test
    void compactWithoutSystemMessageYieldsFiveMessages() {
        ConversationStore store = new ConversationStore(10);
        for (int i = 0; i < 7; i++) {
            store.append(Message.user(LONG + i));
        }
        assertTrue(store.compact(messages -> CompletableFuture.completedFuture("sum")));

        List<Message> after = store.snapshot();
        assertEquals(5, after.size());
        assertEquals(Role.SYSTEM, after.get(0).getRole());
        assertEquals(Message.user(LONG + 6), after.get(4));
    }

    @Test
    void summarizerFailureUsesPlaceholder() {
        ConversationStore store = new ConversationStore(10);
        store.injectSystem("sys");
        for (int i = 0; i < 6; i++) {
            store.append(Message.user(LONG));
        }

        assertTrue(store.compact(messages -> CompletableFuture.failedFuture(new LLMException("boom"))));
        assertEquals(ConversationStore.SUMMARY_PREFIX + ConversationStore.SUMMARY_FAILED,
                store.snapshot().get(1).getContent());
    }

    @Test
    void missingSummarizerUsesPlaceholder() {
        ConversationStore store = new ConversationStore(10);
        for (int i = 0; i < 6; i++) {
            store.append(Message.user(LONG));
        }
        assertTrue(store.compact(null));
        assertEquals(ConversationStore.SUMMARY_PREFIX + ConversationStore.SUMMARY_UNAVAILABLE,
                store.snapshot().get(0).getContent());
    }

    @Test
    void interruptedSummaryLeavesLogUntouched() {
        ConversationStore store = new ConversationStore(10);
        store.injectSystem("sys");
        for (int i = 0; i < 6; i++) {
            store.append(Message.user(LONG + i));
        }
        List<Message> before = store.snapshot();
        InterruptChannel channel = new InterruptChannel();
        InterruptSubscription interrupt = channel.subscribe();
        channel.interrupt();

        assertFalse(store.compact(messages -> new CompletableFuture<>(), interrupt));
        assertEquals(before, store.snapshot());
    }

    @Test
    void summaryFinishingWithoutInterruptIsApplied() {
        ConversationStore store = new ConversationStore(10);
        for (int i = 0; i < 6; i++) {
            store.append(Message.user(LONG + i));
        }

        assertTrue(store.compact(messages -> CompletableFuture.completedFuture("raced"),
                new InterruptChannel().subscribe()));
        assertEquals(ConversationStore.SUMMARY_PREFIX + "raced", store.snapshot().get(0).getContent());
    }

    @Test
    void compactIsIdempotentOnceBelowThreshold() {
        ConversationStore store = new ConversationStore(120);
        store.injectSystem("sys");
        for (int i = 0; i < 8; i++) {
            store.append(Message.user("z".repeat(100)));
        }
        assertTrue(store.compact(messages -> CompletableFuture.completedFuture("tiny")));
        List<Message> once = store.snapshot();

        assertFalse(store.compact(failOnCall()));
        assertEquals(once, store.snapshot());
    }

    private static LLMClient failOnCall() {
        return messages -> {
            throw new AssertionError("summarizer must not be called");
        };
    }
}
