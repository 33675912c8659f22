package com.zzf.miniagent.llm;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Completion capability. A system message, when present, is always at index 0
 * of the list, optionally followed by a compaction summary.
 */
@FunctionalInterface
public interface LLMClient {

    CompletableFuture<String> complete(List<Message> messages);
}
