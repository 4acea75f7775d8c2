package com.libraryindex.agent.observability;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-run counters for observability, flushed to {@link ResearchRunTrace} at the end.
 *
 * Analyzers and pair merges report token usage from worker threads, so the
 * counters are atomic.
 */
public class RunContext {

    private final long startTimeMs = System.currentTimeMillis();

    private final AtomicInteger promptTokens = new AtomicInteger();
    private final AtomicInteger completionTokens = new AtomicInteger();
    private final AtomicInteger llmCalls = new AtomicInteger();

    public void addTokens(int prompt, int completion) {
        promptTokens.addAndGet(prompt);
        completionTokens.addAndGet(completion);
        llmCalls.incrementAndGet();
    }

    public long elapsedMs() {
        return System.currentTimeMillis() - startTimeMs;
    }

    public int getPromptTokens() {
        return promptTokens.get();
    }

    public int getCompletionTokens() {
        return completionTokens.get();
    }

    public int getLlmCalls() {
        return llmCalls.get();
    }

    public int totalTokens() {
        return promptTokens.get() + completionTokens.get();
    }
}
