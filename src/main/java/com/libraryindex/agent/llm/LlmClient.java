package com.libraryindex.agent.llm;

import com.libraryindex.agent.model.LlmResponse;
import com.libraryindex.agent.model.Message;

import java.util.List;

/**
 * Language-model capability.
 *
 * Implementations must distinguish failure kinds:
 * {@link com.libraryindex.agent.exception.LlmUnavailableException} for permanent failures,
 * {@link com.libraryindex.agent.exception.LlmTransientException} for everything retryable.
 */
public interface LlmClient {

    /**
     * @param messages system + user messages for a single-turn completion
     * @param options  token budget / temperature overrides for this call
     */
    LlmResponse complete(List<Message> messages, CompletionOptions options);

    default String complete(List<Message> messages) {
        return complete(messages, CompletionOptions.DEFAULTS).getContent();
    }

    /** Label used in logs, e.g. "groq/llama-3.3-70b-versatile". */
    String describe();
}
