package com.libraryindex.agent.exception;

/**
 * Recoverable language-model failure (5xx, 429, network, open circuit).
 * Fails only the unit of work that made the call.
 */
public class LlmTransientException extends ResearchException {

    public LlmTransientException(String message) {
        super(message);
    }

    public LlmTransientException(String message, Throwable cause) {
        super(message, cause);
    }
}
