package com.libraryindex.agent.exception;

/**
 * Permanent language-model failure, such as bad credentials or a decommissioned
 * model. Not retried, not counted by the circuit breaker,
 * and terminates the session.
 */
public class LlmUnavailableException extends ResearchException {

    public LlmUnavailableException(String message) {
        super(message);
    }

    public LlmUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
