package com.libraryindex.agent.exception;

/**
 * The provider rejected one specific request (400/413/422, e.g. context too long).
 * Not retryable, but says nothing about the provider as a whole, so only the
 * owning unit of work fails.
 */
public class LlmRequestRejectedException extends ResearchException {

    public LlmRequestRejectedException(String message) {
        super(message);
    }
}
