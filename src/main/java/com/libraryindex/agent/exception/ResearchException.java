package com.libraryindex.agent.exception;

/**
 * Root of the research engine's exception hierarchy.
 * Unchecked so collaborator failures can cross lambda boundaries in the worker pool.
 */
public class ResearchException extends RuntimeException {

    public ResearchException(String message) {
        super(message);
    }

    public ResearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
