package com.libraryindex.agent.exception;

/**
 * A session with the requested id is already running.
 */
public class SessionConflictException extends ResearchException {

    public SessionConflictException(String sessionId) {
        super("Session " + sessionId + " is already running");
    }
}
