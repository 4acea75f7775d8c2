package com.libraryindex.agent.exception;

/**
 * A required collaborator failed its capability check, e.g. the analysis cache
 * health check at session start.
 */
public class CollaboratorUnavailableException extends ResearchException {

    private final String collaborator;

    public CollaboratorUnavailableException(String collaborator, String message) {
        super(collaborator + " unavailable: " + message);
        this.collaborator = collaborator;
    }

    public CollaboratorUnavailableException(String collaborator, String message, Throwable cause) {
        super(collaborator + " unavailable: " + message, cause);
        this.collaborator = collaborator;
    }

    public String getCollaborator() {
        return collaborator;
    }
}
