package com.ai.tpr.exception;

/**
 * Fatal workflow failure. Recoverable outcomes are returned as responses instead.
 */
public class WorkflowException extends RuntimeException {

    private final String sessionId;

    public WorkflowException(String sessionId, String message) {
        super("[" + sessionId + "] " + message);
        this.sessionId = sessionId;
    }

    public WorkflowException(String sessionId, String message, Throwable cause) {
        super("[" + sessionId + "] " + message, cause);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
