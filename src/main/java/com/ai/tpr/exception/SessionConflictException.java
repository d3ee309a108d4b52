package com.ai.tpr.exception;

/**
 * The stored session changed since it was loaded.
 */
public class SessionConflictException extends WorkflowException {

    public SessionConflictException(String sessionId, Long expectedVersion, Long actualVersion) {
        super(sessionId, "Session version conflict: expected=" + expectedVersion + " actual=" + actualVersion);
    }

    public SessionConflictException(String sessionId, Throwable cause) {
        super(sessionId, "Session version conflict", cause);
    }
}
