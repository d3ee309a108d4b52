package com.ai.tpr.exception;

public class SessionStoreException extends WorkflowException {

    public SessionStoreException(String sessionId, String message, Throwable cause) {
        super(sessionId, message, cause);
    }
}
