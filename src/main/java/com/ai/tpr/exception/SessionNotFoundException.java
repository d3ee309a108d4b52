package com.ai.tpr.exception;

public class SessionNotFoundException extends WorkflowException {

    public SessionNotFoundException(String sessionId) {
        super(sessionId, "No workflow session; start one first");
    }
}
