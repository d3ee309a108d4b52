package com.ai.tpr.exception;

import com.ai.tpr.conversation.IntentResult;

public class MalformedIntentException extends WorkflowException {

    public MalformedIntentException(String sessionId, IntentResult intent) {
        super(sessionId, "Malformed classifier result: " + intent);
    }
}
