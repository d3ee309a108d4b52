package com.ai.tpr.service;

import com.ai.tpr.conversation.ClassificationContext;
import com.ai.tpr.conversation.IntentResult;
import com.ai.tpr.dto.WorkflowResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry for free-text messages: classify against the session's stage, then hand
 * the typed intent to the engine.
 */
@Service
public class WorkflowOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(WorkflowOrchestrator.class);

    private final IntentClassifier intentClassifier;
    private final WorkflowEngine workflowEngine;

    public WorkflowOrchestrator(IntentClassifier intentClassifier, WorkflowEngine workflowEngine) {
        this.intentClassifier = intentClassifier;
        this.workflowEngine = workflowEngine;
    }

    public WorkflowResponse process(String sessionId, String message) {
        ClassificationContext context = workflowEngine.contextFor(sessionId);
        IntentResult intent = intentClassifier.classify(message, context);
        log.debug("[{}] classified at {}: {}", sessionId, context.getStage(), intent);
        return workflowEngine.handleInput(sessionId, intent);
    }
}
