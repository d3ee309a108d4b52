package com.ai.tpr.service;

import com.ai.tpr.conversation.ClassificationContext;
import com.ai.tpr.conversation.IntentResult;

/**
 * Turns free text into a typed intent for the current stage.
 */
public interface IntentClassifier {

    IntentResult classify(String message, ClassificationContext context);
}
