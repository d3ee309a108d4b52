package com.ai.tpr.service;

import com.ai.tpr.conversation.IntentResult;
import com.ai.tpr.conversation.Session;

/**
 * Answers information, data and analysis questions. The workflow engine passes
 * the answer through unmodified and appends a reminder of valid next inputs.
 */
public interface ExplanationDelegate {

    /**
     * @param session read-only snapshot of the session
     */
    String explain(Session session, IntentResult intent);
}
