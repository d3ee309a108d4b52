package com.ai.tpr.conversation;

public enum IntentKind {
    SELECTION,
    INFORMATION,
    DATA_INQUIRY,
    ANALYSIS_REQUEST,
    NAVIGATION,
    UNCLEAR;

    /** Intents answered by the explanation delegate without touching the session. */
    public boolean isDelegated() {
        return this == INFORMATION || this == DATA_INQUIRY || this == ANALYSIS_REQUEST;
    }
}
