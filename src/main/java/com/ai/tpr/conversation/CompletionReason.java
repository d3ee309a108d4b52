package com.ai.tpr.conversation;

public enum CompletionReason {
    CALCULATED,
    EXITED
}
