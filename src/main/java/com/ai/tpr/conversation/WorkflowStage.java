package com.ai.tpr.conversation;

/**
 * Stages in order. Each selection stage owns exactly one selection.
 */
public enum WorkflowStage {
    INITIAL,
    STATE_SELECTION,
    FACILITY_LEVEL_SELECTION,
    AGE_GROUP_SELECTION,
    CALCULATING,
    COMPLETE;

    public boolean isSelectionStage() {
        return this == STATE_SELECTION || this == FACILITY_LEVEL_SELECTION || this == AGE_GROUP_SELECTION;
    }

    public boolean isAfter(WorkflowStage other) {
        return ordinal() > other.ordinal();
    }
}
