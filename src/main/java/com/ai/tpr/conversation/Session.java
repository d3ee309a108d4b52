package com.ai.tpr.conversation;

import lombok.Getter;
import lombok.Setter;

import java.util.Objects;

/**
 * Workflow state of one conversation. Mutated only by the workflow engine, on a
 * private copy that is written back through the session store.
 * <p>
 * {@code version} is assigned by the store; {@code null} means never saved.
 */
@Getter
@Setter
public class Session {

    private final String sessionId;
    private WorkflowStage stage = WorkflowStage.INITIAL;
    private Selections selections = Selections.none();
    private String datasetHandle;
    private CompletionReason completionReason;
    private Long version;

    public Session(String sessionId) {
        this.sessionId = sessionId;
    }

    public Session copy() {
        Session copy = new Session(sessionId);
        copy.stage = stage;
        copy.selections = selections;
        copy.datasetHandle = datasetHandle;
        copy.completionReason = completionReason;
        copy.version = version;
        return copy;
    }

    public boolean isComplete() {
        return stage == WorkflowStage.COMPLETE;
    }

    public boolean sameStateAs(Session other) {
        return other != null
                && stage == other.stage
                && selections.equals(other.selections)
                && Objects.equals(datasetHandle, other.datasetHandle)
                && completionReason == other.completionReason;
    }
}
