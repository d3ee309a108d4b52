package com.ai.tpr.exception;

public class DatasetNotFoundException extends WorkflowException {

    public DatasetNotFoundException(String sessionId, String datasetHandle) {
        super(sessionId, "Dataset not registered: " + datasetHandle);
    }
}
