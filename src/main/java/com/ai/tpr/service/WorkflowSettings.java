package com.ai.tpr.service;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class WorkflowSettings {

    @Builder.Default
    double urbanThreshold = 50.0;
    @Builder.Default
    double fuzzyCutoff = 0.75;
    /** Classifier results below this are treated as not understood. */
    @Builder.Default
    double minConfidence = 0.5;
    @Builder.Default
    int maxConflictRetries = 3;

    public static WorkflowSettings defaults() {
        return WorkflowSettings.builder().build();
    }
}
