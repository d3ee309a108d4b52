package com.ai.tpr.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * What a workflow needs to know about an uploaded dataset before the first selection.
 * States are ordered by total tests, most data first.
 */
@Value
@Builder
public class DatasetSummary {

    String datasetHandle;
    int recordCount;
    List<StateProfile> states;

    public boolean isSingleState() {
        return states.size() == 1;
    }
}
