package com.ai.tpr.dto;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class StartWorkflowRequest {

    private String datasetHandle;
}
