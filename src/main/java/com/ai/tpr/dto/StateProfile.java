package com.ai.tpr.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class StateProfile {

    String name;
    int recordCount;
    int facilityCount;
    int wardCount;
    int lgaCount;
    double totalTests;
}
