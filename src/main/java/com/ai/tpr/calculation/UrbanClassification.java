package com.ai.tpr.calculation;

import lombok.Value;

@Value
public class UrbanClassification {

    boolean urban;
    double urbanPercentage;
    UrbanSource source;
}
