package com.ai.tpr.calculation;

import lombok.Value;

import java.util.List;

/**
 * Output of one calculation run, owned by the caller.
 */
@Value
public class CalculationResult {

    AgeGroup ageGroup;
    double urbanThreshold;
    List<WardAggregate> wards;
    List<DataQualityIssue> issues;

    public TprSummary summary() {
        return TprSummary.of(wards);
    }
}
