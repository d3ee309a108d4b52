package com.ai.tpr.threshold;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Read-only diagnostics over one calculation run.
 */
@Value
@Builder
public class ViolationReport {

    double urbanThreshold;
    double ruralThreshold;
    int wardsChecked;
    @Singular
    List<WardViolation> urbanViolations;
    @Singular
    List<WardViolation> ruralViolations;
    /** LGA to its violating wards, only LGAs with at least two. */
    Map<String, List<String>> clusteredLgas;
    int severeViolations;
    int extremeViolations;
    Double meanViolationTpr;
    Double maxViolationTpr;
    int lowFacilityUrbanViolations;
    @Singular
    List<Recommendation> recommendations;
    String summary;

    public boolean hasViolations() {
        return !urbanViolations.isEmpty() || !ruralViolations.isEmpty();
    }

    public int totalViolations() {
        return urbanViolations.size() + ruralViolations.size();
    }
}
