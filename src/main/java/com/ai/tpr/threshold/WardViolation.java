package com.ai.tpr.threshold;

import com.ai.tpr.calculation.TprMethod;
import lombok.Value;

/**
 * A ward whose TPR exceeded the threshold for its urban/rural class.
 */
@Value
public class WardViolation {

    String ward;
    String lga;
    double tpr;
    double threshold;
    boolean urban;
    TprMethod method;
    int facilityCount;

    public boolean isSevere() {
        return tpr > ThresholdDetector.SEVERE_TPR;
    }

    public boolean isExtreme() {
        return tpr > ThresholdDetector.EXTREME_TPR;
    }
}
