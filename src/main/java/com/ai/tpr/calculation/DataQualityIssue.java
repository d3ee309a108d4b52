package com.ai.tpr.calculation;

import lombok.Value;

/**
 * A reported, non-fatal problem found while aggregating. Values are never
 * corrected; the issue says what was seen and how it was treated.
 */
@Value
public class DataQualityIssue {

    public enum Kind {
        /** A count below zero; the row is left out of the ward sums. */
        NEGATIVE_COUNT,
        /** More positives than tests for a method; the row is kept as reported. */
        POSITIVE_EXCEEDS_TESTED,
        /** No tests in the ward; TPR is missing. */
        ZERO_DENOMINATOR,
        /** Urban ward above the threshold without outpatient attendance to recalculate with. */
        ALTERNATIVE_DENOMINATOR_UNAVAILABLE
    }

    Kind kind;
    String ward;
    String lga;
    String facilityName;
    String detail;
}
