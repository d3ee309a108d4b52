package com.ai.tpr.calculation;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * One row of the facility register for a reporting period. Immutable once ingested.
 */
@Value
@Builder
@Jacksonized
public class FacilityRecord {

    String facilityName;
    String ward;
    String lga;
    String state;
    FacilityLevel facilityLevel;
    @Singular("cohort")
    Map<AgeGroup, CohortTests> tests;
    Double outpatientAttendance;
    Boolean urban;
    Double urbanPercentage;

    /**
     * Counts for the requested group. For {@link AgeGroup#ALL_AGES} each method is
     * summed across the cohorts first.
     */
    public CohortTests testsFor(AgeGroup group) {
        if (group.isCohort()) {
            return tests.getOrDefault(group, CohortTests.empty());
        }
        CohortTests total = CohortTests.empty();
        for (AgeGroup cohort : AgeGroup.cohorts()) {
            total = total.plus(tests.get(cohort));
        }
        return total;
    }
}
