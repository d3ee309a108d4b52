package com.ai.tpr.calculation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TprCalculatorTest {

    private final TprCalculator calculator = new TprCalculator(new PriorityUrbanClassifier());

    private static CohortTests tests(Double rdtTested, Double rdtPositive, Double micTested, Double micPositive) {
        return CohortTests.builder()
                .rdtTested(rdtTested).rdtPositive(rdtPositive)
                .microscopyTested(micTested).microscopyPositive(micPositive)
                .build();
    }

    private static FacilityRecord.FacilityRecordBuilder record(String facility, String ward, String lga) {
        return FacilityRecord.builder()
                .facilityName(facility)
                .ward(ward)
                .lga(lga)
                .state("Adamawa")
                .facilityLevel(FacilityLevel.PRIMARY);
    }

    private static WardAggregate only(CalculationResult result) {
        assertThat(result.getWards()).hasSize(1);
        return result.getWards().get(0);
    }

    @Nested
    @DisplayName("standard formula")
    class Standard {

        @Test
        @DisplayName("tested and positive are the per-method maxima, never the sum")
        void maxOfMethods() {
            FacilityRecord r = record("PHC Bille", "Bille", "Fufore")
                    .cohort(AgeGroup.UNDER_FIVE, tests(100.0, 30.0, 80.0, 25.0))
                    .build();

            WardAggregate ward = only(calculator.calculate(List.of(r), AgeGroup.UNDER_FIVE));

            assertThat(ward.getDenominator()).isEqualTo(100.0);
            assertThat(ward.getNumerator()).isEqualTo(30.0);
            assertThat(ward.getTprValue()).isEqualTo(30.0);
            assertThat(ward.getStandardTpr()).isEqualTo(30.0);
            assertThat(ward.getMethod()).isEqualTo(TprMethod.STANDARD);
        }

        @Test
        @DisplayName("ward totals are sums of per-row maxima")
        void sumOfRowMaxima() {
            List<FacilityRecord> rows = List.of(
                    record("A", "Bille", "Fufore").cohort(AgeGroup.UNDER_FIVE, tests(40.0, 10.0, 50.0, 5.0)).build(),
                    record("B", "Bille", "Fufore").cohort(AgeGroup.UNDER_FIVE, tests(60.0, 12.0, null, 20.0)).build());

            WardAggregate ward = only(calculator.calculate(rows, AgeGroup.UNDER_FIVE));

            assertThat(ward.getDenominator()).isEqualTo(110.0);
            assertThat(ward.getNumerator()).isEqualTo(30.0);
            assertThat(ward.getFacilityCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("all ages sums each method across cohorts before taking the maximum")
        void allAgesSumThenRatio() {
            FacilityRecord r = record("A", "Bille", "Fufore")
                    .cohort(AgeGroup.UNDER_FIVE, tests(40.0, 10.0, 10.0, 5.0))
                    .cohort(AgeGroup.OVER_FIVE, tests(20.0, 4.0, 60.0, 20.0))
                    .build();

            WardAggregate ward = only(calculator.calculate(List.of(r), AgeGroup.ALL_AGES));

            // rdt 60/14, microscopy 70/25
            assertThat(ward.getDenominator()).isEqualTo(70.0);
            assertThat(ward.getNumerator()).isEqualTo(25.0);
        }

        @Test
        @DisplayName("same ward name in different LGAs stays separate")
        void groupedByWardAndLga() {
            List<FacilityRecord> rows = List.of(
                    record("A", "Bille", "Fufore").cohort(AgeGroup.UNDER_FIVE, tests(10.0, 1.0, null, null)).build(),
                    record("B", "Bille", "Michika").cohort(AgeGroup.UNDER_FIVE, tests(10.0, 2.0, null, null)).build());

            CalculationResult result = calculator.calculate(rows, AgeGroup.UNDER_FIVE);

            assertThat(result.getWards()).extracting(WardAggregate::getLga).containsExactly("Fufore", "Michika");
        }
    }

    @Nested
    @DisplayName("missing values")
    class Missing {

        @Test
        @DisplayName("zero tested gives a missing TPR, never zero")
        void zeroDenominator() {
            FacilityRecord r = record("A", "Gurin", "Fufore")
                    .cohort(AgeGroup.UNDER_FIVE, tests(0.0, 0.0, 0.0, 0.0))
                    .build();

            CalculationResult result = calculator.calculate(List.of(r), AgeGroup.UNDER_FIVE);
            WardAggregate ward = only(result);

            assertThat(ward.isTprMissing()).isTrue();
            assertThat(ward.getTprValue()).isNull();
            assertThat(ward.tpr()).isEmpty();
            assertThat(ward.getDisplayTpr()).isNull();
            assertThat(result.getIssues()).extracting(DataQualityIssue::getKind)
                    .containsExactly(DataQualityIssue.Kind.ZERO_DENOMINATOR);
        }

        @Test
        @DisplayName("completeness counts rows reporting any tested count")
        void completeness() {
            List<FacilityRecord> rows = List.of(
                    record("A", "Bille", "Fufore").cohort(AgeGroup.UNDER_FIVE, tests(10.0, 2.0, null, null)).build(),
                    record("B", "Bille", "Fufore").build());

            WardAggregate ward = only(calculator.calculate(rows, AgeGroup.UNDER_FIVE));

            assertThat(ward.getCompleteness()).isEqualTo(50.0);
            assertThat(ward.getRecordCount()).isEqualTo(2);
            assertThat(ward.getTprValue()).isEqualTo(20.0);
        }
    }

    @Nested
    @DisplayName("alternative denominator")
    class Alternative {

        @Test
        @DisplayName("urban ward above threshold with outpatient attendance uses positive / OPD")
        void urbanRecalculated() {
            FacilityRecord r = record("A", "Jambutu", "Yola North")
                    .cohort(AgeGroup.UNDER_FIVE, tests(96.0, 60.0, null, null))
                    .outpatientAttendance(500.0)
                    .urban(true)
                    .build();

            WardAggregate ward = only(calculator.calculate(List.of(r), AgeGroup.UNDER_FIVE));

            assertThat(ward.getStandardTpr()).isEqualTo(62.5);
            assertThat(ward.getMethod()).isEqualTo(TprMethod.ALTERNATIVE);
            assertThat(ward.getTprValue()).isEqualTo(60.0 / 500.0 * 100.0);
            assertThat(ward.getDisplayTpr()).isEqualTo(12.0);
            assertThat(ward.getDenominator()).isEqualTo(500.0);
        }

        @Test
        @DisplayName("urban ward without outpatient attendance keeps the standard TPR and is reported")
        void urbanWithoutOpd() {
            FacilityRecord r = record("A", "Jambutu", "Yola North")
                    .cohort(AgeGroup.UNDER_FIVE, tests(96.0, 60.0, null, null))
                    .urban(true)
                    .build();

            CalculationResult result = calculator.calculate(List.of(r), AgeGroup.UNDER_FIVE);

            assertThat(only(result).getMethod()).isEqualTo(TprMethod.STANDARD);
            assertThat(only(result).getTprValue()).isEqualTo(62.5);
            assertThat(result.getIssues()).extracting(DataQualityIssue::getKind)
                    .containsExactly(DataQualityIssue.Kind.ALTERNATIVE_DENOMINATOR_UNAVAILABLE);
        }

        @Test
        @DisplayName("rural ward above the urban threshold is not recalculated")
        void ruralUntouched() {
            FacilityRecord r = record("A", "Gurin", "Fufore")
                    .cohort(AgeGroup.UNDER_FIVE, tests(96.0, 60.0, null, null))
                    .outpatientAttendance(500.0)
                    .urban(false)
                    .build();

            assertThat(only(calculator.calculate(List.of(r), AgeGroup.UNDER_FIVE)).getMethod()).isEqualTo(TprMethod.STANDARD);
        }

        @Test
        @DisplayName("threshold is a parameter and compared at full precision")
        void thresholdParameter() {
            FacilityRecord r = record("A", "Jambutu", "Yola North")
                    .cohort(AgeGroup.UNDER_FIVE, tests(96.0, 60.0, null, null))
                    .outpatientAttendance(500.0)
                    .urban(true)
                    .build();

            assertThat(only(calculator.calculate(List.of(r), AgeGroup.UNDER_FIVE, 62.5)).getMethod())
                    .isEqualTo(TprMethod.STANDARD);
            assertThat(only(calculator.calculate(List.of(r), AgeGroup.UNDER_FIVE, 62.49)).getMethod())
                    .isEqualTo(TprMethod.ALTERNATIVE);
        }
    }

    @Nested
    @DisplayName("data quality")
    class DataQuality {

        @Test
        @DisplayName("negative counts leave the row out of the sums and are reported")
        void negativeExcluded() {
            List<FacilityRecord> rows = List.of(
                    record("A", "Bille", "Fufore").cohort(AgeGroup.UNDER_FIVE, tests(-5.0, 2.0, null, null)).build(),
                    record("B", "Bille", "Fufore").cohort(AgeGroup.UNDER_FIVE, tests(20.0, 5.0, null, null)).build());

            CalculationResult result = calculator.calculate(rows, AgeGroup.UNDER_FIVE);

            assertThat(only(result).getDenominator()).isEqualTo(20.0);
            assertThat(result.getIssues()).singleElement()
                    .satisfies(issue -> {
                        assertThat(issue.getKind()).isEqualTo(DataQualityIssue.Kind.NEGATIVE_COUNT);
                        assertThat(issue.getFacilityName()).isEqualTo("A");
                    });
        }

        @Test
        @DisplayName("positives above tests are kept as reported and flagged")
        void positiveExceedsTested() {
            FacilityRecord r = record("A", "Bille", "Fufore")
                    .cohort(AgeGroup.UNDER_FIVE, tests(10.0, 12.0, null, null))
                    .build();

            CalculationResult result = calculator.calculate(List.of(r), AgeGroup.UNDER_FIVE);

            assertThat(only(result).getTprValue()).isEqualTo(120.0);
            assertThat(result.getIssues()).extracting(DataQualityIssue::getKind)
                    .containsExactly(DataQualityIssue.Kind.POSITIVE_EXCEEDS_TESTED);
        }
    }

    @Test
    @DisplayName("summary statistics skip missing wards")
    void summary() {
        List<FacilityRecord> rows = List.of(
                record("A", "W1", "L").cohort(AgeGroup.UNDER_FIVE, tests(10.0, 2.0, null, null)).build(),
                record("B", "W2", "L").cohort(AgeGroup.UNDER_FIVE, tests(10.0, 4.0, null, null)).build(),
                record("C", "W3", "L").cohort(AgeGroup.UNDER_FIVE, tests(10.0, 9.0, null, null)).build(),
                record("D", "W4", "L").cohort(AgeGroup.UNDER_FIVE, tests(0.0, 0.0, null, null)).build());

        TprSummary summary = calculator.calculate(rows, AgeGroup.UNDER_FIVE).summary();

        assertThat(summary.getTotalWards()).isEqualTo(4);
        assertThat(summary.getWardsWithTpr()).isEqualTo(3);
        assertThat(summary.getMissingWards()).isEqualTo(1);
        assertThat(summary.getMedianTpr()).isEqualTo(40.0);
        assertThat(summary.getMinTpr()).isEqualTo(20.0);
        assertThat(summary.getMaxTpr()).isEqualTo(90.0);
        assertThat(summary.getMeanTpr()).isEqualTo(50.0);
        assertThat(summary.getWardsAbove30()).isEqualTo(2);
        assertThat(summary.getWardsAbove50()).isEqualTo(1);
    }
}
