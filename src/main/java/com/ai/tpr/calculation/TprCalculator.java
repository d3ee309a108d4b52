package com.ai.tpr.calculation;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Aggregates facility rows into ward-level test positivity.
 * <p>
 * Per row, people tested is the larger of the RDT and microscopy counts (likewise
 * positives); ward totals are sums of those per-row maxima. Urban wards whose
 * standard TPR exceeds the urban threshold are recalculated against outpatient
 * attendance when the ward reports any.
 * <p>
 * Stateless and thread-safe; every call returns fresh objects.
 */
public class TprCalculator {

    private static final Logger log = LoggerFactory.getLogger(TprCalculator.class);

    public static final double DEFAULT_URBAN_THRESHOLD = 50.0;

    private final UrbanClassifier urbanClassifier;

    public TprCalculator(UrbanClassifier urbanClassifier) {
        this.urbanClassifier = Objects.requireNonNull(urbanClassifier, "urbanClassifier");
    }

    public CalculationResult calculate(List<FacilityRecord> records, AgeGroup ageGroup) {
        return calculate(records, ageGroup, DEFAULT_URBAN_THRESHOLD);
    }

    public CalculationResult calculate(List<FacilityRecord> records, AgeGroup ageGroup, double urbanThreshold) {
        Objects.requireNonNull(ageGroup, "ageGroup");
        Map<String, List<FacilityRecord>> byWard = new LinkedHashMap<>();
        for (FacilityRecord record : records) {
            if (StringUtils.isBlank(record.getWard())) {
                log.debug("Skipping row without ward: facility={}", record.getFacilityName());
                continue;
            }
            byWard.computeIfAbsent(wardKey(record), k -> new ArrayList<>()).add(record);
        }

        List<WardAggregate> wards = new ArrayList<>(byWard.size());
        List<DataQualityIssue> issues = new ArrayList<>();
        for (List<FacilityRecord> wardRecords : byWard.values()) {
            wards.add(aggregate(wardRecords, ageGroup, urbanThreshold, issues));
        }

        long alternative = wards.stream().filter(w -> w.getMethod() == TprMethod.ALTERNATIVE).count();
        log.info("TPR calculated: ageGroup={}, wards={}, alternative={}, issues={}",
                ageGroup.getCode(), wards.size(), alternative, issues.size());
        return new CalculationResult(ageGroup, urbanThreshold, List.copyOf(wards), List.copyOf(issues));
    }

    private WardAggregate aggregate(List<FacilityRecord> wardRecords, AgeGroup ageGroup,
                                    double urbanThreshold, List<DataQualityIssue> issues) {
        FacilityRecord first = wardRecords.get(0);
        String ward = first.getWard().trim();
        String lga = StringUtils.trimToEmpty(first.getLga());

        double tested = 0.0;
        double positive = 0.0;
        double opd = 0.0;
        int withData = 0;
        Set<String> facilities = new LinkedHashSet<>();

        for (FacilityRecord record : wardRecords) {
            facilities.add(Objects.toString(record.getFacilityName(), ""));
            CohortTests counts = record.testsFor(ageGroup);
            if (!counts.hasTestData()) {
                continue;
            }
            withData++;
            if (counts.hasNegativeCount()) {
                issues.add(issue(DataQualityIssue.Kind.NEGATIVE_COUNT, ward, lga, record,
                        "negative test count reported; row excluded from ward totals"));
                continue;
            }
            if (counts.positiveExceedsTested()) {
                issues.add(issue(DataQualityIssue.Kind.POSITIVE_EXCEEDS_TESTED, ward, lga, record,
                        "positives exceed tests for a method; kept as reported"));
            }
            tested += counts.tested();
            positive += counts.positive();
            Double attendance = record.getOutpatientAttendance();
            if (attendance != null && attendance > 0) {
                opd += attendance;
            }
        }

        UrbanClassification urban = urbanClassifier.classify(ward, wardRecords);
        double completeness = Rounding.oneDecimal(withData * 100.0 / wardRecords.size());

        WardAggregate.WardAggregateBuilder builder = WardAggregate.builder()
                .wardName(ward)
                .lga(lga)
                .state(StringUtils.trimToNull(first.getState()))
                .numerator(positive)
                .outpatientAttendance(opd)
                .facilityCount(facilities.size())
                .recordCount(wardRecords.size())
                .completeness(completeness)
                .urban(urban.isUrban())
                .urbanPercentage(urban.getUrbanPercentage())
                .urbanSource(urban.getSource());

        if (tested <= 0.0) {
            issues.add(new DataQualityIssue(DataQualityIssue.Kind.ZERO_DENOMINATOR, ward, lga, null,
                    "no tests reported for " + ageGroup.getLabel() + "; TPR is missing"));
            return builder.method(TprMethod.STANDARD).denominator(0.0).build();
        }

        double standardTpr = positive / tested * 100.0;
        builder.standardTpr(standardTpr);

        if (urban.isUrban() && standardTpr > urbanThreshold) {
            if (opd > 0.0) {
                double alternativeTpr = positive / opd * 100.0;
                log.debug("Alternative TPR for {} ({}): standard={} alternative={}", ward, lga, standardTpr, alternativeTpr);
                return builder.method(TprMethod.ALTERNATIVE)
                        .tprValue(alternativeTpr)
                        .denominator(opd)
                        .build();
            }
            issues.add(new DataQualityIssue(DataQualityIssue.Kind.ALTERNATIVE_DENOMINATOR_UNAVAILABLE, ward, lga, null,
                    "urban TPR above threshold but no outpatient attendance reported"));
        }
        return builder.method(TprMethod.STANDARD)
                .tprValue(standardTpr)
                .denominator(tested)
                .build();
    }

    private static DataQualityIssue issue(DataQualityIssue.Kind kind, String ward, String lga,
                                          FacilityRecord record, String detail) {
        log.warn("Data quality: {} ward={} lga={} facility={}", kind, ward, lga, record.getFacilityName());
        return new DataQualityIssue(kind, ward, lga, record.getFacilityName(), detail);
    }

    private static String wardKey(FacilityRecord record) {
        return record.getWard().trim() + '\u001F' + StringUtils.trimToEmpty(record.getLga());
    }
}
