package com.ai.tpr.calculation;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Objects;

/**
 * Descriptive statistics over the wards of one run. Statistics are computed
 * over wards with a TPR; missing wards are only counted.
 */
@Value
@Builder
public class TprSummary {

    int totalWards;
    int wardsWithTpr;
    int missingWards;
    Double meanTpr;
    Double medianTpr;
    Double minTpr;
    Double maxTpr;
    int wardsAbove30;
    int wardsAbove50;
    int alternativeMethodWards;
    double averageCompleteness;

    public static TprSummary of(List<WardAggregate> wards) {
        List<Double> values = wards.stream()
                .map(WardAggregate::getTprValue)
                .filter(Objects::nonNull)
                .sorted()
                .toList();

        TprSummaryBuilder builder = TprSummary.builder()
                .totalWards(wards.size())
                .wardsWithTpr(values.size())
                .missingWards(wards.size() - values.size())
                .wardsAbove30((int) values.stream().filter(v -> v > 30.0).count())
                .wardsAbove50((int) values.stream().filter(v -> v > 50.0).count())
                .alternativeMethodWards((int) wards.stream().filter(w -> w.getMethod() == TprMethod.ALTERNATIVE).count())
                .averageCompleteness(Rounding.oneDecimal(
                        wards.stream().mapToDouble(WardAggregate::getCompleteness).average().orElse(0.0)));

        if (!values.isEmpty()) {
            int n = values.size();
            double median = n % 2 == 1 ? values.get(n / 2) : (values.get(n / 2 - 1) + values.get(n / 2)) / 2.0;
            builder.meanTpr(Rounding.oneDecimal(values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0)))
                    .medianTpr(Rounding.oneDecimal(median))
                    .minTpr(Rounding.oneDecimal(values.get(0)))
                    .maxTpr(Rounding.oneDecimal(values.get(n - 1)));
        }
        return builder.build();
    }
}
