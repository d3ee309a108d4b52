package com.ai.tpr.calculation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.util.OptionalDouble;

/**
 * Ward-level positivity for one age group. {@code tprValue} is {@code null}
 * ("missing") exactly when the denominator is zero; it is never coerced to 0.
 */
@Value
@Builder
public class WardAggregate {

    String wardName;
    String lga;
    String state;
    /** Full precision; use {@link #getDisplayTpr()} for presentation. */
    Double tprValue;
    /** positive / tested * 100 before any alternative recalculation; null when nothing was tested. */
    Double standardTpr;
    TprMethod method;
    double numerator;
    double denominator;
    double outpatientAttendance;
    int facilityCount;
    int recordCount;
    double completeness;
    boolean urban;
    double urbanPercentage;
    UrbanSource urbanSource;

    public boolean isTprMissing() {
        return tprValue == null;
    }

    @JsonIgnore
    public OptionalDouble tpr() {
        return tprValue == null ? OptionalDouble.empty() : OptionalDouble.of(tprValue);
    }

    public Double getDisplayTpr() {
        return Rounding.oneDecimal(tprValue);
    }
}
