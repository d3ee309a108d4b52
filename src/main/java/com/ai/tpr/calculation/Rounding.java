package com.ai.tpr.calculation;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Display rounding. Comparisons always use the unrounded values.
 */
public final class Rounding {

    private Rounding() {
    }

    public static Double oneDecimal(Double value) {
        if (value == null || value.isNaN() || value.isInfinite()) return value;
        return BigDecimal.valueOf(value).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }
}
