package com.ai.tpr.dto;

import com.ai.tpr.calculation.WardAggregate;
import com.ai.tpr.matching.MatchResult;
import lombok.Value;

/**
 * A calculated ward joined to its boundary match. Unmatched wards stay in the
 * output with {@code geometryAvailable=false}.
 */
@Value
public class WardMapping {

    WardAggregate aggregate;
    MatchResult match;

    public boolean isGeometryAvailable() {
        return match.isGeometryAvailable();
    }
}
