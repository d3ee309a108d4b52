package com.ai.tpr.matching;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One ward of the boundary registry. The code identifies the ward geometry.
 */
@Value
@Builder
@Jacksonized
public class CanonicalWard {

    String wardCode;
    String wardName;
    String lgaName;
    String stateName;
}
