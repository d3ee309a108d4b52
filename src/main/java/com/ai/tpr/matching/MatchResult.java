package com.ai.tpr.matching;

import lombok.Builder;
import lombok.Value;

/**
 * Reconciliation outcome for one source ward. Unmatched results never carry
 * canonical fields; {@code confidence} is the fuzzy score for the FUZZY tier,
 * 1.0 for exact tiers and 0.0 when unmatched.
 */
@Value
@Builder
public class MatchResult {

    String sourceWard;
    String sourceLga;
    String canonicalWardCode;
    String canonicalWardName;
    String canonicalLga;
    double confidence;
    MatchTier matchTier;
    boolean ambiguous;

    public boolean isMatched() {
        return matchTier != MatchTier.UNMATCHED;
    }

    public boolean isGeometryAvailable() {
        return isMatched();
    }

    static MatchResult matched(String sourceWard, String sourceLga, CanonicalWard ward,
                               MatchTier tier, double confidence, boolean ambiguous) {
        return MatchResult.builder()
                .sourceWard(sourceWard)
                .sourceLga(sourceLga)
                .canonicalWardCode(ward.getWardCode())
                .canonicalWardName(ward.getWardName())
                .canonicalLga(ward.getLgaName())
                .confidence(confidence)
                .matchTier(tier)
                .ambiguous(ambiguous)
                .build();
    }

    static MatchResult unmatched(String sourceWard, String sourceLga) {
        return MatchResult.builder()
                .sourceWard(sourceWard)
                .sourceLga(sourceLga)
                .confidence(0.0)
                .matchTier(MatchTier.UNMATCHED)
                .build();
    }
}
