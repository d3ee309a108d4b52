package com.ai.tpr.matching;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Post-run summary of a reconciliation batch.
 */
@Value
@Builder
public class MatchDiagnostics {

    int totalWards;
    int matchedWards;
    double matchRate;
    Map<MatchTier, Long> tierCounts;
    List<MatchResult> unmatched;
    List<MatchResult> ambiguous;
}
