package com.ai.tpr.matching;

/**
 * How a source ward was resolved, strongest first.
 */
public enum MatchTier {
    EXACT_WITH_LGA,
    EXACT_WARD_ONLY,
    FUZZY,
    UNMATCHED
}
