package com.ai.tpr.threshold;

import lombok.Value;

/**
 * Urban ward still computed with the standard denominator while above the urban threshold.
 */
@Value
public class AlternativeCandidate {

    String ward;
    String lga;
    double currentTpr;
    String reason;
    Recommendation.Priority priority;
}
