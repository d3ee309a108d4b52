package com.ai.tpr.calculation;

/**
 * Evidence used to classify a ward as urban or rural, strongest first.
 */
public enum UrbanSource {
    FLAG,
    PERCENTAGE,
    NAME_HEURISTIC,
    NONE
}
