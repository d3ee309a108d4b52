package com.ai.tpr.threshold;

import lombok.Value;

import java.util.List;

@Value
public class Recommendation {

    public enum Type {
        ALTERNATIVE_CALCULATION,
        DATA_QUALITY_CHECK,
        DATA_VALIDATION,
        INTERPRETATION_WARNING
    }

    public enum Priority {
        HIGH,
        MEDIUM
    }

    Type type;
    Priority priority;
    String message;
    String reason;
    int affectedWards;
    List<String> affectedLgas;
}
