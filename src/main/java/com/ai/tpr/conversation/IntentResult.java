package com.ai.tpr.conversation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

/**
 * Typed output of an intent classifier. Construction does not validate; the
 * workflow engine rejects malformed results (null kind, missing confidence or one
 * outside [0, 1]).
 */
public final class IntentResult {

    private final IntentKind kind;
    private final String extractedValue;
    private final Double confidence;
    private final String rationale;

    @JsonCreator
    public IntentResult(@JsonProperty("kind") IntentKind kind,
                        @JsonProperty("extractedValue") String extractedValue,
                        @JsonProperty("confidence") Double confidence,
                        @JsonProperty("rationale") String rationale) {
        this.kind = kind;
        this.extractedValue = extractedValue;
        this.confidence = confidence;
        this.rationale = rationale;
    }

    public IntentKind getKind() {
        return kind;
    }

    public String getExtractedValue() {
        return extractedValue;
    }

    public Double getConfidence() {
        return confidence;
    }

    public String getRationale() {
        return rationale;
    }

    public boolean isWellFormed() {
        return kind != null && confidence != null && !confidence.isNaN() && confidence >= 0.0 && confidence <= 1.0;
    }

    public static IntentResult selection(String value, double confidence) {
        return new IntentResult(IntentKind.SELECTION, value, confidence, null);
    }

    public static IntentResult navigation(NavigationCommand command) {
        return new IntentResult(IntentKind.NAVIGATION, command.name().toLowerCase(Locale.ROOT), 1.0, null);
    }

    public static IntentResult of(IntentKind kind, String value, double confidence) {
        return new IntentResult(kind, value, confidence, null);
    }

    public static IntentResult unclear(String rationale) {
        return new IntentResult(IntentKind.UNCLEAR, null, 0.0, rationale);
    }

    @Override
    public String toString() {
        return "IntentResult{kind=" + kind + ", value=" + extractedValue + ", confidence=" + confidence + "}";
    }
}
