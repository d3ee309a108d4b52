package com.ai.tpr.dto;

import com.ai.tpr.calculation.DataQualityIssue;
import com.ai.tpr.calculation.TprSummary;
import com.ai.tpr.conversation.WorkflowStage;
import com.ai.tpr.matching.MatchDiagnostics;
import com.ai.tpr.matching.MatchResult;
import com.ai.tpr.threshold.ViolationReport;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one workflow step. {@code type} tells the caller what happened;
 * calculation fields are only set on {@link ResponseType#RESULTS}.
 */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WorkflowResponse {

    public enum ResponseType {
        /** Stage advanced (or started); options for the new stage attached. */
        OPTIONS,
        /** Selection not valid here; nothing changed. */
        CLARIFY,
        /** Unclear or low-confidence input; nothing changed. */
        NOT_UNDERSTOOD,
        /** Calculation refused because an earlier selection is absent. */
        MISSING_PREREQUISITE,
        NAVIGATED_BACK,
        /** Back at a stage with nothing before it. */
        NAVIGATION_NOOP,
        STATUS,
        EXITED,
        DELEGATED,
        RESULTS,
        ALREADY_COMPLETE
    }

    private final String sessionId;
    private final ResponseType type;
    private final String message;
    private final WorkflowStage stage;
    private final Map<String, String> selections;
    private final List<StageOption> options;

    private final ViolationReport diagnostics;
    private final String alert;
    private final List<MatchResult> matchSummary;
    private final MatchDiagnostics matchDiagnostics;
    private final List<WardMapping> wards;
    private final List<DataQualityIssue> dataQualityIssues;
    private final TprSummary summary;
}
