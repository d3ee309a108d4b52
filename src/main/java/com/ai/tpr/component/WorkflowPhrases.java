package com.ai.tpr.component;

import com.ai.tpr.calculation.AgeGroup;
import com.ai.tpr.calculation.FacilityLevel;
import com.ai.tpr.calculation.TprSummary;
import com.ai.tpr.conversation.Selections;
import com.ai.tpr.conversation.WorkflowStage;
import com.ai.tpr.dto.StageOption;
import com.ai.tpr.matching.MatchDiagnostics;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * User-facing text for workflow responses. Flow logic decides what happens;
 * this class only words it.
 */
@Component
public class WorkflowPhrases {

    public String introduction(int stateCount) {
        return "Let's calculate the test positivity rate (TPR) for your data. "
                + "Your dataset covers " + stateCount + " states. Which state would you like to analyse?";
    }

    public String introductionSingleState(String state) {
        return "Let's calculate the test positivity rate (TPR) for your data. "
                + "Your dataset covers " + state + " only, so I've selected it. Which facility level should I include?";
    }

    public String noStates() {
        return "I couldn't find any state values in this dataset, so there is nothing to select yet.";
    }

    public String chooseFacilityLevel(String state) {
        return "Got it, " + state + ". Which facility level should I include?";
    }

    public String chooseAgeGroup(FacilityLevel level) {
        return level.getLabel() + " it is. Which age group should I calculate TPR for?";
    }

    public String chooseState() {
        return "Which state would you like to analyse?";
    }

    public String noAgeGroupData(FacilityLevel level) {
        return "There are no test counts for " + level.getLabel().toLowerCase(Locale.ROOT)
                + " in this state. Say \"back\" to choose another facility level.";
    }

    public String invalidSelection(WorkflowStage stage, String value) {
        String what = "option";
        if (stage == WorkflowStage.STATE_SELECTION) what = "state";
        else if (stage == WorkflowStage.FACILITY_LEVEL_SELECTION) what = "facility level";
        else if (stage == WorkflowStage.AGE_GROUP_SELECTION) what = "age group";
        return "\"" + (value == null ? "" : value) + "\" isn't one of the " + what + " options. "
                + "Pick one of the options by name or number.";
    }

    public String notUnderstood() {
        return "Sorry, I didn't catch that.";
    }

    public String missingPrerequisite(List<String> missing) {
        return "I can't calculate yet: no " + String.join(" or ", missing) + " has been selected. "
                + "Say \"back\" to choose it, or start the workflow again.";
    }

    public String notStarted() {
        return "The workflow hasn't started yet. Start it with a dataset first.";
    }

    public String calculationInProgress() {
        return "The calculation is still running.";
    }

    public String movedBack(WorkflowStage to) {
        return "Okay, going back to " + stageName(to) + ".";
    }

    public String nothingToGoBackTo(WorkflowStage stage) {
        if (stage == WorkflowStage.COMPLETE) {
            return "This analysis is finished, so there is nothing to go back to. Start a new workflow to change selections.";
        }
        return "You're at the first step, so there's nothing to go back to.";
    }

    public String status(WorkflowStage stage, Selections selections) {
        StringBuilder sb = new StringBuilder("Current step: ").append(stageName(stage)).append('.');
        if (selections.getState() != null) sb.append(" State: ").append(selections.getState()).append('.');
        if (selections.getFacilityLevel() != null) sb.append(" Facility level: ").append(selections.getFacilityLevel().getLabel()).append('.');
        if (selections.getAgeGroup() != null) sb.append(" Age group: ").append(selections.getAgeGroup().getLabel()).append('.');
        return sb.toString();
    }

    public String exited() {
        return "Alright, I've stopped the TPR workflow. Your selections are kept for reference.";
    }

    public String alreadyComplete() {
        return "This analysis is already complete. Start a new workflow to run another one.";
    }

    public String results(String state, FacilityLevel level, AgeGroup ageGroup, TprSummary summary,
                          MatchDiagnostics matches) {
        StringBuilder sb = new StringBuilder();
        sb.append("TPR for ").append(state).append(", ").append(level.getLabel().toLowerCase(Locale.ROOT))
                .append(", ").append(ageGroup.getLabel().toLowerCase(Locale.ROOT)).append(": ");
        if (summary.getWardsWithTpr() == 0) {
            sb.append("no ward had tests to calculate from (").append(summary.getTotalWards()).append(" wards).");
            return sb.toString();
        }
        sb.append(summary.getWardsWithTpr()).append(" of ").append(summary.getTotalWards())
                .append(" wards calculated, mean ").append(percent(summary.getMeanTpr()))
                .append(", median ").append(percent(summary.getMedianTpr()))
                .append(", range ").append(percent(summary.getMinTpr())).append(" to ").append(percent(summary.getMaxTpr()))
                .append('.');
        if (summary.getAlternativeMethodWards() > 0) {
            sb.append(' ').append(summary.getAlternativeMethodWards())
                    .append(" urban wards used outpatient attendance as denominator.");
        }
        sb.append(String.format(Locale.ROOT, " %d of %d wards matched to boundaries (%.1f%%).",
                matches.getMatchedWards(), matches.getTotalWards(), matches.getMatchRate()));
        return sb.toString();
    }

    /**
     * Reminder of what the user can say next, appended to delegated answers.
     */
    public String reminder(WorkflowStage stage, List<StageOption> options) {
        if (stage == WorkflowStage.COMPLETE) {
            return "The analysis is complete.";
        }
        if (options.isEmpty()) {
            return "You can say \"back\", \"status\" or \"exit\".";
        }
        String listed = options.stream()
                .map(o -> o.getNumber() + ". " + o.getLabel())
                .collect(Collectors.joining(", "));
        return "To continue, choose " + stageName(stage) + ": " + listed + ".";
    }

    private static String stageName(WorkflowStage stage) {
        switch (stage) {
            case STATE_SELECTION:
                return "state selection";
            case FACILITY_LEVEL_SELECTION:
                return "facility level selection";
            case AGE_GROUP_SELECTION:
                return "age group selection";
            case CALCULATING:
                return "calculation";
            case COMPLETE:
                return "complete";
            default:
                return "the start";
        }
    }

    private static String percent(Double value) {
        return value == null ? "n/a" : String.format(Locale.ROOT, "%.1f%%", value);
    }
}
