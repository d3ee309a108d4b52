package com.ai.tpr.service;

import com.ai.tpr.conversation.ClassificationContext;
import com.ai.tpr.conversation.IntentKind;
import com.ai.tpr.conversation.IntentResult;
import com.ai.tpr.conversation.NavigationCommand;
import com.ai.tpr.conversation.WorkflowStage;
import com.ai.tpr.matching.NameRole;
import com.ai.tpr.matching.Normalizer;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Deterministic classifier over keywords and the options of the current stage.
 * Navigation words win over everything else; a question about an option is
 * information, not a selection.
 */
@Service
public class KeywordIntentClassifier implements IntentClassifier {

    private static final double CERTAIN = 0.95;
    private static final double LIKELY = 0.8;
    private static final double POSSIBLE = 0.6;

    private static final Pattern BACK = Pattern.compile(
            "^\\s*(go )?back\\b|\\b(previous step|go back|undo)\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern STATUS = Pattern.compile(
            "\\b(status|where am i|progress|what have i (selected|chosen))\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern EXIT = Pattern.compile(
            "^\\s*(exit|quit|stop|cancel|end)\\b|\\b(exit|quit) (the )?(workflow|analysis)\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern QUESTION = Pattern.compile(
            "\\b(what is|what's|what are|what does|explain|why|how does|how is|meaning of|difference between|tell me about)\\b|\\?\\s*$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern DATA_INQUIRY = Pattern.compile(
            "\\b(how many|show me|which wards|what data|records|columns|facilities are there|summary of (the )?data)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern ANALYSIS_REQUEST = Pattern.compile(
            "\\b(analy[sz]e|compare|comparison|trend|correlat\\w*|risk|vulnerab\\w*|rank)\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern NUMBER = Pattern.compile("^\\s*(?:option\\s*)?#?(\\d{1,2})\\s*\\.?\\s*$", Pattern.CASE_INSENSITIVE);

    private static final Map<Pattern, String> FACILITY_LEVELS = new LinkedHashMap<>();
    private static final Map<Pattern, String> AGE_GROUPS = new LinkedHashMap<>();

    static {
        FACILITY_LEVELS.put(word("all( facilit(y|ies)| levels)?|every|combined"), "ALL");
        FACILITY_LEVELS.put(word("primary|phc|health cent(re|er)s?|clinics?"), "PRIMARY");
        FACILITY_LEVELS.put(word("secondary|general hospitals?|cottage hospitals?"), "SECONDARY");
        FACILITY_LEVELS.put(word("tertiary|teaching hospitals?|federal medical cent(re|er)s?|fmc"), "TERTIARY");

        AGE_GROUPS.put(word("all ages|all age groups|combined|everyone|all"), "all_ages");
        AGE_GROUPS.put(word("under ?(5|five)|u5|children|kids"), "u5");
        AGE_GROUPS.put(word("over ?(5|five)|o5|adults|5 and above"), "o5");
        AGE_GROUPS.put(word("pregnant( women)?|pw|anc|antenatal"), "pw");
    }

    @Override
    public IntentResult classify(String message, ClassificationContext context) {
        if (StringUtils.isBlank(message)) {
            return IntentResult.unclear("empty message");
        }
        String text = message.trim();

        Optional<NavigationCommand> navigation = navigation(text);
        if (navigation.isPresent()) {
            return new IntentResult(IntentKind.NAVIGATION, navigation.get().name().toLowerCase(Locale.ROOT),
                    CERTAIN, "navigation keyword");
        }

        var number = NUMBER.matcher(text);
        if (number.matches() && context.getStage().isSelectionStage()) {
            return new IntentResult(IntentKind.SELECTION, number.group(1), CERTAIN, "option number");
        }

        if (QUESTION.matcher(text).find()) {
            IntentKind kind = DATA_INQUIRY.matcher(text).find() ? IntentKind.DATA_INQUIRY : IntentKind.INFORMATION;
            return new IntentResult(kind, text, LIKELY, "question");
        }

        Optional<String> selected = selection(text, context);
        if (selected.isPresent()) {
            return new IntentResult(IntentKind.SELECTION, selected.get(), LIKELY, "option keyword");
        }

        if (DATA_INQUIRY.matcher(text).find()) {
            return new IntentResult(IntentKind.DATA_INQUIRY, text, POSSIBLE, "data keyword");
        }
        if (ANALYSIS_REQUEST.matcher(text).find()) {
            return new IntentResult(IntentKind.ANALYSIS_REQUEST, text, POSSIBLE, "analysis keyword");
        }
        return IntentResult.unclear("no keyword matched");
    }

    private static Optional<NavigationCommand> navigation(String text) {
        if (EXIT.matcher(text).find()) return Optional.of(NavigationCommand.EXIT);
        if (BACK.matcher(text).find()) return Optional.of(NavigationCommand.BACK);
        if (STATUS.matcher(text).find()) return Optional.of(NavigationCommand.STATUS);
        return Optional.empty();
    }

    private static Optional<String> selection(String text, ClassificationContext context) {
        WorkflowStage stage = context.getStage();
        if (stage == WorkflowStage.STATE_SELECTION) {
            String normalized = " " + Normalizer.normalize(text, NameRole.STATE) + " ";
            return context.getOptionValues().stream()
                    .filter(state -> {
                        String name = Normalizer.normalize(state, NameRole.STATE);
                        return !name.isEmpty() && normalized.contains(" " + name + " ");
                    })
                    .findFirst();
        }
        if (stage == WorkflowStage.FACILITY_LEVEL_SELECTION) {
            return firstOffered(text, FACILITY_LEVELS, context);
        }
        if (stage == WorkflowStage.AGE_GROUP_SELECTION) {
            return firstOffered(text, AGE_GROUPS, context);
        }
        return Optional.empty();
    }

    /**
     * Most specific keyword match among the options actually offered. "All" entries
     * come first in the maps but only win when nothing more specific matches.
     */
    private static Optional<String> firstOffered(String text, Map<Pattern, String> keywords, ClassificationContext context) {
        String fallback = null;
        for (Map.Entry<Pattern, String> entry : keywords.entrySet()) {
            if (!entry.getKey().matcher(text).find() || !context.getOptionValues().contains(entry.getValue())) continue;
            boolean isAll = "ALL".equals(entry.getValue()) || "all_ages".equals(entry.getValue());
            if (!isAll) return Optional.of(entry.getValue());
            fallback = entry.getValue();
        }
        return Optional.ofNullable(fallback);
    }

    private static Pattern word(String alternatives) {
        return Pattern.compile("\\b(" + alternatives + ")\\b", Pattern.CASE_INSENSITIVE);
    }
}
