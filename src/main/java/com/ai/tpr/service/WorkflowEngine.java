package com.ai.tpr.service;

import com.ai.tpr.calculation.AgeGroup;
import com.ai.tpr.calculation.CalculationResult;
import com.ai.tpr.calculation.FacilityLevel;
import com.ai.tpr.calculation.FacilityRecord;
import com.ai.tpr.calculation.TprCalculator;
import com.ai.tpr.calculation.TprSummary;
import com.ai.tpr.calculation.WardAggregate;
import com.ai.tpr.component.WorkflowPhrases;
import com.ai.tpr.conversation.ClassificationContext;
import com.ai.tpr.conversation.CompletionReason;
import com.ai.tpr.conversation.IntentKind;
import com.ai.tpr.conversation.IntentResult;
import com.ai.tpr.conversation.NavigationCommand;
import com.ai.tpr.conversation.Selections;
import com.ai.tpr.conversation.Session;
import com.ai.tpr.conversation.WorkflowStage;
import com.ai.tpr.dto.DatasetSummary;
import com.ai.tpr.dto.StageOption;
import com.ai.tpr.dto.WardMapping;
import com.ai.tpr.dto.WorkflowResponse;
import com.ai.tpr.dto.WorkflowResponse.ResponseType;
import com.ai.tpr.exception.DatasetNotFoundException;
import com.ai.tpr.exception.MalformedIntentException;
import com.ai.tpr.exception.SessionConflictException;
import com.ai.tpr.exception.SessionNotFoundException;
import com.ai.tpr.matching.MatchDiagnostics;
import com.ai.tpr.matching.MatchResult;
import com.ai.tpr.matching.WardMatcher;
import com.ai.tpr.threshold.ThresholdDetector;
import com.ai.tpr.threshold.ViolationReport;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Stage-based TPR workflow: state, facility level, age group, then calculation.
 * <p>
 * The id-based operations run as one read-modify-write under the session lock
 * and save only when the session changed; a version conflict reruns the whole
 * step on fresh state. The session-based overloads mutate the given session in
 * place and persist nothing.
 * <p>
 * Recoverable outcomes come back as {@link ResponseType}s with the session
 * untouched. Malformed classifier output, store failures and missing datasets
 * are thrown.
 */
@Service
public class WorkflowEngine {

    private static final Logger log = LoggerFactory.getLogger(WorkflowEngine.class);

    private final SessionStore sessionStore;
    private final DatasetRegistry datasetRegistry;
    private final CanonicalWardRegistry wardRegistry;
    private final DatasetProfiler profiler;
    private final TprCalculator calculator;
    private final ThresholdDetector detector;
    private final ExplanationDelegate explanationDelegate;
    private final WorkflowPhrases phrases;
    private final WorkflowSettings settings;

    public WorkflowEngine(SessionStore sessionStore,
                          DatasetRegistry datasetRegistry,
                          CanonicalWardRegistry wardRegistry,
                          DatasetProfiler profiler,
                          TprCalculator calculator,
                          ThresholdDetector detector,
                          ExplanationDelegate explanationDelegate,
                          WorkflowPhrases phrases,
                          WorkflowSettings settings) {
        this.sessionStore = sessionStore;
        this.datasetRegistry = datasetRegistry;
        this.wardRegistry = wardRegistry;
        this.profiler = profiler;
        this.calculator = calculator;
        this.detector = detector;
        this.explanationDelegate = explanationDelegate;
        this.phrases = phrases;
        this.settings = settings;
    }

    /**
     * Starts (or restarts) the workflow for a session. A single-state dataset skips
     * state selection with that state saved.
     */
    public WorkflowResponse startWorkflow(String sessionId, DatasetSummary summary) {
        return withRetries(sessionId, () -> {
            Session session = new Session(sessionId);
            session.setDatasetHandle(summary.getDatasetHandle());
            WorkflowResponse response = start(session, summary);
            session.setVersion(sessionStore.load(sessionId).map(Session::getVersion).orElse(null));
            sessionStore.save(sessionId, session);
            log.info("[{}] workflow started: dataset={}, states={}, stage={}",
                    sessionId, summary.getDatasetHandle(), summary.getStates().size(), session.getStage());
            return response;
        });
    }

    /**
     * Moves a fresh session out of {@link WorkflowStage#INITIAL}.
     */
    public WorkflowResponse start(Session session, DatasetSummary summary) {
        session.setStage(WorkflowStage.INITIAL);
        session.setSelections(Selections.none());
        session.setCompletionReason(null);

        if (summary.isSingleState()) {
            String state = summary.getStates().get(0).getName();
            session.setSelections(Selections.none().withState(state));
            session.setStage(WorkflowStage.FACILITY_LEVEL_SELECTION);
            return respond(session, ResponseType.OPTIONS, phrases.introductionSingleState(state))
                    .options(profiler.facilityLevelOptions(records(session), state))
                    .build();
        }

        session.setStage(WorkflowStage.STATE_SELECTION);
        String message = summary.getStates().isEmpty()
                ? phrases.noStates()
                : phrases.introduction(summary.getStates().size());
        return respond(session, ResponseType.OPTIONS, message)
                .options(profiler.stateOptions(summary))
                .build();
    }

    public WorkflowResponse handleInput(String sessionId, IntentResult intent) {
        requireWellFormed(sessionId, intent);
        return withRetries(sessionId, () -> {
            Session current = sessionStore.load(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
            Session working = current.copy();
            WorkflowResponse response = handleInput(working, intent);
            if (!working.sameStateAs(current)) {
                sessionStore.save(sessionId, working);
                log.info("[{}] {} -> {} ({})", sessionId, current.getStage(), working.getStage(), response.getType());
            }
            return response;
        });
    }

    public WorkflowResponse handleInput(Session session, IntentResult intent) {
        requireWellFormed(session.getSessionId(), intent);

        // recognised navigation commands are unconditional, whatever the confidence
        if (intent.getKind() == IntentKind.NAVIGATION) {
            Optional<NavigationCommand> command = NavigationCommand.fromValue(intent.getExtractedValue());
            if (command.isPresent()) return handleNavigation(session, command.get());
        }

        if (intent.getKind() == IntentKind.UNCLEAR || intent.getConfidence() < settings.getMinConfidence()) {
            log.debug("[{}] not understood: {}", session.getSessionId(), intent);
            return notUnderstood(session);
        }

        switch (intent.getKind()) {
            case NAVIGATION:
                return notUnderstood(session);
            case INFORMATION:
            case DATA_INQUIRY:
            case ANALYSIS_REQUEST: {
                String answer = explanationDelegate.explain(session.copy(), intent);
                List<StageOption> options = currentOptions(session);
                return respond(session, ResponseType.DELEGATED,
                        answer + "\n\n" + phrases.reminder(session.getStage(), options))
                        .options(nullIfEmpty(options))
                        .build();
            }
            case SELECTION:
                return handleSelection(session, intent.getExtractedValue());
            default:
                throw new MalformedIntentException(session.getSessionId(), intent);
        }
    }

    public WorkflowResponse handleNavigation(Session session, NavigationCommand command) {
        switch (command) {
            case STATUS:
                return respond(session, ResponseType.STATUS, phrases.status(session.getStage(), session.getSelections()))
                        .build();
            case EXIT:
                if (session.getStage() != WorkflowStage.COMPLETE) {
                    session.setStage(WorkflowStage.COMPLETE);
                    session.setCompletionReason(CompletionReason.EXITED);
                    log.info("[{}] workflow exited", session.getSessionId());
                }
                return respond(session, ResponseType.EXITED, phrases.exited()).build();
            case BACK:
            default:
                return back(session);
        }
    }

    public WorkflowResponse status(String sessionId) {
        Session session = sessionStore.load(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
        return handleNavigation(session, NavigationCommand.STATUS);
    }

    /**
     * Stage and current option values, for classifying a message for this session.
     */
    public ClassificationContext contextFor(String sessionId) {
        Session session = sessionStore.load(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
        List<String> values = currentOptions(session).stream().map(StageOption::getValue).collect(Collectors.toList());
        return new ClassificationContext(session.getStage(), values, session.getSelections());
    }

    private WorkflowResponse back(Session session) {
        Selections selections = session.getSelections();
        switch (session.getStage()) {
            case FACILITY_LEVEL_SELECTION:
                session.setSelections(selections.withFacilityLevel(null).withAgeGroup(null));
                session.setStage(WorkflowStage.STATE_SELECTION);
                return respond(session, ResponseType.NAVIGATED_BACK,
                        phrases.movedBack(WorkflowStage.STATE_SELECTION) + " " + phrases.chooseState())
                        .options(stateOptions(session))
                        .build();
            case AGE_GROUP_SELECTION:
                session.setSelections(selections.withAgeGroup(null));
                session.setStage(WorkflowStage.FACILITY_LEVEL_SELECTION);
                return respond(session, ResponseType.NAVIGATED_BACK,
                        phrases.movedBack(WorkflowStage.FACILITY_LEVEL_SELECTION) + " "
                                + phrases.chooseFacilityLevel(session.getSelections().getState()))
                        .options(facilityLevelOptions(session))
                        .build();
            default:
                return respond(session, ResponseType.NAVIGATION_NOOP, phrases.nothingToGoBackTo(session.getStage()))
                        .options(nullIfEmpty(currentOptions(session)))
                        .build();
        }
    }

    private WorkflowResponse handleSelection(Session session, String value) {
        Selections selections = session.getSelections();
        switch (session.getStage()) {
            case INITIAL:
                return respond(session, ResponseType.MISSING_PREREQUISITE, phrases.notStarted()).build();
            case STATE_SELECTION: {
                List<StageOption> options = stateOptions(session);
                Optional<StageOption> chosen = resolve(value, options,
                        option -> DatasetProfiler.sameState(option.getValue(), value));
                if (chosen.isEmpty()) return clarify(session, value, options);

                String state = chosen.get().getValue();
                session.setSelections(Selections.none().withState(state));
                session.setStage(WorkflowStage.FACILITY_LEVEL_SELECTION);
                return respond(session, ResponseType.OPTIONS, phrases.chooseFacilityLevel(state))
                        .options(facilityLevelOptions(session))
                        .build();
            }
            case FACILITY_LEVEL_SELECTION: {
                List<String> missing = missing(selections, false);
                if (!missing.isEmpty()) return missingPrerequisite(session, missing);

                List<StageOption> options = facilityLevelOptions(session);
                Optional<FacilityLevel> parsed = FacilityLevel.fromSelection(value);
                Optional<StageOption> chosen = resolve(value, options,
                        option -> parsed.isPresent() && parsed.get().name().equals(option.getValue()));
                if (chosen.isEmpty()) return clarify(session, value, options);

                FacilityLevel level = FacilityLevel.valueOf(chosen.get().getValue());
                session.setSelections(selections.withFacilityLevel(level).withAgeGroup(null));
                session.setStage(WorkflowStage.AGE_GROUP_SELECTION);
                List<StageOption> ageOptions = ageGroupOptions(session);
                String message = ageOptions.isEmpty() ? phrases.noAgeGroupData(level) : phrases.chooseAgeGroup(level);
                return respond(session, ResponseType.OPTIONS, message)
                        .options(ageOptions)
                        .build();
            }
            case AGE_GROUP_SELECTION: {
                List<String> missing = missing(selections, true);
                if (!missing.isEmpty()) return missingPrerequisite(session, missing);

                List<StageOption> options = ageGroupOptions(session);
                Optional<AgeGroup> parsed = AgeGroup.fromSelection(value);
                Optional<StageOption> chosen = resolve(value, options,
                        option -> parsed.isPresent() && parsed.get().getCode().equals(option.getValue()));
                if (chosen.isEmpty()) return clarify(session, value, options);

                AgeGroup ageGroup = AgeGroup.fromSelection(chosen.get().getValue()).orElseThrow();
                return calculate(session, ageGroup);
            }
            case CALCULATING:
                return respond(session, ResponseType.CLARIFY, phrases.calculationInProgress()).build();
            case COMPLETE:
            default:
                return respond(session, ResponseType.ALREADY_COMPLETE, phrases.alreadyComplete()).build();
        }
    }

    /**
     * Saves the age group, runs calculation, threshold check and boundary matching,
     * and completes the session. On failure the session is restored and the error rethrown.
     */
    private WorkflowResponse calculate(Session session, AgeGroup ageGroup) {
        WorkflowStage previousStage = session.getStage();
        Selections previousSelections = session.getSelections();
        Selections selections = previousSelections.withAgeGroup(ageGroup);
        session.setSelections(selections);
        session.setStage(WorkflowStage.CALCULATING);
        try {
            String state = selections.getState();
            List<FacilityRecord> scoped = profiler.filter(records(session), state, selections.getFacilityLevel());

            CalculationResult calculation = calculator.calculate(scoped, ageGroup, settings.getUrbanThreshold());
            ViolationReport report = detector.detect(calculation.getWards());

            WardMatcher matcher = new WardMatcher(wardRegistry.findByState(state), settings.getFuzzyCutoff());
            List<MatchResult> matches = new ArrayList<>();
            List<WardMapping> mappings = new ArrayList<>();
            for (WardAggregate ward : calculation.getWards()) {
                MatchResult match = matcher.match(ward.getWardName(), ward.getLga());
                matches.add(match);
                mappings.add(new WardMapping(ward, match));
            }
            MatchDiagnostics matchDiagnostics = matcher.diagnostics(matches);
            TprSummary summary = calculation.summary();

            session.setStage(WorkflowStage.COMPLETE);
            session.setCompletionReason(CompletionReason.CALCULATED);
            log.info("[{}] calculated: state={}, level={}, ageGroup={}, wards={}, violations={}, matched={}/{}",
                    session.getSessionId(), state, selections.getFacilityLevel(), ageGroup.getCode(),
                    summary.getTotalWards(), report.totalViolations(),
                    matchDiagnostics.getMatchedWards(), matchDiagnostics.getTotalWards());

            return respond(session, ResponseType.RESULTS,
                    phrases.results(state, selections.getFacilityLevel(), ageGroup, summary, matchDiagnostics))
                    .diagnostics(report)
                    .alert(detector.generateAlertMessage(report).orElse(null))
                    .matchSummary(matches)
                    .matchDiagnostics(matchDiagnostics)
                    .wards(mappings)
                    .dataQualityIssues(calculation.getIssues())
                    .summary(summary)
                    .build();
        } catch (RuntimeException e) {
            session.setStage(previousStage);
            session.setSelections(previousSelections);
            session.setCompletionReason(null);
            throw e;
        }
    }

    private WorkflowResponse withRetries(String sessionId, Supplier<WorkflowResponse> step) {
        int attempts = Math.max(1, settings.getMaxConflictRetries());
        for (int attempt = 1; ; attempt++) {
            try {
                return sessionStore.withSessionLock(sessionId, step);
            } catch (SessionConflictException e) {
                if (attempt >= attempts) {
                    log.error("[{}] giving up after {} conflicting attempts", sessionId, attempt);
                    throw e;
                }
                log.warn("[{}] session changed concurrently, retrying ({}/{})", sessionId, attempt, attempts);
            }
        }
    }

    private static void requireWellFormed(String sessionId, IntentResult intent) {
        if (intent == null || !intent.isWellFormed()) {
            throw new MalformedIntentException(sessionId, intent);
        }
    }

    /**
     * Earlier selections that must be present before the current stage can complete.
     */
    private static List<String> missing(Selections selections, boolean needsFacilityLevel) {
        List<String> missing = new ArrayList<>();
        if (StringUtils.isBlank(selections.getState())) missing.add("state");
        if (needsFacilityLevel && selections.getFacilityLevel() == null) missing.add("facility level");
        return missing;
    }

    private WorkflowResponse missingPrerequisite(Session session, List<String> missing) {
        log.warn("[{}] refusing transition from {}: missing {}", session.getSessionId(), session.getStage(), missing);
        return respond(session, ResponseType.MISSING_PREREQUISITE, phrases.missingPrerequisite(missing)).build();
    }

    private WorkflowResponse notUnderstood(Session session) {
        List<StageOption> options = currentOptions(session);
        return respond(session, ResponseType.NOT_UNDERSTOOD,
                phrases.notUnderstood() + " " + phrases.reminder(session.getStage(), options))
                .options(nullIfEmpty(options))
                .build();
    }

    private WorkflowResponse clarify(Session session, String value, List<StageOption> options) {
        return respond(session, ResponseType.CLARIFY, phrases.invalidSelection(session.getStage(), value))
                .options(options)
                .build();
    }

    /**
     * A 1-based option number, the option value, or whatever {@code matches} accepts.
     */
    private static Optional<StageOption> resolve(String value, List<StageOption> options, Predicate<StageOption> matches) {
        if (StringUtils.isBlank(value)) return Optional.empty();
        String v = value.trim();
        if (StringUtils.isNumeric(v)) {
            int number = Integer.parseInt(v);
            return options.stream().filter(o -> o.getNumber() == number).findFirst();
        }
        return options.stream()
                .filter(o -> o.getValue().equalsIgnoreCase(v) || o.getLabel().equalsIgnoreCase(v) || matches.test(o))
                .findFirst();
    }

    private List<StageOption> currentOptions(Session session) {
        Selections selections = session.getSelections();
        switch (session.getStage()) {
            case STATE_SELECTION:
                return stateOptions(session);
            case FACILITY_LEVEL_SELECTION:
                return selections.getState() == null ? List.of() : facilityLevelOptions(session);
            case AGE_GROUP_SELECTION:
                return selections.getState() == null || selections.getFacilityLevel() == null
                        ? List.of() : ageGroupOptions(session);
            default:
                return List.of();
        }
    }

    private List<StageOption> stateOptions(Session session) {
        return profiler.stateOptions(profiler.summarize(session.getDatasetHandle(), records(session)));
    }

    private List<StageOption> facilityLevelOptions(Session session) {
        return profiler.facilityLevelOptions(records(session), session.getSelections().getState());
    }

    private List<StageOption> ageGroupOptions(Session session) {
        Selections selections = session.getSelections();
        return profiler.ageGroupOptions(records(session), selections.getState(), selections.getFacilityLevel());
    }

    private List<FacilityRecord> records(Session session) {
        return datasetRegistry.find(session.getDatasetHandle())
                .orElseThrow(() -> new DatasetNotFoundException(session.getSessionId(), session.getDatasetHandle()));
    }

    private WorkflowResponse.WorkflowResponseBuilder respond(Session session, ResponseType type, String message) {
        return WorkflowResponse.builder()
                .sessionId(session.getSessionId())
                .type(type)
                .message(message)
                .stage(session.getStage())
                .selections(session.getSelections().toMap());
    }

    private static <T> List<T> nullIfEmpty(List<T> list) {
        return list.isEmpty() ? null : list;
    }
}
