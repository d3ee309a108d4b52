package com.ai.tpr.service;

import com.ai.tpr.calculation.AgeGroup;
import com.ai.tpr.calculation.CohortTests;
import com.ai.tpr.calculation.FacilityLevel;
import com.ai.tpr.calculation.FacilityRecord;
import com.ai.tpr.dto.DatasetSummary;
import com.ai.tpr.dto.StageOption;
import com.ai.tpr.dto.StateProfile;
import com.ai.tpr.matching.NameRole;
import com.ai.tpr.matching.Normalizer;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Profiles a facility register into the choices offered at each selection stage.
 * States are grouped by normalized name and shown with their first spelling.
 */
@Service
public class DatasetProfiler {

    public DatasetSummary summarize(String datasetHandle, List<FacilityRecord> records) {
        Map<String, List<FacilityRecord>> byState = new LinkedHashMap<>();
        for (FacilityRecord record : records) {
            String key = Normalizer.normalize(record.getState(), NameRole.STATE);
            if (key.isEmpty()) continue;
            byState.computeIfAbsent(key, k -> new ArrayList<>()).add(record);
        }

        List<StateProfile> states = byState.values().stream()
                .map(DatasetProfiler::profile)
                .sorted(Comparator.comparingDouble(StateProfile::getTotalTests).reversed())
                .collect(Collectors.toList());

        return DatasetSummary.builder()
                .datasetHandle(datasetHandle)
                .recordCount(records.size())
                .states(states)
                .build();
    }

    public List<StageOption> stateOptions(DatasetSummary summary) {
        List<StageOption> options = new ArrayList<>();
        List<StateProfile> states = summary.getStates();
        for (int i = 0; i < states.size(); i++) {
            StateProfile state = states.get(i);
            options.add(StageOption.builder()
                    .number(i + 1)
                    .value(state.getName())
                    .label(state.getName())
                    .detail(String.format(Locale.ROOT, "%d facilities, %d wards, %,.0f tests",
                            state.getFacilityCount(), state.getWardCount(), state.getTotalTests()))
                    .recommended(i == 0)
                    .build());
        }
        return options;
    }

    /**
     * Levels present in the state, then "all facilities". Primary is recommended when present.
     */
    public List<StageOption> facilityLevelOptions(List<FacilityRecord> records, String state) {
        List<FacilityRecord> inState = inState(records, state);
        long stateFacilities = countFacilities(inState);

        List<StageOption> options = new ArrayList<>();
        List<FacilityLevel> present = FacilityLevel.tiers().stream()
                .filter(level -> inState.stream().anyMatch(r -> r.getFacilityLevel() == level))
                .collect(Collectors.toList());
        boolean primaryPresent = present.contains(FacilityLevel.PRIMARY);

        for (FacilityLevel level : present) {
            List<FacilityRecord> atLevel = inState.stream()
                    .filter(r -> r.getFacilityLevel() == level)
                    .collect(Collectors.toList());
            long facilities = countFacilities(atLevel);
            double share = stateFacilities == 0 ? 0.0 : facilities * 100.0 / stateFacilities;
            long urban = atLevel.stream().filter(r -> Boolean.TRUE.equals(r.getUrban())).count();
            double rdt = 0.0;
            double microscopy = 0.0;
            for (FacilityRecord r : atLevel) {
                CohortTests all = r.testsFor(AgeGroup.ALL_AGES);
                rdt += positiveOrZero(all.getRdtTested());
                microscopy += positiveOrZero(all.getMicroscopyTested());
            }
            options.add(StageOption.builder()
                    .number(options.size() + 1)
                    .value(level.name())
                    .label(level.getLabel())
                    .detail(String.format(Locale.ROOT,
                            "%s. %d facilities (%.1f%% of state), %.1f%% urban, RDT %,.0f / microscopy %,.0f tests",
                            level.getDescription(), facilities, share,
                            atLevel.isEmpty() ? 0.0 : urban * 100.0 / atLevel.size(), rdt, microscopy))
                    .recommended(primaryPresent ? level == FacilityLevel.PRIMARY : options.isEmpty())
                    .build());
        }
        options.add(StageOption.builder()
                .number(options.size() + 1)
                .value(FacilityLevel.ALL.name())
                .label(FacilityLevel.ALL.getLabel())
                .detail(String.format(Locale.ROOT, "%s. %d facilities", FacilityLevel.ALL.getDescription(), stateFacilities))
                .recommended(present.isEmpty())
                .build());
        return options;
    }

    /**
     * Cohorts with any tests in the state and level, then "all ages" when any cohort has data.
     * Under 5 is recommended when present.
     */
    public List<StageOption> ageGroupOptions(List<FacilityRecord> records, String state, FacilityLevel level) {
        List<FacilityRecord> scoped = filter(records, state, level);

        List<StageOption> options = new ArrayList<>();
        boolean underFivePresent = false;
        for (AgeGroup group : AgeGroup.cohorts()) {
            double tested = 0.0;
            double positive = 0.0;
            int reporting = 0;
            for (FacilityRecord r : scoped) {
                CohortTests counts = r.testsFor(group);
                if (!counts.hasTestData() || counts.hasNegativeCount()) continue;
                tested += counts.tested();
                positive += counts.positive();
                if (counts.tested() > 0) reporting++;
            }
            if (tested <= 0) continue;
            if (group == AgeGroup.UNDER_FIVE) underFivePresent = true;
            options.add(ageOption(options.size() + 1, group, tested, positive, reporting));
        }
        if (options.isEmpty()) return options;

        List<StageOption> ranked = new ArrayList<>();
        for (StageOption option : options) {
            boolean recommended = underFivePresent
                    ? AgeGroup.UNDER_FIVE.getCode().equals(option.getValue())
                    : option.getNumber() == 1;
            ranked.add(option.toBuilder().recommended(recommended).build());
        }
        ranked.add(StageOption.builder()
                .number(ranked.size() + 1)
                .value(AgeGroup.ALL_AGES.getCode())
                .label(AgeGroup.ALL_AGES.getLabel())
                .detail("Every cohort combined")
                .build());
        return ranked;
    }

    /**
     * Rows of the given state (normalized comparison) at the given level.
     */
    public List<FacilityRecord> filter(List<FacilityRecord> records, String state, FacilityLevel level) {
        return inState(records, state).stream()
                .filter(r -> level.includes(r.getFacilityLevel()))
                .collect(Collectors.toList());
    }

    public static boolean sameState(String a, String b) {
        String left = Normalizer.normalize(a, NameRole.STATE);
        return !left.isEmpty() && left.equals(Normalizer.normalize(b, NameRole.STATE));
    }

    private static List<FacilityRecord> inState(List<FacilityRecord> records, String state) {
        return records.stream()
                .filter(r -> sameState(r.getState(), state))
                .collect(Collectors.toList());
    }

    private static StageOption ageOption(int number, AgeGroup group, double tested, double positive,
                                         int reporting) {
        return StageOption.builder()
                .number(number)
                .value(group.getCode())
                .label(group.getLabel())
                .detail(String.format(Locale.ROOT, "%,.0f tests, %,.0f positive (%.1f%%), %d facilities reporting",
                        tested, positive, positive / tested * 100.0, reporting))
                .build();
    }

    private static StateProfile profile(List<FacilityRecord> records) {
        double tests = 0.0;
        for (FacilityRecord r : records) {
            CohortTests all = r.testsFor(AgeGroup.ALL_AGES);
            if (!all.hasNegativeCount()) tests += all.tested();
        }
        return StateProfile.builder()
                .name(StringUtils.trim(records.get(0).getState()))
                .recordCount(records.size())
                .facilityCount((int) countFacilities(records))
                .wardCount((int) records.stream().map(r -> StringUtils.trimToEmpty(r.getWard()) + '\u001F' + StringUtils.trimToEmpty(r.getLga())).distinct().count())
                .lgaCount((int) records.stream().map(FacilityRecord::getLga).filter(Objects::nonNull).map(String::trim).distinct().count())
                .totalTests(tests)
                .build();
    }

    private static long countFacilities(List<FacilityRecord> records) {
        return records.stream().map(FacilityRecord::getFacilityName).filter(Objects::nonNull).distinct().count();
    }

    private static double positiveOrZero(Double value) {
        return value == null || value < 0 ? 0.0 : value;
    }
}
