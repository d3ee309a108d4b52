package com.ai.tpr.calculation;

import com.fasterxml.jackson.annotation.JsonCreator;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Reporting cohorts. {@link #ALL_AGES} sums the three cohorts per record before
 * the RDT / microscopy maximum is taken.
 */
public enum AgeGroup {
    UNDER_FIVE("u5", "Under 5", List.of("u5", "under 5", "under five", "under_5", "children under 5")),
    OVER_FIVE("o5", "Over 5", List.of("o5", "over 5", "over five", "over_5", "5 and above", "adults")),
    PREGNANT_WOMEN("pw", "Pregnant women", List.of("pw", "pregnant", "pregnant women", "anc")),
    ALL_AGES("all_ages", "All ages", List.of("all_ages", "all ages", "all", "combined", "everyone"));

    private static final List<AgeGroup> COHORTS = List.of(UNDER_FIVE, OVER_FIVE, PREGNANT_WOMEN);

    private final String code;
    private final String label;
    private final List<String> aliases;

    AgeGroup(String code, String label, List<String> aliases) {
        this.code = code;
        this.label = label;
        this.aliases = aliases;
    }

    public String getCode() {
        return code;
    }

    public String getLabel() {
        return label;
    }

    public boolean isCohort() {
        return this != ALL_AGES;
    }

    public static List<AgeGroup> cohorts() {
        return COHORTS;
    }

    /**
     * Accepts codes and aliases as well as constant names in JSON.
     */
    @JsonCreator
    public static AgeGroup fromJson(String value) {
        return fromSelection(value).orElseThrow(() -> new IllegalArgumentException("Unknown age group: " + value));
    }

    /**
     * Resolves a user-facing value ("u5", "Under 5", "UNDER_FIVE", "pregnant women").
     */
    public static Optional<AgeGroup> fromSelection(String value) {
        if (StringUtils.isBlank(value)) return Optional.empty();
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (AgeGroup group : values()) {
            if (group.name().equalsIgnoreCase(v) || group.label.equalsIgnoreCase(v) || group.aliases.contains(v)) {
                return Optional.of(group);
            }
        }
        return Optional.empty();
    }
}
