package com.ai.tpr.calculation;

import com.fasterxml.jackson.annotation.JsonCreator;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Health facility tier. {@link #ALL} is only a selection scope, never the level
 * of an individual record.
 */
public enum FacilityLevel {
    PRIMARY("Primary", "Basic health centres and community clinics",
            List.of("primary", "primary health facility", "primary health care", "phc", "health centre", "health center")),
    SECONDARY("Secondary", "General hospitals and specialist clinics",
            List.of("secondary", "secondary health facility", "general hospital", "cottage hospital")),
    TERTIARY("Tertiary", "Teaching hospitals and federal medical centres",
            List.of("tertiary", "tertiary health facility", "teaching hospital", "federal medical center",
                    "federal medical centre", "specialist hospital")),
    ALL("All facilities", "Every facility tier combined",
            List.of("all", "all facilities", "all levels", "every", "combined"));

    private final String label;
    private final String description;
    private final List<String> aliases;

    FacilityLevel(String label, String description, List<String> aliases) {
        this.label = label;
        this.description = description;
        this.aliases = aliases;
    }

    public String getLabel() {
        return label;
    }

    public String getDescription() {
        return description;
    }

    public boolean includes(FacilityLevel recordLevel) {
        return this == ALL || this == recordLevel;
    }

    public static List<FacilityLevel> tiers() {
        return List.of(PRIMARY, SECONDARY, TERTIARY);
    }

    /**
     * Register spellings in JSON; an unrecognised level, or a scope word such as
     * "all", reads as {@code null} and such rows are only included under {@link #ALL}.
     */
    @JsonCreator
    public static FacilityLevel fromJson(String value) {
        return fromRegisterValue(value).orElse(null);
    }

    /**
     * Parses a level as written in facility registers ("PHC", "Teaching Hospital").
     * Never returns {@link #ALL}.
     */
    public static Optional<FacilityLevel> fromRegisterValue(String value) {
        return fromSelection(value).filter(level -> level != ALL);
    }

    public static Optional<FacilityLevel> fromSelection(String value) {
        if (StringUtils.isBlank(value)) return Optional.empty();
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (FacilityLevel level : values()) {
            if (level.name().equalsIgnoreCase(v) || level.label.equalsIgnoreCase(v) || level.aliases.contains(v)) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }
}
