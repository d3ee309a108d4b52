package com.ai.tpr.conversation;

import com.ai.tpr.calculation.AgeGroup;
import com.ai.tpr.calculation.FacilityLevel;
import lombok.Value;
import lombok.With;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Saved choices; each is {@code null} until its stage has been passed.
 */
@Value
@With
public class Selections {

    private static final Selections NONE = new Selections(null, null, null);

    String state;
    FacilityLevel facilityLevel;
    AgeGroup ageGroup;

    public static Selections none() {
        return NONE;
    }

    /** Present selections only, in stage order. */
    public Map<String, String> toMap() {
        Map<String, String> map = new LinkedHashMap<>();
        if (state != null) map.put("state", state);
        if (facilityLevel != null) map.put("facilityLevel", facilityLevel.name());
        if (ageGroup != null) map.put("ageGroup", ageGroup.getCode());
        return map;
    }
}
