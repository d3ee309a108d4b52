package com.ai.tpr.matching;

import java.util.List;

/**
 * Administrative level a place name belongs to. Each level carries the
 * trailing designators that are dropped during normalization.
 */
public enum NameRole {
    WARD(" WARD"),
    LGA(" LOCAL GOVERNMENT AREA", " LGA"),
    STATE(" STATE");

    private final List<String> suffixes;

    NameRole(String... suffixes) {
        this.suffixes = List.of(suffixes);
    }

    public List<String> getSuffixes() {
        return suffixes;
    }
}
