package com.ai.tpr.service;

import com.ai.tpr.matching.CanonicalWard;

import java.util.Collection;
import java.util.List;

/**
 * Ward boundary registry. Lookups by state accept any spelling that normalizes
 * to the same state name ("ad Adamawa State", "ADAMAWA").
 */
public interface CanonicalWardRegistry {

    /** Adds wards not yet known by ward code; returns how many were added. */
    int register(Collection<CanonicalWard> wards);

    List<CanonicalWard> findByState(String state);

    int size();
}
