package com.ai.tpr.service;

import com.ai.tpr.calculation.FacilityRecord;

import java.util.List;
import java.util.Optional;

/**
 * Ingested facility registers by dataset handle. Registered lists are read-only.
 */
public interface DatasetRegistry {

    void register(String datasetHandle, List<FacilityRecord> records);

    Optional<List<FacilityRecord>> find(String datasetHandle);
}
