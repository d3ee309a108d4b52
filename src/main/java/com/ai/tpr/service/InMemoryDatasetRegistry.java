package com.ai.tpr.service;

import com.ai.tpr.calculation.FacilityRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class InMemoryDatasetRegistry implements DatasetRegistry {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDatasetRegistry.class);

    private final Map<String, List<FacilityRecord>> datasets = new ConcurrentHashMap<>();

    @Override
    public void register(String datasetHandle, List<FacilityRecord> records) {
        datasets.put(datasetHandle, List.copyOf(records));
        log.info("Dataset registered: handle={}, records={}", datasetHandle, records.size());
    }

    @Override
    public Optional<List<FacilityRecord>> find(String datasetHandle) {
        return datasetHandle == null ? Optional.empty() : Optional.ofNullable(datasets.get(datasetHandle));
    }
}
