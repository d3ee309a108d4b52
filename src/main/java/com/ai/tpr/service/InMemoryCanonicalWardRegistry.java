package com.ai.tpr.service;

import com.ai.tpr.matching.CanonicalWard;
import com.ai.tpr.matching.NameRole;
import com.ai.tpr.matching.Normalizer;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class InMemoryCanonicalWardRegistry implements CanonicalWardRegistry {

    private final Map<String, Map<String, CanonicalWard>> byState = new ConcurrentHashMap<>();

    @Override
    public synchronized int register(Collection<CanonicalWard> wards) {
        int added = 0;
        for (CanonicalWard ward : wards) {
            String state = Normalizer.normalize(ward.getStateName(), NameRole.STATE);
            Map<String, CanonicalWard> stateWards = byState.computeIfAbsent(state, k -> new LinkedHashMap<>());
            if (stateWards.putIfAbsent(ward.getWardCode(), ward) == null) {
                added++;
            }
        }
        return added;
    }

    @Override
    public synchronized List<CanonicalWard> findByState(String state) {
        Map<String, CanonicalWard> stateWards = byState.get(Normalizer.normalize(state, NameRole.STATE));
        return stateWards == null ? List.of() : List.copyOf(stateWards.values());
    }

    @Override
    public synchronized int size() {
        return byState.values().stream().mapToInt(Map::size).sum();
    }
}
