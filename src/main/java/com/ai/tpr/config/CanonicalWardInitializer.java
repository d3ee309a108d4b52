package com.ai.tpr.config;

import com.ai.tpr.matching.CanonicalWard;
import com.ai.tpr.service.CanonicalWardRegistry;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Idempotent seeder: loads the ward boundary registry from a JSON resource,
 * adding only wards whose codes are not registered yet. Safe to re-run.
 */
@Component
public class CanonicalWardInitializer {

    private static final Logger log = LoggerFactory.getLogger(CanonicalWardInitializer.class);

    private final CanonicalWardRegistry registry;
    private final ObjectMapper objectMapper;
    private final Resource seed;

    public CanonicalWardInitializer(CanonicalWardRegistry registry,
                                    ObjectMapper objectMapper,
                                    @Value("${tpr.registry.canonical-wards:classpath:canonical-wards.json}") Resource seed) {
        this.registry = registry;
        this.objectMapper = objectMapper;
        this.seed = seed;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void seed() {
        if (!seed.exists()) {
            log.warn("Ward registry seed {} not found; boundary matching will report every ward unmatched", seed);
            return;
        }
        try (InputStream in = seed.getInputStream()) {
            List<CanonicalWard> wards = objectMapper.readValue(in, new TypeReference<List<CanonicalWard>>() {
            });
            int added = registry.register(wards);
            log.info("CanonicalWardInitializer: seed={}, added={}, total={}", seed.getFilename(), added, registry.size());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read ward registry seed " + seed, e);
        }
    }
}
