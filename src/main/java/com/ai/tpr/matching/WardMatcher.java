package com.ai.tpr.matching;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Reconciles facility-register ward names against the boundary registry of a
 * single state. Resolution order, first hit wins:
 * <ol>
 *     <li>normalized ward + normalized LGA equal a registry pair</li>
 *     <li>normalized ward alone equals a registry ward</li>
 *     <li>best token-sort similarity within the LGA (or the state when the LGA is
 *     not recognised) at or above the cutoff</li>
 * </ol>
 * Ties are resolved by registry order and flagged as ambiguous.
 * <p>
 * One instance serves one batch: successful lookups are cached per
 * (ward, LGA) and failures are kept for {@link #diagnostics(List)}. Not thread-safe.
 */
public class WardMatcher {

    private static final Logger log = LoggerFactory.getLogger(WardMatcher.class);

    public static final double DEFAULT_FUZZY_CUTOFF = 0.75;

    private static final char SEP = '\u001F';

    private final List<IndexedWard> candidates;
    private final double fuzzyCutoff;
    private final Map<String, List<IndexedWard>> byWardAndLga;
    private final Map<String, List<IndexedWard>> byWard;
    private final Map<String, List<IndexedWard>> byLga;

    private final Map<String, MatchResult> cache = new HashMap<>();
    private final Map<String, MatchResult> failedLookups = new LinkedHashMap<>();

    public WardMatcher(List<CanonicalWard> canonicalWards) {
        this(canonicalWards, DEFAULT_FUZZY_CUTOFF);
    }

    public WardMatcher(List<CanonicalWard> canonicalWards, double fuzzyCutoff) {
        if (fuzzyCutoff < 0.0 || fuzzyCutoff > 1.0) {
            throw new IllegalArgumentException("fuzzy cutoff must be within [0, 1]: " + fuzzyCutoff);
        }
        this.fuzzyCutoff = fuzzyCutoff;
        this.candidates = canonicalWards == null ? List.of() : canonicalWards.stream()
                .map(IndexedWard::new)
                .filter(w -> !w.ward.isEmpty())
                .collect(Collectors.toUnmodifiableList());
        this.byWardAndLga = index(w -> w.ward + SEP + w.lga);
        this.byWard = index(w -> w.ward);
        this.byLga = index(w -> w.lga);
    }

    public double getFuzzyCutoff() {
        return fuzzyCutoff;
    }

    public MatchResult match(String sourceWard, String sourceLga) {
        String key = String.valueOf(sourceWard) + SEP + sourceLga;
        MatchResult cached = cache.get(key);
        if (cached != null) return cached;

        String ward = Normalizer.normalize(sourceWard, NameRole.WARD);
        String lga = Normalizer.normalize(sourceLga, NameRole.LGA);
        MatchResult result = resolve(sourceWard, sourceLga, ward, lga);

        if (result.isMatched()) {
            cache.put(key, result);
            if (result.isAmbiguous()) {
                log.warn("Ambiguous ward match '{}' ({}) -> {} [{}]", sourceWard, sourceLga,
                        result.getCanonicalWardCode(), result.getMatchTier());
            }
        } else if (failedLookups.putIfAbsent(key, result) == null) {
            log.warn("No boundary match for ward '{}' ({}) normalized='{}'", sourceWard, sourceLga, ward);
        }
        return result;
    }

    /**
     * Summary over the results of a batch, including every failed lookup recorded so far.
     */
    public MatchDiagnostics diagnostics(List<MatchResult> results) {
        Map<MatchTier, Long> tierCounts = new EnumMap<>(MatchTier.class);
        for (MatchTier tier : MatchTier.values()) tierCounts.put(tier, 0L);
        for (MatchResult r : results) tierCounts.merge(r.getMatchTier(), 1L, Long::sum);

        int matched = (int) results.stream().filter(MatchResult::isMatched).count();
        double rate = results.isEmpty() ? 0.0 : matched * 100.0 / results.size();
        return MatchDiagnostics.builder()
                .totalWards(results.size())
                .matchedWards(matched)
                .matchRate(rate)
                .tierCounts(Collections.unmodifiableMap(tierCounts))
                .unmatched(List.copyOf(failedLookups.values()))
                .ambiguous(results.stream().filter(MatchResult::isAmbiguous).collect(Collectors.toList()))
                .build();
    }

    public List<MatchResult> getFailedLookups() {
        return List.copyOf(failedLookups.values());
    }

    private MatchResult resolve(String sourceWard, String sourceLga, String ward, String lga) {
        if (ward.isEmpty() || candidates.isEmpty()) {
            return MatchResult.unmatched(sourceWard, sourceLga);
        }

        if (!lga.isEmpty()) {
            List<IndexedWard> exact = byWardAndLga.get(ward + SEP + lga);
            if (exact != null) {
                return MatchResult.matched(sourceWard, sourceLga, exact.get(0).source,
                        MatchTier.EXACT_WITH_LGA, 1.0, exact.size() > 1);
            }
        }

        List<IndexedWard> wardOnly = byWard.get(ward);
        if (wardOnly != null) {
            long lgas = wardOnly.stream().map(w -> w.lga).distinct().count();
            return MatchResult.matched(sourceWard, sourceLga, wardOnly.get(0).source,
                    MatchTier.EXACT_WARD_ONLY, 1.0, wardOnly.size() > 1 && lgas > 1);
        }

        List<IndexedWard> pool = !lga.isEmpty() && byLga.containsKey(lga) ? byLga.get(lga) : candidates;
        IndexedWard best = null;
        double bestScore = -1.0;
        int ties = 0;
        for (IndexedWard candidate : pool) {
            double score = TokenSortSimilarity.score(ward, candidate.ward);
            if (score > bestScore) {
                best = candidate;
                bestScore = score;
                ties = 1;
            } else if (score == bestScore) {
                ties++;
            }
        }
        if (best != null && bestScore >= fuzzyCutoff) {
            log.debug("Fuzzy ward match '{}' -> '{}' score={}", ward, best.ward, bestScore);
            return MatchResult.matched(sourceWard, sourceLga, best.source, MatchTier.FUZZY, bestScore, ties > 1);
        }
        return MatchResult.unmatched(sourceWard, sourceLga);
    }

    private Map<String, List<IndexedWard>> index(Function<IndexedWard, String> key) {
        Map<String, List<IndexedWard>> index = new HashMap<>();
        for (IndexedWard w : candidates) {
            index.computeIfAbsent(key.apply(w), k -> new ArrayList<>()).add(w);
        }
        return index;
    }

    private static final class IndexedWard {
        private final CanonicalWard source;
        private final String ward;
        private final String lga;

        private IndexedWard(CanonicalWard source) {
            this.source = source;
            this.ward = Normalizer.normalize(source.getWardName(), NameRole.WARD);
            this.lga = Normalizer.normalize(source.getLgaName(), NameRole.LGA);
        }
    }
}
