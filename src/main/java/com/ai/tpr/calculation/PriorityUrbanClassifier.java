package com.ai.tpr.calculation;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Urban classification in priority order:
 * <ol>
 *     <li>explicit per-row urban flags: urban when any reporting row is flagged,
 *     urban percentage is the flagged share of flagged rows</li>
 *     <li>reported urban percentage: urban when the mean exceeds the cutoff</li>
 *     <li>ward-name keywords, a low-confidence fallback used only when neither of
 *     the above is present</li>
 * </ol>
 */
public class PriorityUrbanClassifier implements UrbanClassifier {

    public static final double DEFAULT_PERCENTAGE_CUTOFF = 30.0;
    public static final List<String> DEFAULT_KEYWORDS =
            List.of("central", "metropol", "city", "urban", "municipal", "town");

    private final double percentageCutoff;
    private final List<String> keywords;

    public PriorityUrbanClassifier() {
        this(DEFAULT_PERCENTAGE_CUTOFF, DEFAULT_KEYWORDS);
    }

    public PriorityUrbanClassifier(double percentageCutoff, List<String> keywords) {
        this.percentageCutoff = percentageCutoff;
        this.keywords = keywords.stream().map(k -> k.toLowerCase(Locale.ROOT)).toList();
    }

    @Override
    public UrbanClassification classify(String wardName, List<FacilityRecord> wardRecords) {
        List<Boolean> flags = wardRecords.stream()
                .map(FacilityRecord::getUrban)
                .filter(Objects::nonNull)
                .toList();
        if (!flags.isEmpty()) {
            long flagged = flags.stream().filter(Boolean::booleanValue).count();
            return new UrbanClassification(flagged > 0, flagged * 100.0 / flags.size(), UrbanSource.FLAG);
        }

        double[] percentages = wardRecords.stream()
                .map(FacilityRecord::getUrbanPercentage)
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .toArray();
        if (percentages.length > 0) {
            double mean = 0.0;
            for (double p : percentages) mean += p;
            mean /= percentages.length;
            return new UrbanClassification(mean > percentageCutoff, mean, UrbanSource.PERCENTAGE);
        }

        boolean keywordHit = Stream.concat(Stream.of(wardName), wardRecords.stream().map(FacilityRecord::getLga))
                .filter(Objects::nonNull)
                .map(name -> name.toLowerCase(Locale.ROOT))
                .anyMatch(name -> keywords.stream().anyMatch(name::contains));
        if (keywordHit) {
            return new UrbanClassification(true, 0.0, UrbanSource.NAME_HEURISTIC);
        }
        return new UrbanClassification(false, 0.0, UrbanSource.NONE);
    }
}
