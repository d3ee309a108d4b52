package com.ai.tpr.threshold;

import com.ai.tpr.calculation.Rounding;
import com.ai.tpr.calculation.TprMethod;
import com.ai.tpr.calculation.WardAggregate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Flags wards whose TPR is implausibly high for their setting. Diagnostics only:
 * aggregates are never modified and the calculator's method choice stands.
 */
public class ThresholdDetector {

    private static final Logger log = LoggerFactory.getLogger(ThresholdDetector.class);

    public static final double DEFAULT_URBAN_THRESHOLD = 50.0;
    public static final double DEFAULT_RURAL_THRESHOLD = 70.0;

    static final double SEVERE_TPR = 70.0;
    static final double EXTREME_TPR = 90.0;
    static final int LOW_FACILITY_COUNT = 5;
    private static final int SUMMARY_TOP = 3;

    private final double urbanThreshold;
    private final double ruralThreshold;

    public ThresholdDetector() {
        this(DEFAULT_URBAN_THRESHOLD, DEFAULT_RURAL_THRESHOLD);
    }

    public ThresholdDetector(double urbanThreshold, double ruralThreshold) {
        this.urbanThreshold = urbanThreshold;
        this.ruralThreshold = ruralThreshold;
    }

    public ViolationReport detect(List<WardAggregate> aggregates) {
        return detect(aggregates, urbanThreshold, ruralThreshold);
    }

    public ViolationReport detect(List<WardAggregate> aggregates, double urbanThreshold, double ruralThreshold) {
        List<WardViolation> urban = new ArrayList<>();
        List<WardViolation> rural = new ArrayList<>();
        int checked = 0;

        for (WardAggregate ward : aggregates) {
            if (ward.isTprMissing()) continue;
            checked++;
            double tpr = ward.getTprValue();
            if (ward.isUrban() && tpr > urbanThreshold) {
                urban.add(violation(ward, urbanThreshold));
            } else if (!ward.isUrban() && tpr > ruralThreshold) {
                rural.add(violation(ward, ruralThreshold));
            }
        }

        List<WardViolation> all = new ArrayList<>(urban);
        all.addAll(rural);

        Map<String, List<String>> byLga = new LinkedHashMap<>();
        for (WardViolation v : all) {
            byLga.computeIfAbsent(v.getLga(), k -> new ArrayList<>()).add(v.getWard());
        }
        Map<String, List<String>> clustered = byLga.entrySet().stream()
                .filter(e -> e.getValue().size() >= 2)
                .collect(Collectors.toMap(Map.Entry::getKey, e -> List.copyOf(e.getValue()),
                        (a, b) -> a, LinkedHashMap::new));

        int severe = (int) all.stream().filter(WardViolation::isSevere).count();
        int extreme = (int) all.stream().filter(WardViolation::isExtreme).count();
        int lowFacility = (int) urban.stream().filter(v -> v.getFacilityCount() < LOW_FACILITY_COUNT).count();

        ViolationReport.ViolationReportBuilder report = ViolationReport.builder()
                .urbanThreshold(urbanThreshold)
                .ruralThreshold(ruralThreshold)
                .wardsChecked(checked)
                .urbanViolations(urban)
                .ruralViolations(rural)
                .clusteredLgas(clustered)
                .severeViolations(severe)
                .extremeViolations(extreme)
                .lowFacilityUrbanViolations(lowFacility)
                .recommendations(recommendations(urban, clustered, extreme, lowFacility))
                .summary(summary(urban, rural, urbanThreshold, ruralThreshold));

        if (!all.isEmpty()) {
            report.meanViolationTpr(Rounding.oneDecimal(all.stream().mapToDouble(WardViolation::getTpr).average().orElse(0.0)))
                    .maxViolationTpr(Rounding.oneDecimal(all.stream().mapToDouble(WardViolation::getTpr).max().orElse(0.0)));
            log.info("Threshold check: wards={}, urbanViolations={}, ruralViolations={}, clusteredLgas={}",
                    checked, urban.size(), rural.size(), clustered.size());
        }
        return report.build();
    }

    /**
     * User-facing alert, empty when the report has no violations.
     */
    public Optional<String> generateAlertMessage(ViolationReport report) {
        if (!report.hasViolations()) return Optional.empty();

        StringBuilder message = new StringBuilder("Data quality alert\n\n");
        List<WardViolation> urban = report.getUrbanViolations();
        if (!urban.isEmpty()) {
            message.append("I found ").append(plural(urban.size(), "urban ward"))
                    .append(" with unusually high TPR (>").append(format(report.getUrbanThreshold())).append("%):\n");
            urban.stream().limit(SUMMARY_TOP)
                    .forEach(v -> message.append("- ").append(v.getWard()).append(": ").append(format(v.getTpr())).append("%\n"));
            if (urban.stream().anyMatch(v -> v.getMethod() == TprMethod.STANDARD)) {
                message.append("These values are high for urban areas where testing is more accessible. ")
                        .append("Outpatient attendance would allow recalculating them as positive cases / outpatient attendance.\n");
            }
        }
        List<WardViolation> rural = report.getRuralViolations();
        if (!rural.isEmpty()) {
            if (!urban.isEmpty()) message.append('\n');
            message.append("I found ").append(plural(rural.size(), "rural ward"))
                    .append(" above ").append(format(report.getRuralThreshold())).append("%. ")
                    .append("Please validate the source data for these wards.\n");
        }
        return Optional.of(message.toString().trim());
    }

    /**
     * Urban violations that were not already recalculated with the alternative denominator.
     */
    public List<AlternativeCandidate> alternativeCalculationCandidates(ViolationReport report) {
        return report.getUrbanViolations().stream()
                .filter(v -> v.getMethod() == TprMethod.STANDARD)
                .map(v -> new AlternativeCandidate(v.getWard(), v.getLga(), v.getTpr(),
                        "Urban ward with TPR " + format(v.getTpr()) + "% > " + format(report.getUrbanThreshold()) + "%",
                        v.isSevere() ? Recommendation.Priority.HIGH : Recommendation.Priority.MEDIUM))
                .collect(Collectors.toList());
    }

    private static WardViolation violation(WardAggregate ward, double threshold) {
        return new WardViolation(ward.getWardName(), ward.getLga(), ward.getTprValue(), threshold,
                ward.isUrban(), ward.getMethod(), ward.getFacilityCount());
    }

    private static List<Recommendation> recommendations(List<WardViolation> urban, Map<String, List<String>> clustered,
                                                        int extreme, int lowFacility) {
        List<Recommendation> out = new ArrayList<>();
        if (!urban.isEmpty()) {
            out.add(new Recommendation(Recommendation.Type.ALTERNATIVE_CALCULATION, Recommendation.Priority.HIGH,
                    "Recalculate TPR for " + plural(urban.size(), "urban ward") + " using outpatient attendance as denominator",
                    "Urban areas typically have lower TPR due to better access to testing",
                    urban.size(), List.of()));
        }
        if (!clustered.isEmpty()) {
            int wards = clustered.values().stream().mapToInt(List::size).sum();
            out.add(new Recommendation(Recommendation.Type.DATA_QUALITY_CHECK, Recommendation.Priority.MEDIUM,
                    "Review data quality for " + clustered.size() + " LGAs with multiple high-TPR wards",
                    "Geographic clustering may indicate systematic data issues",
                    wards, List.copyOf(clustered.keySet())));
        }
        if (extreme > 0) {
            out.add(new Recommendation(Recommendation.Type.DATA_VALIDATION, Recommendation.Priority.HIGH,
                    "Validate source data for " + plural(extreme, "ward") + " with TPR > 90%",
                    "Extremely high TPR values may indicate data entry errors",
                    extreme, List.of()));
        }
        if (lowFacility > 0) {
            out.add(new Recommendation(Recommendation.Type.INTERPRETATION_WARNING, Recommendation.Priority.MEDIUM,
                    "Interpret results carefully for wards with <" + LOW_FACILITY_COUNT + " reporting facilities",
                    "Low facility counts may not represent true ward-level burden",
                    lowFacility, List.of()));
        }
        return out;
    }

    private static String summary(List<WardViolation> urban, List<WardViolation> rural,
                                  double urbanThreshold, double ruralThreshold) {
        if (urban.isEmpty() && rural.isEmpty()) {
            return "No threshold violations detected. All TPR values are within expected ranges.";
        }
        List<String> parts = new ArrayList<>();
        if (!urban.isEmpty()) {
            parts.add("Found " + plural(urban.size(), "urban ward") + " with TPR > " + format(urbanThreshold) + "%:");
            urban.stream()
                    .sorted(Comparator.comparingDouble(WardViolation::getTpr).reversed())
                    .limit(SUMMARY_TOP)
                    .forEach(v -> parts.add("  - " + v.getWard() + " (" + v.getLga() + "): " + format(v.getTpr()) + "%"));
            if (urban.size() > SUMMARY_TOP) {
                parts.add("  ...and " + (urban.size() - SUMMARY_TOP) + " more");
            }
        }
        if (!rural.isEmpty()) {
            parts.add("Found " + plural(rural.size(), "rural ward") + " with TPR > " + format(ruralThreshold) + "%");
        }
        return String.join("\n", parts);
    }

    private static String plural(int n, String noun) {
        return n + " " + noun + (n == 1 ? "" : "s");
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
