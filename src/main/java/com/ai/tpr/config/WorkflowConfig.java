package com.ai.tpr.config;

import com.ai.tpr.calculation.PriorityUrbanClassifier;
import com.ai.tpr.calculation.TprCalculator;
import com.ai.tpr.calculation.UrbanClassifier;
import com.ai.tpr.service.WorkflowSettings;
import com.ai.tpr.threshold.ThresholdDetector;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Wires the calculation, threshold and matching settings from {@code tpr.*} properties.
 */
@Configuration
public class WorkflowConfig {

    @Value("${tpr.urban-threshold:50.0}")
    private double urbanThreshold;

    @Value("${tpr.rural-threshold:70.0}")
    private double ruralThreshold;

    @Value("${tpr.urban-percentage-cutoff:30.0}")
    private double urbanPercentageCutoff;

    @Value("${tpr.urban-keywords:central,metropol,city,urban,municipal,town}")
    private List<String> urbanKeywords;

    @Value("${tpr.match.fuzzy-cutoff:0.75}")
    private double fuzzyCutoff;

    @Value("${tpr.intent.min-confidence:0.5}")
    private double minConfidence;

    @Value("${tpr.session.max-conflict-retries:3}")
    private int maxConflictRetries;

    @Bean
    public UrbanClassifier urbanClassifier() {
        return new PriorityUrbanClassifier(urbanPercentageCutoff, urbanKeywords);
    }

    @Bean
    public TprCalculator tprCalculator(UrbanClassifier urbanClassifier) {
        return new TprCalculator(urbanClassifier);
    }

    @Bean
    public ThresholdDetector thresholdDetector() {
        return new ThresholdDetector(urbanThreshold, ruralThreshold);
    }

    @Bean
    public WorkflowSettings workflowSettings() {
        if (fuzzyCutoff < 0.0 || fuzzyCutoff > 1.0) {
            throw new IllegalStateException("tpr.match.fuzzy-cutoff must be within [0, 1]: " + fuzzyCutoff);
        }
        return WorkflowSettings.builder()
                .urbanThreshold(urbanThreshold)
                .fuzzyCutoff(fuzzyCutoff)
                .minConfidence(minConfidence)
                .maxConflictRetries(maxConflictRetries)
                .build();
    }
}
