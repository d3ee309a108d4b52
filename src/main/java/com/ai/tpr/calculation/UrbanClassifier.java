package com.ai.tpr.calculation;

import java.util.List;

/**
 * Decides whether a ward is urban from its facility rows.
 */
public interface UrbanClassifier {

    UrbanClassification classify(String wardName, List<FacilityRecord> wardRecords);
}
