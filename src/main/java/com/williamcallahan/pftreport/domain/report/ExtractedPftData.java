package com.williamcallahan.pftreport.domain.report;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Standardized measurements produced by the extraction stage.
 *
 * <p>Keys are lower-case parameter names such as {@code fvc}, {@code fev1} or
 * {@code fev1_fvc_ratio}; percent-predicted keys carry a {@code _percent} suffix.</p>
 *
 * @param rawData measured values
 * @param predictedValues reference values for the subject, possibly empty
 * @param percentPredicted measured values as a percentage of predicted, possibly empty
 * @param qualityMetrics completeness and quality grading
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExtractedPftData(
        Map<String, Double> rawData,
        Map<String, Double> predictedValues,
        Map<String, Double> percentPredicted,
        DataQualityMetrics qualityMetrics) {

    public ExtractedPftData {
        rawData = presentValues(rawData);
        predictedValues = presentValues(predictedValues);
        percentPredicted = presentValues(percentPredicted);
    }

    // Reasoning replies use null for parameters they could not find.
    private static Map<String, Double> presentValues(Map<String, Double> values) {
        if (values == null) {
            return Map.of();
        }
        Map<String, Double> present = new LinkedHashMap<>();
        values.forEach((key, value) -> {
            if (key != null && value != null) {
                present.put(key, value);
            }
        });
        return Collections.unmodifiableMap(present);
    }

    public Double raw(String parameter) {
        return rawData.get(parameter);
    }

    public Double percent(String parameter) {
        return percentPredicted.get(parameter + "_percent");
    }
}
