package com.williamcallahan.pftreport.domain.report;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * Completeness and quality of the measurements recovered from an upload.
 *
 * @param dataCompleteness share of the tracked parameters that were found, 0-100
 * @param measurementQuality excellent, good, fair or poor
 * @param missingParameters tracked parameters absent from the upload
 * @param dataQualityIssues free-form quality concerns
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DataQualityMetrics(
        double dataCompleteness,
        String measurementQuality,
        List<String> missingParameters,
        List<String> dataQualityIssues) {

    public DataQualityMetrics {
        missingParameters = missingParameters == null ? List.of() : List.copyOf(missingParameters);
        dataQualityIssues = dataQualityIssues == null ? List.of() : List.copyOf(dataQualityIssues);
    }

    /**
     * Derives the quality grade from completeness the same way for every extraction path.
     */
    public static DataQualityMetrics fromCompleteness(double completeness, List<String> missingParameters) {
        String grade;
        if (completeness >= 80) {
            grade = "excellent";
        } else if (completeness >= 60) {
            grade = "good";
        } else if (completeness >= 40) {
            grade = "fair";
        } else {
            grade = "poor";
        }
        List<String> issues = completeness > 50 ? List.of() : List.of("low_data_completeness");
        return new DataQualityMetrics(completeness, grade, missingParameters, issues);
    }
}
