package com.williamcallahan.pftreport.web;

import com.williamcallahan.pftreport.domain.pipeline.HistoricalMeasurement;
import com.williamcallahan.pftreport.domain.pipeline.SubjectDemographics;
import com.williamcallahan.pftreport.domain.report.ExtractedPftData;
import java.util.List;
import java.util.Map;

/**
 * Body of {@code POST /api/pft/interpret}: measurements that are already structured.
 *
 * @param rawData measured values keyed by lower-case parameter name
 * @param predictedValues optional reference values
 * @param percentPredicted optional percent-predicted values, keys suffixed with {@code _percent}
 * @param patientDemographics subject attributes
 * @param historicalData optional prior measurements
 */
public record DirectInterpretationRequest(
        Map<String, Double> rawData,
        Map<String, Double> predictedValues,
        Map<String, Double> percentPredicted,
        SubjectDemographics patientDemographics,
        List<HistoricalMeasurement> historicalData) {

    ExtractedPftData measurements() {
        return new ExtractedPftData(rawData, predictedValues, percentPredicted, null);
    }

    List<HistoricalMeasurement> history() {
        return historicalData == null ? List.of() : historicalData;
    }
}
