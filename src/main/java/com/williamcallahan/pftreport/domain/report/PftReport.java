package com.williamcallahan.pftreport.domain.report;

import com.williamcallahan.pftreport.domain.pipeline.HistoricalMeasurement;
import com.williamcallahan.pftreport.domain.pipeline.SubjectDemographics;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Final artifact released once a request reaches COMPLETED.
 *
 * @param reportId identifier of the report, equal to the request id
 * @param demographics subject attributes as submitted
 * @param measurements standardized measurements
 * @param interpretation physiological interpretation
 * @param triage clinical priority
 * @param narrative prose sections
 * @param qualityAssessment review outcome
 * @param historicalData prior measurements supplied with the submission
 * @param generatedBy generator name
 * @param generatedAt generation time
 * @param processingMetadata stage list and timing
 */
public record PftReport(
        String reportId,
        SubjectDemographics demographics,
        ExtractedPftData measurements,
        PftInterpretation interpretation,
        TriageAssessment triage,
        ReportNarrative narrative,
        QualityAssessment qualityAssessment,
        List<HistoricalMeasurement> historicalData,
        String generatedBy,
        Instant generatedAt,
        ProcessingMetadata processingMetadata) {

    public static final String GENERATOR_NAME = "AutoPFTReport AI";

    public PftReport {
        Objects.requireNonNull(reportId, "Report id is required");
        Objects.requireNonNull(measurements, "Measurements are required");
        Objects.requireNonNull(interpretation, "Interpretation is required");
        Objects.requireNonNull(triage, "Triage is required");
        Objects.requireNonNull(narrative, "Narrative is required");
        Objects.requireNonNull(qualityAssessment, "Quality assessment is required");
        historicalData = historicalData == null ? List.of() : List.copyOf(historicalData);
    }

    /**
     * Workflow bookkeeping attached to the report.
     *
     * @param workflowVersion pipeline definition version
     * @param stagesExecuted stage names in execution order
     * @param processingSeconds wall-clock time from admission to report assembly
     */
    public record ProcessingMetadata(String workflowVersion, List<String> stagesExecuted, double processingSeconds) {
        public ProcessingMetadata {
            stagesExecuted = stagesExecuted == null ? List.of() : List.copyOf(stagesExecuted);
        }
    }
}
