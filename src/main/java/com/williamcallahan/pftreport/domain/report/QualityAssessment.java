package com.williamcallahan.pftreport.domain.report;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Objects;

/**
 * Review of a generated report's completeness and clarity; scores are on a 1-10 scale.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record QualityAssessment(
        int overallQuality,
        int completeness,
        int clarity,
        List<String> strengths,
        List<String> areasForImprovement,
        List<String> criticalIssues,
        ApprovalStatus approvalStatus) {

    public QualityAssessment {
        Objects.requireNonNull(approvalStatus, "Approval status is required");
        strengths = strengths == null ? List.of() : List.copyOf(strengths);
        areasForImprovement = areasForImprovement == null ? List.of() : List.copyOf(areasForImprovement);
        criticalIssues = criticalIssues == null ? List.of() : List.copyOf(criticalIssues);
    }
}
