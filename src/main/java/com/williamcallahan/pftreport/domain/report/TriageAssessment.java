package com.williamcallahan.pftreport.domain.report;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.williamcallahan.pftreport.domain.pipeline.TriagePriority;
import java.util.List;
import java.util.Objects;

/**
 * Clinical priority assigned after interpretation.
 *
 * @param level assigned priority
 * @param reasons findings that drove the level
 * @param recommendedFollowup follow-up timeline
 * @param specialistReferral whether a specialist should see the subject
 * @param specialistType specialist to refer to, or null
 * @param urgencyScore 0-10 urgency
 * @param riskFactors abnormalities found by interpretation
 * @param immediateActions actions to take now
 * @param monitoringRequirements ongoing monitoring
 * @param followUpInstructions instructions for the care team
 * @param redFlags safety concerns that need attention
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TriageAssessment(
        TriagePriority level,
        List<String> reasons,
        String recommendedFollowup,
        boolean specialistReferral,
        String specialistType,
        int urgencyScore,
        List<String> riskFactors,
        List<String> immediateActions,
        List<String> monitoringRequirements,
        List<String> followUpInstructions,
        List<String> redFlags) {

    public TriageAssessment {
        Objects.requireNonNull(level, "Triage level is required");
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
        riskFactors = riskFactors == null ? List.of() : List.copyOf(riskFactors);
        immediateActions = immediateActions == null ? List.of() : List.copyOf(immediateActions);
        monitoringRequirements = monitoringRequirements == null ? List.of() : List.copyOf(monitoringRequirements);
        followUpInstructions = followUpInstructions == null ? List.of() : List.copyOf(followUpInstructions);
        redFlags = redFlags == null ? List.of() : List.copyOf(redFlags);
        if (urgencyScore < 0 || urgencyScore > 10) {
            throw new IllegalArgumentException("Urgency score must be within 0-10: " + urgencyScore);
        }
    }
}
