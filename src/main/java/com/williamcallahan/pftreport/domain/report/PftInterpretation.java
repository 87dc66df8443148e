package com.williamcallahan.pftreport.domain.report;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Objects;

/**
 * Physiological interpretation of one set of measurements.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PftInterpretation(
        InterpretationPattern pattern,
        Severity severity,
        Boolean reversibility,
        Double reversibilityPercent,
        boolean airwayObstruction,
        boolean restriction,
        boolean diffusionImpairment,
        List<String> keyFindings,
        List<String> likelyDiagnoses,
        List<String> recommendations,
        String interpretationRationale) {

    public PftInterpretation {
        Objects.requireNonNull(pattern, "Interpretation pattern is required");
        Objects.requireNonNull(severity, "Severity is required");
        keyFindings = keyFindings == null ? List.of() : List.copyOf(keyFindings);
        likelyDiagnoses = likelyDiagnoses == null ? List.of() : List.copyOf(likelyDiagnoses);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}
