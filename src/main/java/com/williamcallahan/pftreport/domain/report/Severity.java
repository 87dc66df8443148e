package com.williamcallahan.pftreport.domain.report;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Severity grading keyed off FEV1 percent predicted.
 */
public enum Severity {
    NORMAL,
    MILD,
    MODERATE,
    SEVERE,
    VERY_SEVERE;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Severity fromWireValue(String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            return NORMAL;
        }
        return valueOf(rawValue.trim().toUpperCase(Locale.ROOT).replace(' ', '_'));
    }

    /**
     * Grades severity from FEV1 percent predicted.
     *
     * @param fev1Percent FEV1 as a percentage of predicted, or null when unknown
     * @return graded severity, {@link #NORMAL} when the value is unknown
     */
    public static Severity fromFev1Percent(Double fev1Percent) {
        if (fev1Percent == null || fev1Percent >= 80) {
            return NORMAL;
        }
        if (fev1Percent >= 70) {
            return MILD;
        }
        if (fev1Percent >= 50) {
            return MODERATE;
        }
        if (fev1Percent >= 30) {
            return SEVERE;
        }
        return VERY_SEVERE;
    }

    public boolean isAtLeastSevere() {
        return this == SEVERE || this == VERY_SEVERE;
    }
}
