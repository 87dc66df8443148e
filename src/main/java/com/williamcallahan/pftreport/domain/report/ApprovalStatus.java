package com.williamcallahan.pftreport.domain.report;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Outcome of the report quality review.
 */
public enum ApprovalStatus {
    APPROVED,
    NEEDS_REVISION,
    REQUIRES_REVIEW;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ApprovalStatus fromWireValue(String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            return REQUIRES_REVIEW;
        }
        return valueOf(rawValue.trim().toUpperCase(Locale.ROOT));
    }
}
