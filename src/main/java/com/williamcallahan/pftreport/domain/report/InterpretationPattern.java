package com.williamcallahan.pftreport.domain.report;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Primary physiological pattern identified by the interpretation stage.
 */
public enum InterpretationPattern {
    NORMAL,
    OBSTRUCTIVE,
    RESTRICTIVE,
    MIXED,
    INCONCLUSIVE;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static InterpretationPattern fromWireValue(String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            return INCONCLUSIVE;
        }
        return valueOf(rawValue.trim().toUpperCase(Locale.ROOT));
    }
}
