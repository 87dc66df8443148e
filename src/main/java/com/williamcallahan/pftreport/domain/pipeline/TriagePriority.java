package com.williamcallahan.pftreport.domain.pipeline;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Clinical priority levels shared by submission requests and triage assessments.
 */
public enum TriagePriority {
    ROUTINE("routine"),
    URGENT("urgent"),
    CRITICAL("critical");

    private final String wireValue;

    TriagePriority(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    /**
     * Parses a priority name case-insensitively, defaulting to {@link #ROUTINE} when absent.
     *
     * @param rawValue value supplied by a client or a reasoning model
     * @return matching priority
     * @throws IllegalArgumentException when the value names no known priority
     */
    @JsonCreator
    public static TriagePriority parse(String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            return ROUTINE;
        }
        String normalized = rawValue.trim().toLowerCase(Locale.ROOT);
        for (TriagePriority priority : values()) {
            if (priority.wireValue.equals(normalized)) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown triage priority: " + rawValue);
    }
}
