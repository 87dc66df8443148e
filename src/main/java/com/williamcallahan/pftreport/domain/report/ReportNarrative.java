package com.williamcallahan.pftreport.domain.report;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Prose sections of the generated report.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReportNarrative(String clinicalSummary, String detailedInterpretation, String recommendationsText) {}
