package com.williamcallahan.pftreport.domain.report;

import java.time.Instant;

/**
 * Interpretation and triage of measurements that arrived already structured, outside a pipeline run.
 *
 * @param interpretationId correlation id used in logs
 * @param interpretation pattern and severity classification
 * @param triage priority assigned to the interpretation
 * @param processedAt when the triage finished
 */
public record DirectInterpretation(
        String interpretationId,
        PftInterpretation interpretation,
        TriageAssessment triage,
        Instant processedAt) {}
