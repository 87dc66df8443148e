package com.williamcallahan.pftreport.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.williamcallahan.pftreport.domain.pipeline.ProcessingSnapshot;
import com.williamcallahan.pftreport.domain.pipeline.ProcessingStage;
import java.time.Instant;

/**
 * Status payload shared by the status endpoint and the progress stream.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StatusResponse(
        String requestId,
        ProcessingStage stage,
        int progress,
        String currentStepLabel,
        String errorReason,
        ProcessingStage failedStage,
        Instant createdAt,
        Instant completedAt) {

    public static StatusResponse from(ProcessingSnapshot snapshot) {
        return new StatusResponse(
                snapshot.requestId(),
                snapshot.stage(),
                snapshot.progress(),
                snapshot.currentStepLabel(),
                snapshot.errorReason(),
                snapshot.failedStage(),
                snapshot.createdAt(),
                snapshot.completedAt());
    }
}
