package com.williamcallahan.pftreport.domain.errors;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.williamcallahan.pftreport.domain.pipeline.ProcessingSnapshot;
import com.williamcallahan.pftreport.domain.pipeline.ProcessingStage;
import java.util.Objects;

/**
 * Payload returned while a report cannot be released yet, including after a failed run.
 *
 * @param status fixed status indicator, always "not_ready"
 * @param stage stage the request currently sits in
 * @param progress progress percentage
 * @param errorReason failure description when the run failed
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReportNotReadyResponse(String status, ProcessingStage stage, int progress, String errorReason)
        implements ApiResponse {
    private static final String STATUS_NOT_READY = "not_ready";

    public ReportNotReadyResponse {
        Objects.requireNonNull(status, "Status is required");
        Objects.requireNonNull(stage, "Stage is required");
    }

    public static ReportNotReadyResponse from(ProcessingSnapshot snapshot) {
        return new ReportNotReadyResponse(
                STATUS_NOT_READY, snapshot.stage(), snapshot.progress(), snapshot.errorReason());
    }
}
