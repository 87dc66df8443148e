package com.williamcallahan.pftreport.domain.pipeline;

import java.util.Objects;

/**
 * Acknowledgement returned to a submitter once the QUEUED registry entry exists.
 *
 * @param requestId identifier for status, progress and result lookups
 * @param stage stage at acknowledgement time, always {@link ProcessingStage#QUEUED}
 */
public record Submission(String requestId, ProcessingStage stage) {
    public Submission {
        Objects.requireNonNull(requestId, "Request id is required");
        Objects.requireNonNull(stage, "Stage is required");
    }

    public static Submission queued(String requestId) {
        return new Submission(requestId, ProcessingStage.QUEUED);
    }
}
