package com.williamcallahan.pftreport.web;

import com.williamcallahan.pftreport.domain.pipeline.ProcessingStage;
import com.williamcallahan.pftreport.domain.pipeline.Submission;

/**
 * Acknowledgement returned for an accepted upload.
 *
 * @param requestId id for status, progress and report lookups
 * @param stage always QUEUED at acknowledgement time
 * @param message human-readable confirmation
 * @param estimatedProcessingTime rough duration hint for clients
 */
public record SubmissionResponse(
        String requestId, ProcessingStage stage, String message, String estimatedProcessingTime) {

    private static final String ACCEPTED_MESSAGE = "PFT file uploaded successfully and queued for processing";
    private static final String ESTIMATED_PROCESSING_TIME = "2-5 minutes";

    public static SubmissionResponse accepted(Submission submission) {
        return new SubmissionResponse(
                submission.requestId(), submission.stage(), ACCEPTED_MESSAGE, ESTIMATED_PROCESSING_TIME);
    }
}
