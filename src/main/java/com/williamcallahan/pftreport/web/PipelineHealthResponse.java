package com.williamcallahan.pftreport.web;

import com.williamcallahan.pftreport.domain.pipeline.ProcessingStage;
import java.time.Instant;
import java.util.List;

/**
 * Pipeline overview returned by the health endpoint.
 *
 * @param status "healthy" or "degraded"
 * @param timestamp time of the check
 * @param activeRuns runs currently executing
 * @param queuedRuns admitted runs waiting for a slot
 * @param maxConcurrentRuns configured concurrency bound
 * @param trackedRequests status entries held by the registry, or -1 when it cannot be read
 * @param reasoningAvailable whether stages call the reasoning model
 * @param stages pipeline stages in execution order
 */
public record PipelineHealthResponse(
        String status,
        Instant timestamp,
        int activeRuns,
        int queuedRuns,
        int maxConcurrentRuns,
        long trackedRequests,
        boolean reasoningAvailable,
        List<ProcessingStage> stages) {}
