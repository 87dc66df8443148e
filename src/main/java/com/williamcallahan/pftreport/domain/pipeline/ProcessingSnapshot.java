package com.williamcallahan.pftreport.domain.pipeline;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable point-in-time view of one processing request.
 *
 * <p>Every registry read returns one of these, so readers never observe a partially applied
 * mutation. {@code version} increases by one per accepted mutation and lets subscribers discard
 * stale or duplicate deliveries.</p>
 *
 * @param requestId opaque request identifier
 * @param stage current lifecycle stage
 * @param progress percentage complete, 0-100
 * @param currentStepLabel human-readable description of the stage
 * @param createdAt when the request was admitted
 * @param updatedAt when the last mutation was applied
 * @param completedAt when a terminal stage was reached, or null
 * @param errorReason failure description, present iff the stage is FAILED
 * @param failedStage stage that was executing when the run failed, present iff the stage is FAILED
 * @param resultRef artifact handle, present iff the stage is COMPLETED
 * @param version mutation counter, starting at zero for the QUEUED entry
 */
public record ProcessingSnapshot(
        String requestId,
        ProcessingStage stage,
        int progress,
        String currentStepLabel,
        Instant createdAt,
        Instant updatedAt,
        Instant completedAt,
        String errorReason,
        ProcessingStage failedStage,
        String resultRef,
        long version) {

    public ProcessingSnapshot {
        Objects.requireNonNull(requestId, "Request id is required");
        Objects.requireNonNull(stage, "Stage is required");
        Objects.requireNonNull(currentStepLabel, "Step label is required");
        Objects.requireNonNull(createdAt, "Creation time is required");
        Objects.requireNonNull(updatedAt, "Update time is required");
        if (progress < 0 || progress > 100) {
            throw new IllegalArgumentException("Progress must be within 0-100: " + progress);
        }
        if ((stage == ProcessingStage.FAILED) != (errorReason != null)) {
            throw new IllegalArgumentException("errorReason must be present iff stage is FAILED");
        }
        if ((stage == ProcessingStage.FAILED) != (failedStage != null)) {
            throw new IllegalArgumentException("failedStage must be present iff stage is FAILED");
        }
        if ((stage == ProcessingStage.COMPLETED) != (resultRef != null)) {
            throw new IllegalArgumentException("resultRef must be present iff stage is COMPLETED");
        }
        if (stage == ProcessingStage.COMPLETED && progress != 100) {
            throw new IllegalArgumentException("Completed entries must report 100% progress");
        }
        if (stage != ProcessingStage.COMPLETED && progress == 100) {
            throw new IllegalArgumentException("Only completed entries may report 100% progress");
        }
        if (stage.isTerminal() != (completedAt != null)) {
            throw new IllegalArgumentException("completedAt must be present iff the stage is terminal");
        }
    }

    /**
     * Creates the initial QUEUED entry for a freshly admitted request.
     */
    public static ProcessingSnapshot queued(String requestId, Instant createdAt) {
        return new ProcessingSnapshot(
                requestId,
                ProcessingStage.QUEUED,
                ProcessingStage.QUEUED.entryProgress(),
                ProcessingStage.QUEUED.label(),
                createdAt,
                createdAt,
                null,
                null,
                null,
                null,
                0L);
    }

    public boolean isTerminal() {
        return stage.isTerminal();
    }

    /**
     * Returns the entry for a forward move into a non-terminal pipeline stage.
     */
    public ProcessingSnapshot advancedTo(ProcessingStage nextStage, Instant now) {
        return new ProcessingSnapshot(
                requestId, nextStage, nextStage.entryProgress(), nextStage.label(),
                createdAt, now, null, null, null, null, version + 1);
    }

    /**
     * Returns the terminal COMPLETED entry pointing at the produced artifact.
     */
    public ProcessingSnapshot completedWith(String artifactRef, Instant now) {
        ProcessingStage done = ProcessingStage.COMPLETED;
        return new ProcessingSnapshot(
                requestId, done, done.entryProgress(), done.label(),
                createdAt, now, now, null, null, artifactRef, version + 1);
    }

    /**
     * Returns the terminal FAILED entry; progress stays frozen at its current value.
     */
    public ProcessingSnapshot failedWith(ProcessingStage stageAtFailure, String reason, Instant now) {
        return new ProcessingSnapshot(
                requestId, ProcessingStage.FAILED, progress, ProcessingStage.FAILED.label(),
                createdAt, now, now, reason, stageAtFailure, null, version + 1);
    }
}
