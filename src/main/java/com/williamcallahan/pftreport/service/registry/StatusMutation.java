package com.williamcallahan.pftreport.service.registry;

import com.williamcallahan.pftreport.domain.pipeline.ProcessingSnapshot;
import com.williamcallahan.pftreport.domain.pipeline.ProcessingStage;
import java.time.Instant;
import java.util.Objects;

/**
 * A single change to a request's status entry.
 *
 * <p>{@link #applyTo} is a pure function of the current snapshot: it either returns the next snapshot
 * or throws, leaving the stored value untouched.</p>
 */
public sealed interface StatusMutation
        permits StatusMutation.Advance, StatusMutation.Complete, StatusMutation.Fail {

    /**
     * Computes the snapshot that results from applying this mutation.
     *
     * @param current stored snapshot
     * @param now mutation timestamp
     * @return next snapshot with its version incremented
     * @throws TerminalStateException when {@code current} is terminal
     * @throws IllegalStageTransitionException when the move breaks the stage order
     */
    ProcessingSnapshot applyTo(ProcessingSnapshot current, Instant now);

    static Advance advance(ProcessingStage stage) {
        return new Advance(stage);
    }

    static Complete complete(String resultRef) {
        return new Complete(resultRef);
    }

    static Fail fail(ProcessingStage failedStage, String reason) {
        return new Fail(failedStage, reason);
    }

    /** Moves the request into the next pipeline stage. */
    record Advance(ProcessingStage stage) implements StatusMutation {
        public Advance {
            Objects.requireNonNull(stage, "Stage is required");
        }

        @Override
        public ProcessingSnapshot applyTo(ProcessingSnapshot current, Instant now) {
            rejectTerminal(current);
            if (!stage.isPipelineStage() || !current.stage().canTransitionTo(stage)) {
                throw new IllegalStageTransitionException(current.requestId(), current.stage(), stage);
            }
            return current.advancedTo(stage, now);
        }
    }

    /** Finishes the request successfully with a handle to the stored report. */
    record Complete(String resultRef) implements StatusMutation {
        public Complete {
            if (resultRef == null || resultRef.isBlank()) {
                throw new IllegalArgumentException("Result reference is required");
            }
        }

        @Override
        public ProcessingSnapshot applyTo(ProcessingSnapshot current, Instant now) {
            rejectTerminal(current);
            if (!current.stage().canTransitionTo(ProcessingStage.COMPLETED)) {
                throw new IllegalStageTransitionException(
                        current.requestId(), current.stage(), ProcessingStage.COMPLETED);
            }
            return current.completedWith(resultRef, now);
        }
    }

    /**
     * Fails the request. {@code failedStage} must be the stage the request currently sits in.
     */
    record Fail(ProcessingStage failedStage, String reason) implements StatusMutation {
        public Fail {
            Objects.requireNonNull(failedStage, "Failed stage is required");
            if (reason == null || reason.isBlank()) {
                throw new IllegalArgumentException("Failure reason is required");
            }
        }

        @Override
        public ProcessingSnapshot applyTo(ProcessingSnapshot current, Instant now) {
            rejectTerminal(current);
            if (current.stage() != failedStage) {
                throw new IllegalStageTransitionException("Request " + current.requestId() + " is in "
                        + current.stage() + ", cannot record a failure in " + failedStage);
            }
            return current.failedWith(failedStage, reason, now);
        }
    }

    private static void rejectTerminal(ProcessingSnapshot current) {
        if (current.isTerminal()) {
            throw new TerminalStateException(current.requestId(), current.stage());
        }
    }
}
