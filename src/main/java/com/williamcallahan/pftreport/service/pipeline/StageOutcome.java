package com.williamcallahan.pftreport.service.pipeline;

import java.util.Objects;

/**
 * Result of one stage invocation: either an output to carry forward or a reason to stop the run.
 */
public sealed interface StageOutcome permits StageOutcome.Success, StageOutcome.Failure {

    static Success success(Object output) {
        return new Success(output);
    }

    static Failure failure(String reason) {
        return new Failure(reason);
    }

    /** Stage output merged into the {@link PipelineContext} under the stage's key. */
    record Success(Object output) implements StageOutcome {
        public Success {
            Objects.requireNonNull(output, "Stage output is required");
        }
    }

    /** Reported failure; the run stops and the reason is recorded on the status entry. */
    record Failure(String reason) implements StageOutcome {
        public Failure {
            if (reason == null || reason.isBlank()) {
                throw new IllegalArgumentException("Failure reason is required");
            }
        }
    }
}
