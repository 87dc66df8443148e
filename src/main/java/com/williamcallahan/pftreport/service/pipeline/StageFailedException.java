package com.williamcallahan.pftreport.service.pipeline;

import com.williamcallahan.pftreport.domain.pipeline.ProcessingStage;

/**
 * Carries a stage failure through the run's reactive chain until it is recorded on the status entry.
 */
class StageFailedException extends RuntimeException {

    private final ProcessingStage stage;
    private final boolean timedOut;

    StageFailedException(ProcessingStage stage, String reason) {
        this(stage, reason, null, false);
    }

    StageFailedException(ProcessingStage stage, String reason, Throwable cause) {
        this(stage, reason, cause, false);
    }

    private StageFailedException(ProcessingStage stage, String reason, Throwable cause, boolean timedOut) {
        super(reason, cause);
        this.stage = stage;
        this.timedOut = timedOut;
    }

    /** Failure raised when a stage or the whole run exceeds its time budget. */
    static StageFailedException timeout(ProcessingStage stage, String reason) {
        return new StageFailedException(stage, reason, null, true);
    }

    boolean timedOut() {
        return timedOut;
    }

    ProcessingStage stage() {
        return stage;
    }
}
