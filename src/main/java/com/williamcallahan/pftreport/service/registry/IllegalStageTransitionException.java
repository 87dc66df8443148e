package com.williamcallahan.pftreport.service.registry;

import com.williamcallahan.pftreport.domain.pipeline.ProcessingStage;

/**
 * Signals a mutation that would move a request backwards, skip a stage, or break a field invariant.
 */
public class IllegalStageTransitionException extends IllegalStateException {

    /**
     * Creates the exception for a rejected stage move.
     *
     * @param requestId request being mutated
     * @param from current stage
     * @param to requested stage
     */
    public IllegalStageTransitionException(String requestId, ProcessingStage from, ProcessingStage to) {
        super("Illegal stage transition for " + requestId + ": " + from + " -> " + to);
    }

    /**
     * Creates the exception with a free-form explanation.
     *
     * @param message explanation of the rejected mutation
     */
    public IllegalStageTransitionException(String message) {
        super(message);
    }
}
