package com.williamcallahan.pftreport.service.registry;

import com.williamcallahan.pftreport.domain.pipeline.ProcessingStage;

/**
 * Signals an attempt to mutate an entry that is already COMPLETED or FAILED.
 */
public class TerminalStateException extends IllegalStateException {

    private final ProcessingStage terminalStage;

    public TerminalStateException(String requestId, ProcessingStage terminalStage) {
        super("Request " + requestId + " is already terminal (" + terminalStage + ")");
        this.terminalStage = terminalStage;
    }

    public ProcessingStage getTerminalStage() {
        return terminalStage;
    }
}
