package com.williamcallahan.pftreport.service.admission;

/**
 * Signals that admission refused a submission because every run slot, and the wait queue where one is
 * configured, is full.
 */
public class CapacityExceededException extends RuntimeException {

    /**
     * Creates a capacity rejection with a human-readable message.
     *
     * @param message explanation of the rejection
     */
    public CapacityExceededException(String message) {
        super(message);
    }
}
