package com.williamcallahan.pftreport.service.registry;

/**
 * Signals that no registry entry exists for the requested id.
 */
public class RequestNotFoundException extends RuntimeException {

    private final String requestId;

    /**
     * Creates the exception for an unknown or expired request id.
     *
     * @param requestId id that was looked up
     */
    public RequestNotFoundException(String requestId) {
        super("Request not found: " + requestId);
        this.requestId = requestId;
    }

    public String getRequestId() {
        return requestId;
    }
}
