package com.williamcallahan.pftreport.service.registry;

/**
 * Signals that a registry entry already exists for a freshly allocated id.
 */
public class DuplicateRequestException extends IllegalStateException {

    public DuplicateRequestException(String requestId) {
        super("Request already registered: " + requestId);
    }
}
