package com.williamcallahan.pftreport.service.reasoning;

/**
 * Raised when a reasoning call is attempted without a configured provider.
 */
public class ReasoningUnavailableException extends RuntimeException {
    public ReasoningUnavailableException(String message) {
        super(message);
    }
}
