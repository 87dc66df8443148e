package com.williamcallahan.pftreport.service.reasoning;

/**
 * Raised when a model reply cannot be read as the structure a stage asked for.
 */
public class ReasoningResponseException extends RuntimeException {
    public ReasoningResponseException(String message) {
        super(message);
    }

    public ReasoningResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
