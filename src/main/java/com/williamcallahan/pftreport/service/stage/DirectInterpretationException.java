package com.williamcallahan.pftreport.service.stage;

/**
 * Raised when interpreting or triaging structured measurements fails.
 */
public class DirectInterpretationException extends RuntimeException {

    public DirectInterpretationException(String message) {
        super(message);
    }

    public DirectInterpretationException(String message, Throwable cause) {
        super(message, cause);
    }
}
