package com.williamcallahan.pftreport.web;

import com.williamcallahan.pftreport.domain.errors.ApiResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Shared error responses for the pipeline's REST controllers.
 *
 * <p>Unexpected service failures map to 500 and rejected input maps to 400. Both bodies come from
 * {@link ExceptionResponseBuilder} so every endpoint answers with the same {@link ApiResponse} shape.</p>
 */
public abstract class BaseController {

    protected final ExceptionResponseBuilder exceptionBuilder;

    /** Wires the shared response builder. */
    protected BaseController(ExceptionResponseBuilder exceptionBuilder) {
        this.exceptionBuilder = exceptionBuilder;
    }

    /**
     * Answers 500 for a failure inside the pipeline services.
     *
     * @param failure what the service raised
     * @param operation short verb phrase such as "accept submission"
     * @return error body naming the operation
     */
    protected ResponseEntity<ApiResponse> handleServiceException(Exception failure, String operation) {
        return exceptionBuilder.buildErrorResponse(
                HttpStatus.INTERNAL_SERVER_ERROR, "Failed to " + operation + ": " + failure.getMessage(), failure);
    }

    /**
     * Answers 400 with the rejection message as-is.
     */
    protected ResponseEntity<ApiResponse> handleValidationException(IllegalArgumentException validationException) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, validationException.getMessage());
    }

    /** One-line description for log lines, including upstream HTTP status when present. */
    protected String describeException(Exception exception) {
        return exceptionBuilder.describeException(exception);
    }
}
