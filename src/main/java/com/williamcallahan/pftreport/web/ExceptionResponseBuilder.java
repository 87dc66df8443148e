package com.williamcallahan.pftreport.web;

import com.williamcallahan.pftreport.domain.errors.ApiErrorResponse;
import com.williamcallahan.pftreport.domain.errors.ApiResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;

/**
 * Centralized utility for building consistent error responses across controllers.
 */
@Component
public class ExceptionResponseBuilder {

    /**
     * Builds a standardized error response with status and message.
     *
     * @param status The HTTP status code
     * @param message The error message
     * @return ResponseEntity with error details
     */
    public ResponseEntity<ApiResponse> buildErrorResponse(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ApiErrorResponse.error(message));
    }

    /**
     * Builds a standardized error response with status, message, and exception details.
     *
     * @param status The HTTP status code
     * @param message The error message
     * @param exception The exception that occurred
     * @return ResponseEntity with error details
     */
    public ResponseEntity<ApiResponse> buildErrorResponse(HttpStatus status, String message, Exception exception) {
        return ResponseEntity.status(status).body(ApiErrorResponse.error(message, describeException(exception)));
    }

    /**
     * Describes an exception with HTTP context when available.
     *
     * @param exception exception to describe
     * @return formatted exception details or null when no exception is provided
     */
    public String describeException(Exception exception) {
        if (exception == null) {
            return null;
        }
        String message = exception.getMessage();
        String description = exception.getClass().getSimpleName()
                + (message == null || message.isBlank() ? "" : ": " + message);
        if (exception instanceof HttpStatusCodeException httpException) {
            description = description + " [httpStatus=" + httpException.getStatusCode().value() + "]";
            String responseBody = httpException.getResponseBodyAsString();
            if (!responseBody.isBlank()) {
                description = description + " body=" + responseBody;
            }
        }
        return description;
    }
}
