package com.williamcallahan.pftreport.domain.errors;

/**
 * Defines the shared contract for JSON API responses so controllers can return consistent payloads.
 *
 * <p>The response contract stays framework-free so the records can be reused outside the web layer.</p>
 */
public sealed interface ApiResponse permits ApiErrorResponse, ReportNotReadyResponse {

    /**
     * Returns the status indicator for this response.
     *
     * @return response status for client handling
     */
    String status();
}
