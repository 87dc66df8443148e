package com.williamcallahan.pftreport.web;

/**
 * Canonical SSE event types for the progress stream.
 */
public final class SseConstants {

    /** SSE event type for a status change of the watched request. */
    public static final String EVENT_PROGRESS = "progress";

    /** SSE event type for the periodic repeat of the current status. */
    public static final String EVENT_HEARTBEAT = "heartbeat";

    /** SSE event type for error notifications sent to the client. */
    public static final String EVENT_ERROR = "error";

    /** Stable error code emitted when the request disappears while being watched. */
    public static final String ERROR_CODE_REQUEST_NOT_FOUND = "progress.request-not-found";

    /** Stable error code emitted when the status store cannot be read. */
    public static final String ERROR_CODE_STORE_UNAVAILABLE = "progress.store-unavailable";

    /** Stable error code for any other stream failure. */
    public static final String ERROR_CODE_STREAM_FAILURE = "progress.stream-failure";

    private SseConstants() {
        // Non-instantiable utility class
    }
}
