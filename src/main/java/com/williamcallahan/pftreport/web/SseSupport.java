package com.williamcallahan.pftreport.web;

import static com.williamcallahan.pftreport.web.SseConstants.*;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.williamcallahan.pftreport.service.progress.ProgressEvent;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

/**
 * Shared SSE support utilities for the progress stream.
 *
 * Provides JSON serialization, progress and error event creation.
 *
 * @see SseConstants for event type constants
 */
@Component
public class SseSupport {
    private static final Logger log = LoggerFactory.getLogger(SseSupport.class);

    /** Fallback JSON payload when SSE error serialization fails. */
    private static final String ERROR_FALLBACK_JSON =
            "{\"message\":\"Error serialization failed\",\"details\":\"See server logs\"}";

    private final ObjectWriter jsonWriter;

    /**
     * Creates SSE support wired to the application's ObjectMapper.
     *
     * @param objectMapper JSON mapper for safe SSE serialization
     */
    public SseSupport(ObjectMapper objectMapper) {
        this.jsonWriter = objectMapper.writer();
    }

    /**
     * Configures HTTP response headers for SSE streaming through proxies.
     * Disables buffering for Nginx and other reverse proxies that might delay streaming.
     *
     * @param response the servlet response to configure
     */
    public void configureStreamingHeaders(HttpServletResponse response) {
        response.addHeader("X-Accel-Buffering", "no"); // Nginx: disable proxy buffering
        response.addHeader(HttpHeaders.CACHE_CONTROL, "no-cache, no-transform");
    }

    /**
     * Serializes an object to JSON for SSE data payloads.
     *
     * @param objectToSerialize object to serialize
     * @return JSON string representation
     * @throws IllegalStateException if serialization fails
     */
    public String jsonSerialize(Object objectToSerialize) {
        try {
            return jsonWriter.writeValueAsString(objectToSerialize);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize SSE data", e);
        }
    }

    /**
     * Wraps a progress event as an SSE event carrying the status JSON.
     *
     * <p>Snapshots go out as {@code progress} events, heartbeats as {@code heartbeat} events. The
     * snapshot version is used as the event id so clients can spot repeats.</p>
     *
     * @param event event from the progress publisher
     * @return ServerSentEvent with the status payload
     */
    public ServerSentEvent<String> progressEvent(ProgressEvent event) {
        String eventType = event.type() == ProgressEvent.Type.HEARTBEAT ? EVENT_HEARTBEAT : EVENT_PROGRESS;
        return ServerSentEvent.<String>builder()
                .id(Long.toString(event.snapshot().version()))
                .event(eventType)
                .data(jsonSerialize(StatusResponse.from(event.snapshot())))
                .build();
    }

    /**
     * Creates a Flux containing a single SSE error event with safe JSON serialization.
     * Uses a localized fallback when error serialization itself fails, since this is the
     * terminal error path with nowhere further to propagate.
     *
     * @param payload error description
     * @return Flux emitting a single error event
     */
    public Flux<ServerSentEvent<String>> sseError(SseEventPayload payload) {
        String json;
        try {
            json = jsonWriter.writeValueAsString(payload);
        } catch (JsonProcessingException serializationFailure) {
            log.error("Failed to serialize SSE error payload", serializationFailure);
            json = ERROR_FALLBACK_JSON;
        }
        return Flux.just(ServerSentEvent.<String>builder().event(EVENT_ERROR).data(json).build());
    }

    /**
     * Payload record for error SSE events.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record SseEventPayload(String message, String details, String code, Boolean retryable) {

        /** Creates a builder with the required message field. */
        public static Builder builder(String message) {
            return new Builder(message);
        }

        /** Fluent builder that lets callers set only the fields they need. */
        public static final class Builder {
            private final String message;
            private String details;
            private String code;
            private Boolean retryable;

            private Builder(String message) {
                this.message = message;
            }

            public Builder details(String details) {
                this.details = details;
                return this;
            }

            public Builder code(String code) {
                this.code = code;
                return this;
            }

            public Builder retryable(Boolean retryable) {
                this.retryable = retryable;
                return this;
            }

            /** Builds the immutable payload record. */
            public SseEventPayload build() {
                return new SseEventPayload(message, details, code, retryable);
            }
        }
    }
}
