package com.williamcallahan.pftreport.web;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.williamcallahan.pftreport.domain.pipeline.ProcessingSnapshot;
import com.williamcallahan.pftreport.domain.pipeline.ProcessingStage;
import com.williamcallahan.pftreport.service.progress.ProgressEvent;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.springframework.http.codec.ServerSentEvent;
import reactor.test.StepVerifier;

/**
 * Verifies SSE event construction for the progress stream.
 */
class SseSupportTest {

    private final SseSupport sseSupport = new SseSupport(new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS));

    @Test
    void snapshotsBecomeProgressEventsKeyedByVersion() {
        Instant now = Instant.parse("2026-01-15T10:00:00Z");
        ProcessingSnapshot interpreting = ProcessingSnapshot.queued("req-1", now)
                .advancedTo(ProcessingStage.EXTRACTING, now)
                .advancedTo(ProcessingStage.INTERPRETING, now);

        ServerSentEvent<String> event = sseSupport.progressEvent(ProgressEvent.snapshot(interpreting));

        assertEquals("2", event.id());
        assertEquals(SseConstants.EVENT_PROGRESS, event.event());
        assertTrue(event.data().contains("\"stage\":\"INTERPRETING\""), event.data());
        assertTrue(event.data().contains("\"progress\":40"), event.data());
        assertTrue(event.data().contains("\"createdAt\":\"2026-01-15T10:00:00Z\""), event.data());
    }

    @Test
    void heartbeatsUseTheirOwnEventType() {
        ProcessingSnapshot queued = ProcessingSnapshot.queued("req-1", Instant.parse("2026-01-15T10:00:00Z"));

        ServerSentEvent<String> event = sseSupport.progressEvent(ProgressEvent.heartbeat(queued));

        assertEquals(SseConstants.EVENT_HEARTBEAT, event.event());
        assertEquals("0", event.id());
    }

    @Test
    void errorEventOmitsUnsetFields() {
        StepVerifier.create(sseSupport.sseError(SseSupport.SseEventPayload.builder("Progress stream interrupted")
                        .code(SseConstants.ERROR_CODE_STORE_UNAVAILABLE)
                        .retryable(true)
                        .build()))
                .assertNext(event -> {
                    assertEquals(SseConstants.EVENT_ERROR, event.event());
                    assertEquals("{\"message\":\"Progress stream interrupted\",\"code\":\"progress.store-unavailable\","
                            + "\"retryable\":true}", event.data());
                })
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }
}
