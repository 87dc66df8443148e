package com.williamcallahan.pftreport.service.progress;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.williamcallahan.pftreport.config.AppProperties;
import com.williamcallahan.pftreport.domain.pipeline.ProcessingSnapshot;
import com.williamcallahan.pftreport.domain.pipeline.ProcessingStage;
import com.williamcallahan.pftreport.service.registry.InMemoryRegistryStore;
import com.williamcallahan.pftreport.service.registry.RequestNotFoundException;
import com.williamcallahan.pftreport.service.registry.RequestRegistry;
import com.williamcallahan.pftreport.service.registry.StatusMutation;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

/**
 * Verifies live progress delivery: current snapshot on join, ordered updates, heartbeats and completion.
 */
class ProgressPublisherTest {

    private static final String REQUEST_ID = "req-1";

    private RequestRegistry registry;
    private ProgressPublisher publisher;

    @BeforeEach
    void setUp() {
        AppProperties appProperties = new AppProperties();
        appProperties.getProgress().setHeartbeatInterval(Duration.ofSeconds(15));
        registry = new RequestRegistry(new InMemoryRegistryStore(appProperties));
        publisher = new ProgressPublisher(registry, appProperties, Schedulers.immediate());
        registry.create(REQUEST_ID);
    }

    @Test
    void lateSubscriberStartsFromCurrentSnapshotAndFollowsToCompletion() {
        registry.update(REQUEST_ID, StatusMutation.advance(ProcessingStage.EXTRACTING));
        registry.update(REQUEST_ID, StatusMutation.advance(ProcessingStage.INTERPRETING));

        StepVerifier.create(publisher.subscribe(REQUEST_ID))
                .assertNext(event -> assertSnapshot(event, ProcessingStage.INTERPRETING))
                .then(() -> registry.update(REQUEST_ID, StatusMutation.advance(ProcessingStage.TRIAGING)))
                .assertNext(event -> assertSnapshot(event, ProcessingStage.TRIAGING))
                .then(() -> registry.update(REQUEST_ID, StatusMutation.advance(ProcessingStage.REPORTING)))
                .assertNext(event -> assertSnapshot(event, ProcessingStage.REPORTING))
                .then(() -> registry.update(REQUEST_ID, StatusMutation.advance(ProcessingStage.VALIDATING)))
                .assertNext(event -> assertSnapshot(event, ProcessingStage.VALIDATING))
                .then(() -> registry.update(REQUEST_ID, StatusMutation.complete("report:req-1")))
                .assertNext(event -> assertSnapshot(event, ProcessingStage.COMPLETED))
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        assertEquals(0, publisher.activeChannelCount());
    }

    @Test
    void subscriberToFinishedRequestGetsTerminalSnapshotOnly() {
        registry.update(REQUEST_ID, StatusMutation.advance(ProcessingStage.EXTRACTING));
        registry.update(REQUEST_ID, StatusMutation.fail(ProcessingStage.EXTRACTING, "Error in step EXTRACTING: x"));

        StepVerifier.create(publisher.subscribe(REQUEST_ID))
                .assertNext(event -> {
                    assertSnapshot(event, ProcessingStage.FAILED);
                    assertEquals(ProcessingStage.EXTRACTING, event.snapshot().failedStage());
                })
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void unknownRequestErrors() {
        StepVerifier.create(publisher.subscribe("missing"))
                .expectError(RequestNotFoundException.class)
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void staleDeliveriesAreDiscarded() {
        ProcessingSnapshot extracting = registry.update(REQUEST_ID, StatusMutation.advance(ProcessingStage.EXTRACTING));

        StepVerifier.create(publisher.subscribe(REQUEST_ID))
                .assertNext(event -> assertSnapshot(event, ProcessingStage.EXTRACTING))
                .then(() -> publisher.onSnapshot(extracting))
                .then(() -> registry.update(REQUEST_ID, StatusMutation.advance(ProcessingStage.INTERPRETING)))
                .assertNext(event -> assertSnapshot(event, ProcessingStage.INTERPRETING))
                .thenCancel()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void heartbeatsRepeatCurrentSnapshotWhileIdle() {
        registry.update(REQUEST_ID, StatusMutation.advance(ProcessingStage.EXTRACTING));

        StepVerifier.withVirtualTime(() -> publisher.subscribe(REQUEST_ID))
                .assertNext(event -> assertSnapshot(event, ProcessingStage.EXTRACTING))
                .thenAwait(Duration.ofSeconds(15))
                .assertNext(event -> {
                    assertEquals(ProgressEvent.Type.HEARTBEAT, event.type());
                    assertEquals(ProcessingStage.EXTRACTING, event.snapshot().stage());
                })
                .thenCancel()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void cancelledSubscriptionReleasesChannel() {
        StepVerifier.create(publisher.subscribe(REQUEST_ID))
                .assertNext(event -> {
                    assertSnapshot(event, ProcessingStage.QUEUED);
                    assertEquals(1, publisher.activeChannelCount());
                })
                .thenCancel()
                .verify(Duration.ofSeconds(5));

        assertEquals(0, publisher.activeChannelCount());
    }

    @Test
    void independentSubscribersShareUpdates() {
        StepVerifier.create(publisher.subscribe(REQUEST_ID).take(2))
                .assertNext(event -> assertSnapshot(event, ProcessingStage.QUEUED))
                .then(() -> StepVerifier.create(publisher.subscribe(REQUEST_ID))
                        .assertNext(event -> assertSnapshot(event, ProcessingStage.QUEUED))
                        .thenCancel()
                        .verify(Duration.ofSeconds(5)))
                .then(() -> registry.update(REQUEST_ID, StatusMutation.advance(ProcessingStage.EXTRACTING)))
                .assertNext(event -> assertSnapshot(event, ProcessingStage.EXTRACTING))
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    private static void assertSnapshot(ProgressEvent event, ProcessingStage expectedStage) {
        assertEquals(ProgressEvent.Type.SNAPSHOT, event.type());
        assertEquals(expectedStage, event.snapshot().stage());
    }
}
