package com.williamcallahan.pftreport.service.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.pftreport.TestFixtures;
import com.williamcallahan.pftreport.TestFixtures.ScriptedStage;
import com.williamcallahan.pftreport.config.AppProperties;
import com.williamcallahan.pftreport.domain.pipeline.ProcessingSnapshot;
import com.williamcallahan.pftreport.domain.pipeline.ProcessingStage;
import com.williamcallahan.pftreport.domain.pipeline.SubmissionInput;
import com.williamcallahan.pftreport.domain.report.PftReport;
import com.williamcallahan.pftreport.service.query.ResultLookup;
import com.williamcallahan.pftreport.service.query.StatusQueryService;
import com.williamcallahan.pftreport.service.registry.InMemoryRegistryStore;
import com.williamcallahan.pftreport.service.registry.RegistryStore;
import com.williamcallahan.pftreport.service.registry.RegistryUnavailableException;
import com.williamcallahan.pftreport.service.registry.RequestRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.UnaryOperator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

/**
 * Verifies stage sequencing, fail-fast handling and both timeout budgets of a pipeline run.
 */
class PipelineOrchestratorTest {

    private static final String REQUEST_ID = "req-1";

    private AppProperties appProperties;
    private SwitchableRegistryStore store;
    private RequestRegistry registry;
    private InMemoryArtifactStore artifactStore;
    private final List<ProcessingSnapshot> history = new CopyOnWriteArrayList<>();
    private final SubmissionInput input = TestFixtures.textInput(TestFixtures.SAMPLE_REPORT_TEXT);
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    @BeforeEach
    void setUp() {
        Metrics.addRegistry(meterRegistry);
        appProperties = new AppProperties();
        store = new SwitchableRegistryStore(new InMemoryRegistryStore(appProperties));
        registry = new RequestRegistry(store);
        registry.addListener(history::add);
        artifactStore = new InMemoryArtifactStore(appProperties);
        registry.create(REQUEST_ID);
    }

    @AfterEach
    void tearDown() {
        Metrics.removeRegistry(meterRegistry);
        meterRegistry.close();
    }

    private double runsWithOutcome(String outcome) {
        Counter counter = meterRegistry.find("pftreport.pipeline.runs").tag("outcome", outcome).counter();
        return counter == null ? 0 : counter.count();
    }

    private PipelineOrchestrator orchestrator(List<StageProcessor> processors) {
        return new PipelineOrchestrator(
                registry, artifactStore, new ReportAssembler(appProperties), processors, appProperties);
    }

    private PipelineOrchestrator orchestratorWith(ProcessingStage stage, StageProcessor override) {
        Map<ProcessingStage, StageProcessor> overrides = new EnumMap<>(ProcessingStage.class);
        overrides.put(stage, override);
        return orchestrator(TestFixtures.stageProcessors(overrides));
    }

    @Test
    void happyPathVisitsEveryStageInOrderAndStoresReport() {
        ProcessingSnapshot terminal = orchestrator(TestFixtures.stageProcessors()).run(REQUEST_ID, input).block();

        assertEquals(ProcessingStage.COMPLETED, terminal.stage());
        assertEquals(List.of(ProcessingStage.QUEUED, ProcessingStage.EXTRACTING, ProcessingStage.INTERPRETING,
                        ProcessingStage.TRIAGING, ProcessingStage.REPORTING, ProcessingStage.VALIDATING,
                        ProcessingStage.COMPLETED),
                history.stream().map(ProcessingSnapshot::stage).toList());
        List<Integer> progress = history.stream().map(ProcessingSnapshot::progress).toList();
        for (int i = 1; i < progress.size(); i++) {
            assertTrue(progress.get(i) > progress.get(i - 1), "progress must strictly increase: " + progress);
        }

        ResultLookup lookup = new StatusQueryService(registry, artifactStore).result(REQUEST_ID);
        PftReport report = assertInstanceOf(ResultLookup.Ready.class, lookup).report();
        assertEquals(REQUEST_ID, report.reportId());
        assertEquals(PftReport.GENERATOR_NAME, report.generatedBy());
        assertEquals(List.of("extracting", "interpreting", "triaging", "reporting", "validating"),
                report.processingMetadata().stagesExecuted());
        assertEquals(TestFixtures.urgentTriage(), report.triage());
    }

    @Test
    void reportedFailureStopsTheRunAtThatStage() {
        ScriptedStage triage = TestFixtures.succeeding(ProcessingStage.TRIAGING);
        Map<ProcessingStage, StageProcessor> overrides = new EnumMap<>(ProcessingStage.class);
        overrides.put(ProcessingStage.INTERPRETING, new ScriptedStage(ProcessingStage.INTERPRETING,
                context -> Mono.just(StageOutcome.failure("measurements are contradictory"))));
        overrides.put(ProcessingStage.TRIAGING, triage);

        ProcessingSnapshot terminal = orchestrator(TestFixtures.stageProcessors(overrides))
                .run(REQUEST_ID, input).block();

        assertEquals(ProcessingStage.FAILED, terminal.stage());
        assertEquals(ProcessingStage.INTERPRETING, terminal.failedStage());
        assertEquals(40, terminal.progress());
        assertEquals("Error in step INTERPRETING: measurements are contradictory", terminal.errorReason());
        assertEquals(0, triage.invocations());
        assertEquals(List.of(ProcessingStage.QUEUED, ProcessingStage.EXTRACTING, ProcessingStage.INTERPRETING,
                        ProcessingStage.FAILED),
                history.stream().map(ProcessingSnapshot::stage).toList());
        assertInstanceOf(ResultLookup.NotReady.class, new StatusQueryService(registry, artifactStore).result(REQUEST_ID));
    }

    @Test
    void thrownExceptionFailsTheStageWithItsMessage() {
        PipelineOrchestrator orchestrator = orchestratorWith(ProcessingStage.REPORTING,
                new ScriptedStage(ProcessingStage.REPORTING, context -> {
                    throw new IllegalStateException("template rendering exploded");
                }));

        ProcessingSnapshot terminal = orchestrator.run(REQUEST_ID, input).block();

        assertEquals(ProcessingStage.REPORTING, terminal.failedStage());
        assertEquals("Error in step REPORTING: template rendering exploded", terminal.errorReason());
    }

    @Test
    void errorSignalFailsTheStage() {
        PipelineOrchestrator orchestrator = orchestratorWith(ProcessingStage.EXTRACTING,
                new ScriptedStage(ProcessingStage.EXTRACTING,
                        context -> Mono.error(new IllegalArgumentException("unreadable PDF scan.pdf"))));

        ProcessingSnapshot terminal = orchestrator.run(REQUEST_ID, input).block();

        assertEquals(ProcessingStage.EXTRACTING, terminal.failedStage());
        assertEquals(20, terminal.progress());
        assertEquals("Error in step EXTRACTING: unreadable PDF scan.pdf", terminal.errorReason());
    }

    @Test
    void emptyStageResultFailsTheStage() {
        PipelineOrchestrator orchestrator = orchestratorWith(ProcessingStage.VALIDATING,
                new ScriptedStage(ProcessingStage.VALIDATING, context -> Mono.empty()));

        ProcessingSnapshot terminal = orchestrator.run(REQUEST_ID, input).block();

        assertEquals(ProcessingStage.VALIDATING, terminal.failedStage());
        assertEquals("Error in step VALIDATING: stage produced no outcome", terminal.errorReason());
    }

    @Test
    void stageTimeoutFailsOnlyThatStage() {
        appProperties.getPipeline().setStageTimeouts(Map.of(ProcessingStage.INTERPRETING, Duration.ofSeconds(1)));
        PipelineOrchestrator orchestrator = orchestratorWith(ProcessingStage.INTERPRETING,
                new ScriptedStage(ProcessingStage.INTERPRETING, context -> Mono.never()));

        StepVerifier.withVirtualTime(() -> orchestrator.run(REQUEST_ID, input))
                .thenAwait(Duration.ofSeconds(2))
                .assertNext(terminal -> {
                    assertEquals(ProcessingStage.FAILED, terminal.stage());
                    assertEquals(ProcessingStage.INTERPRETING, terminal.failedStage());
                    assertTrue(terminal.errorReason().startsWith("Timeout in step INTERPRETING"),
                            terminal.errorReason());
                })
                .verifyComplete();
    }

    @Test
    void overallTimeoutFailsTheStageInFlight() {
        appProperties.getPipeline().setOverallTimeout(Duration.ofSeconds(5));
        PipelineOrchestrator orchestrator = orchestratorWith(ProcessingStage.TRIAGING,
                new ScriptedStage(ProcessingStage.TRIAGING, context -> Mono.never()));

        StepVerifier.withVirtualTime(() -> orchestrator.run(REQUEST_ID, input))
                .expectSubscription()
                .expectNoEvent(Duration.ofSeconds(4))
                .thenAwait(Duration.ofSeconds(2))
                .assertNext(terminal -> {
                    assertEquals(ProcessingStage.FAILED, terminal.stage());
                    assertEquals(ProcessingStage.TRIAGING, terminal.failedStage());
                    assertEquals(60, terminal.progress());
                    assertEquals("Timeout in step TRIAGING: overall processing budget of 5s exceeded",
                            terminal.errorReason());
                })
                .verifyComplete();

        assertEquals(ProcessingStage.FAILED, registry.get(REQUEST_ID).stage());
        assertEquals(1, runsWithOutcome("timed_out"));
        assertEquals(0, runsWithOutcome("failed"));
    }

    @Test
    void eachRunCountsExactlyOneOutcome() {
        appProperties.getPipeline().setStageTimeouts(Map.of(ProcessingStage.EXTRACTING, Duration.ofSeconds(1)));
        PipelineOrchestrator stalled = orchestratorWith(ProcessingStage.EXTRACTING,
                new ScriptedStage(ProcessingStage.EXTRACTING, context -> Mono.never()));
        StepVerifier.withVirtualTime(() -> stalled.run(REQUEST_ID, input))
                .thenAwait(Duration.ofSeconds(2))
                .expectNextCount(1)
                .verifyComplete();

        registry.create("req-2");
        orchestratorWith(ProcessingStage.REPORTING, new ScriptedStage(ProcessingStage.REPORTING,
                context -> Mono.just(StageOutcome.failure("no template")))).run("req-2", input).block();

        registry.create("req-3");
        orchestrator(TestFixtures.stageProcessors()).run("req-3", input).block();

        assertEquals(1, runsWithOutcome("timed_out"));
        assertEquals(1, runsWithOutcome("failed"));
        assertEquals(1, runsWithOutcome("completed"));
    }

    @Test
    void lostStatusStoreErrorsTheRun() {
        PipelineOrchestrator orchestrator = orchestratorWith(ProcessingStage.TRIAGING,
                new ScriptedStage(ProcessingStage.TRIAGING, context -> {
                    store.failing = true;
                    return Mono.just(StageOutcome.success(TestFixtures.urgentTriage()));
                }));

        StepVerifier.create(orchestrator.run(REQUEST_ID, input))
                .expectError(RegistryUnavailableException.class)
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void everyStageNeedsExactlyOneProcessor() {
        List<StageProcessor> missing = new ArrayList<>(TestFixtures.stageProcessors());
        missing.remove(2);
        assertThrows(IllegalArgumentException.class, () -> orchestrator(missing));

        List<StageProcessor> duplicated = new ArrayList<>(TestFixtures.stageProcessors());
        duplicated.add(TestFixtures.succeeding(ProcessingStage.EXTRACTING));
        assertThrows(IllegalArgumentException.class, () -> orchestrator(duplicated));

        List<StageProcessor> queuedStage = new ArrayList<>(TestFixtures.stageProcessors());
        queuedStage.add(new ScriptedStage(ProcessingStage.QUEUED, context -> Mono.empty()));
        assertThrows(IllegalArgumentException.class, () -> orchestrator(queuedStage));
    }

    /** Delegating store that can be switched into an outage. */
    private static final class SwitchableRegistryStore implements RegistryStore {
        private final RegistryStore delegate;
        private volatile boolean failing;

        private SwitchableRegistryStore(RegistryStore delegate) {
            this.delegate = delegate;
        }

        @Override
        public Optional<ProcessingSnapshot> get(String requestId) {
            checkReachable();
            return delegate.get(requestId);
        }

        @Override
        public boolean insert(ProcessingSnapshot snapshot) {
            checkReachable();
            return delegate.insert(snapshot);
        }

        @Override
        public ProcessingSnapshot update(String requestId, UnaryOperator<ProcessingSnapshot> updater) {
            checkReachable();
            return delegate.update(requestId, updater);
        }

        @Override
        public long size() {
            checkReachable();
            return delegate.size();
        }

        private void checkReachable() {
            if (failing) {
                throw new RegistryUnavailableException("status store unreachable");
            }
        }
    }
}
