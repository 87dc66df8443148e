package com.williamcallahan.pftreport.service.pipeline;

import com.williamcallahan.pftreport.config.AppProperties;
import com.williamcallahan.pftreport.domain.pipeline.ProcessingSnapshot;
import com.williamcallahan.pftreport.domain.pipeline.ProcessingStage;
import com.williamcallahan.pftreport.domain.pipeline.SubmissionInput;
import com.williamcallahan.pftreport.domain.report.PftReport;
import com.williamcallahan.pftreport.service.registry.RegistryUnavailableException;
import com.williamcallahan.pftreport.service.registry.RequestRegistry;
import com.williamcallahan.pftreport.service.registry.StatusMutation;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Drives one request through the fixed, ordered list of stage processors.
 *
 * <p>The stage list is folded into a single Reactor chain that short-circuits on the first failure.
 * Before a stage runs, the status entry advances to it; afterwards the output is merged into the
 * context. The run is the only writer for its id, and every status change goes through the
 * {@link RequestRegistry}.</p>
 *
 * <p>Two budgets apply: each stage has its own timeout, and the whole run is bounded by the overall
 * timeout. Either one abandons the in-flight stage and records FAILED with the stage that was running.
 * There is no retry at this level.</p>
 */
@Service
public class PipelineOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private static final Counter COMPLETED_RUNS = Metrics.counter("pftreport.pipeline.runs", "outcome", "completed");
    private static final Counter FAILED_RUNS = Metrics.counter("pftreport.pipeline.runs", "outcome", "failed");
    private static final Counter TIMED_OUT_RUNS = Metrics.counter("pftreport.pipeline.runs", "outcome", "timed_out");
    private static final Counter LOST_RUNS = Metrics.counter("pftreport.pipeline.runs", "outcome", "store_lost");

    private final RequestRegistry registry;
    private final ArtifactStore artifactStore;
    private final ReportAssembler reportAssembler;
    private final AppProperties.Pipeline pipelineSettings;
    private final List<StageProcessor> processors;
    private final Clock clock;

    @Autowired
    public PipelineOrchestrator(
            RequestRegistry registry,
            ArtifactStore artifactStore,
            ReportAssembler reportAssembler,
            List<StageProcessor> processors,
            AppProperties appProperties) {
        this(registry, artifactStore, reportAssembler, processors, appProperties, Clock.systemUTC());
    }

    public PipelineOrchestrator(
            RequestRegistry registry,
            ArtifactStore artifactStore,
            ReportAssembler reportAssembler,
            List<StageProcessor> processors,
            AppProperties appProperties,
            Clock clock) {
        this.registry = registry;
        this.artifactStore = artifactStore;
        this.reportAssembler = reportAssembler;
        this.pipelineSettings = appProperties.getPipeline();
        this.processors = orderedProcessors(processors);
        this.clock = clock;
    }

    private static List<StageProcessor> orderedProcessors(List<StageProcessor> candidates) {
        Map<ProcessingStage, StageProcessor> byStage = new EnumMap<>(ProcessingStage.class);
        for (StageProcessor candidate : candidates) {
            ProcessingStage stage = candidate.stage();
            if (stage == null || !stage.isPipelineStage()) {
                throw new IllegalArgumentException("Stage processor " + candidate.getClass().getSimpleName()
                        + " declares a stage without processing: " + stage);
            }
            StageProcessor previous = byStage.put(stage, candidate);
            if (previous != null) {
                throw new IllegalArgumentException("Multiple stage processors registered for " + stage);
            }
        }
        for (ProcessingStage stage : ProcessingStage.pipelineStages()) {
            if (!byStage.containsKey(stage)) {
                throw new IllegalArgumentException("No stage processor registered for " + stage);
            }
        }
        List<StageProcessor> ordered = new ArrayList<>(byStage.values());
        ordered.sort(Comparator.comparing(StageProcessor::stage));
        return List.copyOf(ordered);
    }

    /**
     * Runs every stage for {@code requestId}, which must already have a QUEUED status entry.
     *
     * <p>The returned Mono emits the terminal snapshot. It errors only when the status store is lost,
     * in which case the outcome could not be recorded.</p>
     *
     * @param requestId id returned at admission
     * @param input submitted artifact and metadata
     * @return terminal snapshot
     */
    public Mono<ProcessingSnapshot> run(String requestId, SubmissionInput input) {
        return Mono.defer(() -> {
            RunTracker run = new RunTracker(requestId, clock.instant());
            Duration overallTimeout = pipelineSettings.getOverallTimeout();
            log.info("Starting pipeline for request {} ({} stages, overall budget {}s)",
                    requestId, processors.size(), overallTimeout.toSeconds());

            Mono<PipelineContext> chain = Mono.just(PipelineContext.start(requestId, input));
            for (StageProcessor processor : processors) {
                chain = chain.flatMap(context -> executeStage(processor, context, run));
            }
            return chain
                    .map(context -> storeReport(context, run))
                    .timeout(overallTimeout, Mono.defer(() -> Mono.error(overallTimeoutFailure(run, overallTimeout))))
                    .map(run::complete)
                    .onErrorResume(StageFailedException.class, failure -> Mono.fromCallable(() -> run.fail(failure)))
                    .doOnError(RegistryUnavailableException.class, storeFailure -> {
                        LOST_RUNS.increment();
                        log.error("Status store lost during run for request {}; outcome was not recorded",
                                requestId, storeFailure);
                    });
        });
    }

    private Mono<PipelineContext> executeStage(StageProcessor processor, PipelineContext context, RunTracker run) {
        ProcessingStage stage = processor.stage();
        return Mono.defer(() -> {
            run.enter(stage);
            Duration stageTimeout = pipelineSettings.timeoutFor(stage);
            return Mono.defer(() -> processor.process(context))
                    .timeout(stageTimeout)
                    .onErrorMap(TimeoutException.class, timeout -> StageFailedException.timeout(stage,
                            "Timeout in step " + stage + ": stage exceeded its " + stageTimeout.toSeconds()
                                    + "s limit"))
                    .onErrorMap(error -> !(error instanceof StageFailedException),
                            error -> new StageFailedException(stage,
                                    "Error in step " + stage + ": " + describe(error), error))
                    .switchIfEmpty(Mono.error(() -> new StageFailedException(stage,
                            "Error in step " + stage + ": stage produced no outcome")))
                    .flatMap(outcome -> merge(stage, outcome, context));
        });
    }

    private static Mono<PipelineContext> merge(ProcessingStage stage, StageOutcome outcome, PipelineContext context) {
        if (outcome instanceof StageOutcome.Success success) {
            return Mono.just(context.with(stage, success.output()));
        }
        StageOutcome.Failure failure = (StageOutcome.Failure) outcome;
        return Mono.error(new StageFailedException(stage, "Error in step " + stage + ": " + failure.reason()));
    }

    private PftReport assembleReport(PipelineContext context, RunTracker run) {
        ProcessingStage lastStage = ProcessingStage.pipelineStages().get(ProcessingStage.pipelineStages().size() - 1);
        try {
            return reportAssembler.assemble(context, run.startedAt, clock.instant());
        } catch (RuntimeException assemblyFailure) {
            throw new StageFailedException(lastStage,
                    "Error in step " + lastStage + ": report assembly failed: " + describe(assemblyFailure),
                    assemblyFailure);
        }
    }

    private String storeReport(PipelineContext context, RunTracker run) {
        return artifactStore.store(assembleReport(context, run));
    }

    private static StageFailedException overallTimeoutFailure(RunTracker run, Duration overallTimeout) {
        ProcessingStage stage = run.currentStage();
        return StageFailedException.timeout(stage, "Timeout in step " + stage
                + ": overall processing budget of " + overallTimeout.toSeconds() + "s exceeded");
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    /**
     * Serializes the run's own status writes so a timeout firing on another thread cannot interleave
     * with a stage advance.
     */
    private final class RunTracker {
        private final String requestId;
        private final Instant startedAt;
        private ProcessingStage currentStage = ProcessingStage.QUEUED;
        private boolean finished;

        private RunTracker(String requestId, Instant startedAt) {
            this.requestId = requestId;
            this.startedAt = startedAt;
        }

        synchronized ProcessingStage currentStage() {
            return currentStage;
        }

        synchronized void enter(ProcessingStage stage) {
            if (finished) {
                throw new IllegalStateException("Run for " + requestId + " already finished, not entering " + stage);
            }
            registry.update(requestId, StatusMutation.advance(stage));
            currentStage = stage;
        }

        synchronized ProcessingSnapshot complete(String resultRef) {
            if (finished) {
                return registry.get(requestId);
            }
            ProcessingSnapshot completed = registry.update(requestId, StatusMutation.complete(resultRef));
            finished = true;
            COMPLETED_RUNS.increment();
            log.info("Request {} completed in {}ms",
                    requestId, Duration.between(startedAt, completed.updatedAt()).toMillis());
            return completed;
        }

        synchronized ProcessingSnapshot fail(StageFailedException failure) {
            if (finished) {
                return registry.get(requestId);
            }
            ProcessingStage failedStage = currentStage;
            if (failure.stage() != failedStage) {
                log.warn("Failure reported for {} while request {} is in {}; recording against {}",
                        failure.stage(), requestId, failedStage, failedStage);
            }
            ProcessingSnapshot failed = registry.update(
                    requestId, StatusMutation.fail(failedStage, failure.getMessage()));
            finished = true;
            (failure.timedOut() ? TIMED_OUT_RUNS : FAILED_RUNS).increment();
            log.warn("Request {} failed in {}: {}", requestId, failedStage, failure.getMessage());
            return failed;
        }
    }
}
