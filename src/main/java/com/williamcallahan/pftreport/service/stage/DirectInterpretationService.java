package com.williamcallahan.pftreport.service.stage;

import com.williamcallahan.pftreport.config.AppProperties;
import com.williamcallahan.pftreport.domain.pipeline.HistoricalMeasurement;
import com.williamcallahan.pftreport.domain.pipeline.ProcessingStage;
import com.williamcallahan.pftreport.domain.pipeline.SubjectDemographics;
import com.williamcallahan.pftreport.domain.pipeline.SubmissionInput;
import com.williamcallahan.pftreport.domain.pipeline.TriagePriority;
import com.williamcallahan.pftreport.domain.report.DirectInterpretation;
import com.williamcallahan.pftreport.domain.report.ExtractedPftData;
import com.williamcallahan.pftreport.service.pipeline.PipelineContext;
import com.williamcallahan.pftreport.service.pipeline.StageOutcome;
import com.williamcallahan.pftreport.service.pipeline.StageProcessor;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Runs the interpretation and triage stages on measurements supplied as structured data.
 *
 * <p>Extraction is skipped: the caller's values become the extraction output of a throwaway context,
 * and nothing is registered, queued or stored. Each stage keeps its configured timeout.</p>
 */
@Service
public class DirectInterpretationService {
    private static final Logger log = LoggerFactory.getLogger(DirectInterpretationService.class);

    private static final String STRUCTURED_SOURCE = "structured-measurements.json";

    private final InterpretationStageProcessor interpreter;
    private final TriageStageProcessor triageSpecialist;
    private final AppProperties.Pipeline pipelineSettings;
    private final Clock clock;

    @Autowired
    public DirectInterpretationService(
            InterpretationStageProcessor interpreter,
            TriageStageProcessor triageSpecialist,
            AppProperties appProperties) {
        this(interpreter, triageSpecialist, appProperties, Clock.systemUTC());
    }

    DirectInterpretationService(
            InterpretationStageProcessor interpreter,
            TriageStageProcessor triageSpecialist,
            AppProperties appProperties,
            Clock clock) {
        this.interpreter = interpreter;
        this.triageSpecialist = triageSpecialist;
        this.pipelineSettings = appProperties.getPipeline();
        this.clock = clock;
    }

    /**
     * Interprets and triages one set of measurements.
     *
     * @param measurements measured, predicted and percent-predicted values; quality metrics are derived
     *                     when absent
     * @param demographics subject attributes
     * @param historicalData prior measurements, possibly empty
     * @return interpretation and triage, or an error when either stage fails
     * @throws IllegalArgumentException when no measured value or no demographics are supplied
     */
    public Mono<DirectInterpretation> interpret(
            ExtractedPftData measurements,
            SubjectDemographics demographics,
            List<HistoricalMeasurement> historicalData) {
        if (measurements == null || measurements.rawData().isEmpty()) {
            throw new IllegalArgumentException("rawData must contain at least one measured value");
        }
        if (demographics == null) {
            throw new IllegalArgumentException("patientDemographics is required");
        }

        String interpretationId = "direct-" + UUID.randomUUID();
        ExtractedPftData extracted = measurements.qualityMetrics() != null
                ? measurements
                : new ExtractedPftData(measurements.rawData(), measurements.predictedValues(),
                        measurements.percentPredicted(), DataExtractionStageProcessor.completenessOf(measurements));
        SubmissionInput submission = new SubmissionInput(
                STRUCTURED_SOURCE, new byte[0], demographics, historicalData, TriagePriority.ROUTINE, null);
        PipelineContext context = PipelineContext.start(interpretationId, submission)
                .with(ProcessingStage.EXTRACTING, extracted);

        log.info("Direct interpretation {} for subject {} ({} measured values)",
                interpretationId, demographics.subjectId(), extracted.rawData().size());
        return runStage(interpreter, context)
                .flatMap(interpreted -> runStage(triageSpecialist, interpreted))
                .map(triaged -> new DirectInterpretation(
                        interpretationId, triaged.interpretation(), triaged.triage(), clock.instant()));
    }

    private Mono<PipelineContext> runStage(StageProcessor processor, PipelineContext context) {
        ProcessingStage stage = processor.stage();
        Duration stageTimeout = pipelineSettings.timeoutFor(stage);
        return Mono.defer(() -> processor.process(context))
                .timeout(stageTimeout)
                .onErrorMap(TimeoutException.class, timeout -> new DirectInterpretationException(
                        stage + " exceeded its " + stageTimeout.toSeconds() + "s limit", timeout))
                .onErrorMap(error -> !(error instanceof DirectInterpretationException),
                        error -> new DirectInterpretationException(stage + " failed: " + error.getMessage(), error))
                .switchIfEmpty(Mono.error(() -> new DirectInterpretationException(stage + " produced no outcome")))
                .flatMap(outcome -> {
                    if (outcome instanceof StageOutcome.Success success) {
                        return Mono.just(context.with(stage, success.output()));
                    }
                    return Mono.error(new DirectInterpretationException(
                            stage + " failed: " + ((StageOutcome.Failure) outcome).reason()));
                });
    }
}
