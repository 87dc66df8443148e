package com.williamcallahan.pftreport.service.pipeline;

import com.williamcallahan.pftreport.domain.pipeline.ProcessingStage;
import reactor.core.publisher.Mono;

/**
 * One analytical step of the pipeline.
 *
 * <p>Implementations read earlier outputs from the context and return their own output, or a failure.
 * An error signal is treated the same as a {@link StageOutcome.Failure} carrying the error message.
 * Blocking work belongs on {@code Schedulers.boundedElastic()}.</p>
 */
public interface StageProcessor {

    /**
     * Pipeline stage this processor runs in; exactly one processor exists per stage.
     */
    ProcessingStage stage();

    Mono<StageOutcome> process(PipelineContext context);
}
