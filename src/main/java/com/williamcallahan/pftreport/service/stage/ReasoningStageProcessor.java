package com.williamcallahan.pftreport.service.stage;

import com.williamcallahan.pftreport.service.pipeline.PipelineContext;
import com.williamcallahan.pftreport.service.pipeline.StageOutcome;
import com.williamcallahan.pftreport.service.pipeline.StageProcessor;
import com.williamcallahan.pftreport.service.reasoning.ReasoningClient;
import com.williamcallahan.pftreport.service.reasoning.ReasoningResponseParser;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Shared flow for stages that ask the reasoning model for a structured answer.
 *
 * <p>When the client is available the prompt is sent and the reply parsed into {@code T}; any
 * failure along that path fails the stage. Without a client the stage runs its rule-based
 * analysis instead. Both paths end in {@link #toOutcome}, where a stage can reject an output.</p>
 *
 * @param <T> stage output type
 */
abstract class ReasoningStageProcessor<T> implements StageProcessor {

    protected final ReasoningClient reasoningClient;
    protected final ReasoningResponseParser responseParser;
    private final Class<T> outputType;

    protected ReasoningStageProcessor(
            ReasoningClient reasoningClient, ReasoningResponseParser responseParser, Class<T> outputType) {
        this.reasoningClient = reasoningClient;
        this.responseParser = responseParser;
        this.outputType = outputType;
    }

    @Override
    public Mono<StageOutcome> process(PipelineContext context) {
        if (!reasoningClient.isAvailable()) {
            return Mono.fromCallable(() -> toOutcome(analyzeWithRules(context), context))
                    .subscribeOn(Schedulers.boundedElastic());
        }
        return Mono.fromCallable(() -> buildPrompt(context))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(reasoningClient::complete)
                .map(reply -> toOutcome(responseParser.parse(reply, outputType), context));
    }

    /**
     * Builds the prompt sent to the reasoning model; may block.
     */
    protected abstract String buildPrompt(PipelineContext context);

    /**
     * Deterministic analysis used when no reasoning model is configured; may block.
     */
    protected abstract T analyzeWithRules(PipelineContext context);

    protected StageOutcome toOutcome(T output, PipelineContext context) {
        return StageOutcome.success(output);
    }
}
