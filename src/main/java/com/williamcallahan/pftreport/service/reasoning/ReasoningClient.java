package com.williamcallahan.pftreport.service.reasoning;

import reactor.core.publisher.Mono;

/**
 * Remote model used by the analytical stages.
 *
 * <p>Each call is opaque to the pipeline: it has its own latency, its own retry policy and its own
 * failure modes. Stages consult {@link #isAvailable()} once per invocation and fall back to their
 * rule-based analysis when no model is configured.</p>
 */
public interface ReasoningClient {

    boolean isAvailable();

    /**
     * Sends one prompt and emits the model's text reply.
     *
     * @param prompt complete prompt text
     * @return reply text, or an error once retries are exhausted
     */
    Mono<String> complete(String prompt);
}
