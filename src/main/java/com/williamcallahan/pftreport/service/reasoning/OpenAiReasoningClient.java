package com.williamcallahan.pftreport.service.reasoning;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.williamcallahan.pftreport.config.AppProperties;
import com.williamcallahan.pftreport.support.ReasoningErrorClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

/**
 * OpenAI Java SDK-backed reasoning client.
 *
 * <p>The SDK client is built only when an API key is configured. Calls block inside the SDK, so
 * they run on {@code boundedElastic}. Transient failures are retried with exponential backoff, and the
 * last provider error reaches the calling stage once attempts run out.</p>
 */
@Service
public class OpenAiReasoningClient implements ReasoningClient {
    private static final Logger log = LoggerFactory.getLogger(OpenAiReasoningClient.class);

    private final AppProperties.Reasoning settings;
    private final OpenAIClient client;

    @Autowired
    public OpenAiReasoningClient(AppProperties appProperties) {
        this(appProperties, buildClient(appProperties.getReasoning()));
    }

    OpenAiReasoningClient(AppProperties appProperties, OpenAIClient client) {
        this.settings = appProperties.getReasoning();
        this.client = client;
        if (client == null) {
            log.warn("No reasoning API key configured (OPENAI_API_KEY) - stages will use rule-based analysis");
        } else {
            log.info("Reasoning client ready (model={}, baseUrl={})", settings.getModel(), settings.getBaseUrl());
        }
    }

    private static OpenAIClient buildClient(AppProperties.Reasoning reasoning) {
        if (!reasoning.isConfigured()) {
            return null;
        }
        return OpenAIOkHttpClient.builder()
                .apiKey(reasoning.getApiKey())
                .baseUrl(reasoning.getBaseUrl())
                .timeout(reasoning.getRequestTimeout())
                .build();
    }

    @Override
    public boolean isAvailable() {
        return client != null;
    }

    @Override
    public Mono<String> complete(String prompt) {
        if (client == null) {
            return Mono.error(new ReasoningUnavailableException("No reasoning provider is configured"));
        }
        return Mono.fromCallable(() -> requestCompletion(prompt))
                .subscribeOn(Schedulers.boundedElastic())
                .retryWhen(Retry.backoff(settings.getMaxAttempts() - 1, settings.getInitialBackoff())
                        .filter(ReasoningErrorClassifier::isTransient)
                        .doBeforeRetry(signal -> log.warn("Reasoning completion failed ({}), retry {}/{}",
                                ReasoningErrorClassifier.determineErrorType(signal.failure()),
                                signal.totalRetries() + 1, settings.getMaxAttempts() - 1))
                        .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure()));
    }

    private String requestCompletion(String prompt) {
        ChatCompletionCreateParams params = ChatCompletionCreateParams.builder()
                .addUserMessage(prompt)
                .model(settings.getModel())
                .maxCompletionTokens(settings.getMaxCompletionTokens())
                .build();
        log.debug("[LLM] Complete via {} (promptLength={})", settings.getModel(), prompt.length());
        ChatCompletion completion = client.chat().completions().create(params);
        return completion.choices().stream()
                .findFirst()
                .flatMap(choice -> choice.message().content())
                .filter(content -> !content.isBlank())
                .orElseThrow(() -> new ReasoningResponseException("Model returned an empty reply"));
    }
}
