package com.williamcallahan.pftreport.config;

import com.williamcallahan.pftreport.domain.pipeline.ProcessingStage;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;

/**
 * Binds the {@code app.*} configuration tree for the processing pipeline.
 */
@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private static final String POSITIVE_FMT = "%s must be greater than zero";

    private Registry registry = new Registry();
    private Artifacts artifacts = new Artifacts();
    private Pipeline pipeline = new Pipeline();
    private Progress progress = new Progress();
    private Admission admission = new Admission();
    private Reasoning reasoning = new Reasoning();

    /**
     * Rejects settings that would leave the pipeline unable to run.
     */
    @PostConstruct
    public void validateConfiguration() {
        requirePositive("app.registry.retention", registry.getRetention());
        requirePositive("app.registry.max-entries", registry.getMaxEntries());
        requirePositive("app.artifacts.retention", artifacts.getRetention());
        requirePositive("app.artifacts.max-entries", artifacts.getMaxEntries());
        requirePositive("app.pipeline.overall-timeout", pipeline.getOverallTimeout());
        pipeline.getStageTimeouts().forEach((stage, timeout) -> {
            if (!stage.isPipelineStage()) {
                throw new IllegalArgumentException("app.pipeline.stage-timeouts has no meaning for stage " + stage);
            }
            requirePositive("app.pipeline.stage-timeouts." + stage.name().toLowerCase(Locale.ROOT), timeout);
        });
        requirePositive("app.progress.heartbeat-interval", progress.getHeartbeatInterval());
        requirePositive("app.admission.max-concurrent-runs", admission.getMaxConcurrentRuns());
        if (admission.getQueueCapacity() < 0) {
            throw new IllegalArgumentException("app.admission.queue-capacity must not be negative");
        }
        if (admission.getMaxFileSize() == null || admission.getMaxFileSize().toBytes() <= 0) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, "app.admission.max-file-size"));
        }
        if (admission.getSupportedFileTypes() == null || admission.getSupportedFileTypes().isEmpty()) {
            throw new IllegalArgumentException("app.admission.supported-file-types must list at least one type");
        }
        if (reasoning.getMaxAttempts() < 1) {
            throw new IllegalArgumentException("app.reasoning.max-attempts must be at least 1");
        }
        requirePositive("app.reasoning.initial-backoff", reasoning.getInitialBackoff());
        requirePositive("app.reasoning.request-timeout", reasoning.getRequestTimeout());
    }

    private static void requirePositive(String key, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, key));
        }
    }

    private static void requirePositive(String key, long value) {
        if (value <= 0) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, key));
        }
    }

    public Registry getRegistry() {
        return registry;
    }

    public void setRegistry(Registry registry) {
        this.registry = registry;
    }

    public Artifacts getArtifacts() {
        return artifacts;
    }

    public void setArtifacts(Artifacts artifacts) {
        this.artifacts = artifacts;
    }

    public Pipeline getPipeline() {
        return pipeline;
    }

    public void setPipeline(Pipeline pipeline) {
        this.pipeline = pipeline;
    }

    public Progress getProgress() {
        return progress;
    }

    public void setProgress(Progress progress) {
        this.progress = progress;
    }

    public Admission getAdmission() {
        return admission;
    }

    public void setAdmission(Admission admission) {
        this.admission = admission;
    }

    public Reasoning getReasoning() {
        return reasoning;
    }

    public void setReasoning(Reasoning reasoning) {
        this.reasoning = reasoning;
    }

    /** Status entry retention for the in-memory registry. */
    public static class Registry {
        private Duration retention = Duration.ofHours(24);
        private long maxEntries = 10_000;

        public Duration getRetention() { return retention; }
        public void setRetention(Duration retention) { this.retention = retention; }

        public long getMaxEntries() { return maxEntries; }
        public void setMaxEntries(long maxEntries) { this.maxEntries = maxEntries; }
    }

    /** Report retention for the in-memory artifact store. */
    public static class Artifacts {
        private Duration retention = Duration.ofHours(24);
        private long maxEntries = 1_000;

        public Duration getRetention() { return retention; }
        public void setRetention(Duration retention) { this.retention = retention; }

        public long getMaxEntries() { return maxEntries; }
        public void setMaxEntries(long maxEntries) { this.maxEntries = maxEntries; }
    }

    /**
     * Run budgets. Stage timeouts not overridden fall back to the built-in defaults.
     */
    public static class Pipeline {
        private static final Map<ProcessingStage, Duration> DEFAULT_STAGE_TIMEOUTS = Map.of(
                ProcessingStage.EXTRACTING, Duration.ofSeconds(60),
                ProcessingStage.INTERPRETING, Duration.ofSeconds(90),
                ProcessingStage.TRIAGING, Duration.ofSeconds(60),
                ProcessingStage.REPORTING, Duration.ofSeconds(120),
                ProcessingStage.VALIDATING, Duration.ofSeconds(30));

        private Duration overallTimeout = Duration.ofMinutes(10);
        private Map<ProcessingStage, Duration> stageTimeouts = new EnumMap<>(ProcessingStage.class);
        private String workflowVersion = "1.0";

        public Duration getOverallTimeout() { return overallTimeout; }
        public void setOverallTimeout(Duration overallTimeout) { this.overallTimeout = overallTimeout; }

        public Map<ProcessingStage, Duration> getStageTimeouts() { return stageTimeouts; }
        public void setStageTimeouts(Map<ProcessingStage, Duration> stageTimeouts) {
            this.stageTimeouts = stageTimeouts == null
                    ? new EnumMap<>(ProcessingStage.class)
                    : new EnumMap<>(stageTimeouts);
        }

        public String getWorkflowVersion() { return workflowVersion; }
        public void setWorkflowVersion(String workflowVersion) { this.workflowVersion = workflowVersion; }

        /**
         * Resolves the effective timeout for a pipeline stage.
         *
         * @param stage stage with a processor
         * @return configured override, or the built-in default
         */
        public Duration timeoutFor(ProcessingStage stage) {
            Duration override = stageTimeouts.get(stage);
            if (override != null) {
                return override;
            }
            Duration fallback = DEFAULT_STAGE_TIMEOUTS.get(stage);
            if (fallback == null) {
                throw new IllegalArgumentException("No processor runs in stage " + stage);
            }
            return fallback;
        }
    }

    /** Live progress stream settings. */
    public static class Progress {
        private Duration heartbeatInterval = Duration.ofSeconds(15);

        public Duration getHeartbeatInterval() { return heartbeatInterval; }
        public void setHeartbeatInterval(Duration heartbeatInterval) { this.heartbeatInterval = heartbeatInterval; }
    }

    /** Submission limits and the policy applied when every run slot is busy. */
    public static class Admission {
        private int maxConcurrentRuns = 10;
        private OverflowPolicy overflowPolicy = OverflowPolicy.QUEUE;
        private int queueCapacity = 100;
        private DataSize maxFileSize = DataSize.ofMegabytes(10);
        private List<String> supportedFileTypes = List.of("txt", "pdf", "csv", "xlsx", "xml", "json");

        public int getMaxConcurrentRuns() { return maxConcurrentRuns; }
        public void setMaxConcurrentRuns(int maxConcurrentRuns) { this.maxConcurrentRuns = maxConcurrentRuns; }

        public OverflowPolicy getOverflowPolicy() { return overflowPolicy; }
        public void setOverflowPolicy(OverflowPolicy overflowPolicy) { this.overflowPolicy = overflowPolicy; }

        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }

        public DataSize getMaxFileSize() { return maxFileSize; }
        public void setMaxFileSize(DataSize maxFileSize) { this.maxFileSize = maxFileSize; }

        public List<String> getSupportedFileTypes() { return supportedFileTypes; }
        public void setSupportedFileTypes(List<String> supportedFileTypes) {
            this.supportedFileTypes = supportedFileTypes == null
                    ? List.of()
                    : supportedFileTypes.stream().map(type -> type.trim().toLowerCase(Locale.ROOT)).toList();
        }
    }

    /** What admission does with a submission that finds every run slot busy. */
    public enum OverflowPolicy {
        QUEUE,
        REJECT
    }

    /** OpenAI-compatible reasoning endpoint used by the analytical stages. */
    public static class Reasoning {
        private String apiKey = "";
        private String baseUrl = "https://api.openai.com/v1";
        private String model = "gpt-4o";
        private long maxCompletionTokens = 4000;
        private Duration requestTimeout = Duration.ofSeconds(60);
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(500);

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }

        public long getMaxCompletionTokens() { return maxCompletionTokens; }
        public void setMaxCompletionTokens(long maxCompletionTokens) { this.maxCompletionTokens = maxCompletionTokens; }

        public Duration getRequestTimeout() { return requestTimeout; }
        public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public Duration getInitialBackoff() { return initialBackoff; }
        public void setInitialBackoff(Duration initialBackoff) { this.initialBackoff = initialBackoff; }

        public boolean isConfigured() {
            return apiKey != null && !apiKey.isBlank();
        }
    }
}
