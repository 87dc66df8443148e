package com.williamcallahan.pftreport.service.pipeline;

import com.williamcallahan.pftreport.config.AppProperties;
import com.williamcallahan.pftreport.domain.pipeline.ProcessingStage;
import com.williamcallahan.pftreport.domain.report.PftReport;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Builds the final report from a context that has passed every stage.
 */
@Component
public class ReportAssembler {

    private static final List<String> STAGE_NAMES = ProcessingStage.pipelineStages().stream()
            .map(stage -> stage.name().toLowerCase(Locale.ROOT))
            .toList();

    private final String workflowVersion;

    public ReportAssembler(AppProperties appProperties) {
        this.workflowVersion = appProperties.getPipeline().getWorkflowVersion();
    }

    /**
     * Assembles the report.
     *
     * @param context context holding output from every pipeline stage
     * @param startedAt when the run started
     * @param generatedAt assembly time
     * @return finished report keyed by the request id
     * @throws IllegalStateException when a stage output is missing
     */
    public PftReport assemble(PipelineContext context, Instant startedAt, Instant generatedAt) {
        double processingSeconds = Duration.between(startedAt, generatedAt).toMillis() / 1000.0;
        return new PftReport(
                context.requestId(),
                context.submission().demographics(),
                context.extractedData(),
                context.interpretation(),
                context.triage(),
                context.narrative(),
                context.qualityAssessment(),
                context.submission().historicalData(),
                PftReport.GENERATOR_NAME,
                generatedAt,
                new PftReport.ProcessingMetadata(workflowVersion, STAGE_NAMES, processingSeconds));
    }
}
