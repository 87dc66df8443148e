package com.williamcallahan.pftreport.service.stage;

import com.williamcallahan.pftreport.domain.pipeline.ProcessingStage;
import com.williamcallahan.pftreport.domain.pipeline.SubjectDemographics;
import com.williamcallahan.pftreport.domain.report.ExtractedPftData;
import com.williamcallahan.pftreport.domain.report.PftInterpretation;
import com.williamcallahan.pftreport.domain.report.ReportNarrative;
import com.williamcallahan.pftreport.domain.report.TriageAssessment;
import com.williamcallahan.pftreport.service.pipeline.PipelineContext;
import com.williamcallahan.pftreport.service.pipeline.StageOutcome;
import com.williamcallahan.pftreport.service.reasoning.ReasoningClient;
import com.williamcallahan.pftreport.service.reasoning.ReasoningResponseParser;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Writes the prose sections of the report from the accumulated analysis.
 */
@Component
public class ReportGenerationStageProcessor extends ReasoningStageProcessor<ReportNarrative> {

    private static final String PROMPT_TEMPLATE = """
            Write a professional pulmonary function test report for healthcare providers.
            Be concise, use appropriate medical terminology and highlight urgent findings.

            PATIENT DEMOGRAPHICS:
            __DEMOGRAPHICS__

            MEASUREMENTS:
            __MEASUREMENTS__

            INTERPRETATION:
            __INTERPRETATION__

            TRIAGE ASSESSMENT:
            __TRIAGE__

            HISTORICAL DATA:
            __HISTORY__

            Reply with JSON only:
            {
              "clinical_summary": "<concise clinical summary paragraph>",
              "detailed_interpretation": "<detailed interpretation section>",
              "recommendations_text": "<recommendations section>"
            }
            """;

    public ReportGenerationStageProcessor(ReasoningClient reasoningClient, ReasoningResponseParser responseParser) {
        super(reasoningClient, responseParser, ReportNarrative.class);
    }

    @Override
    public ProcessingStage stage() {
        return ProcessingStage.REPORTING;
    }

    @Override
    protected String buildPrompt(PipelineContext context) {
        return PROMPT_TEMPLATE
                .replace("__DEMOGRAPHICS__", responseParser.toJson(context.submission().demographics()))
                .replace("__MEASUREMENTS__", responseParser.toJson(context.extractedData()))
                .replace("__INTERPRETATION__", responseParser.toJson(context.interpretation()))
                .replace("__TRIAGE__", responseParser.toJson(context.triage()))
                .replace("__HISTORY__", responseParser.toJson(context.submission().historicalData()));
    }

    @Override
    protected ReportNarrative analyzeWithRules(PipelineContext context) {
        SubjectDemographics demographics = context.submission().demographics();
        ExtractedPftData data = context.extractedData();
        PftInterpretation interpretation = context.interpretation();
        TriageAssessment triage = context.triage();

        String fvc = ReportFormatting.numberOr(data.raw("fvc"), "Not measured");
        String fev1 = ReportFormatting.numberOr(data.raw("fev1"), "Not measured");
        String ratio = ReportFormatting.numberOr(data.raw("fev1_fvc_ratio"), "Not calculated");
        String pattern = interpretation.pattern().wireValue();
        String severity = interpretation.severity().wireValue();

        String clinicalSummary = demographics.age() + "-year-old " + demographics.gender()
                + " patient underwent pulmonary function testing. Results demonstrate " + pattern
                + " pattern with " + ReportFormatting.words(severity) + " severity. FVC: " + fvc
                + " L, FEV1: " + fev1 + " L, FEV1/FVC: " + ratio + "%.";

        String rationale = interpretation.interpretationRationale() == null
                || interpretation.interpretationRationale().isBlank()
                ? "No detailed rationale available."
                : interpretation.interpretationRationale();
        String detailedInterpretation = String.join("\n",
                "SPIROMETRY RESULTS:",
                "- FVC (Forced Vital Capacity): " + fvc + " L",
                "- FEV1 (Forced Expiratory Volume in 1 second): " + fev1 + " L",
                "- FEV1/FVC Ratio: " + ratio + "%",
                "",
                "INTERPRETATION:",
                "The pulmonary function test demonstrates a " + pattern + " pattern.",
                rationale,
                "",
                "SEVERITY: " + ReportFormatting.titleCase(severity));

        List<String> recommendations = new ArrayList<>(interpretation.recommendations());
        if (recommendations.isEmpty()) {
            recommendations.add("Follow-up as clinically indicated");
        }
        if (triage.recommendedFollowup() != null) {
            recommendations.add("Follow-up timeline: " + triage.recommendedFollowup());
        }
        String recommendationsText = recommendations.stream()
                .map(recommendation -> "- " + recommendation)
                .collect(Collectors.joining("\n"));

        return new ReportNarrative(clinicalSummary, detailedInterpretation, recommendationsText);
    }

    @Override
    protected StageOutcome toOutcome(ReportNarrative narrative, PipelineContext context) {
        if (narrative.clinicalSummary() == null || narrative.clinicalSummary().isBlank()) {
            return StageOutcome.failure("generated report has no clinical summary");
        }
        return StageOutcome.success(narrative);
    }
}
