package com.williamcallahan.pftreport.service.stage;

import com.williamcallahan.pftreport.domain.pipeline.ProcessingStage;
import com.williamcallahan.pftreport.domain.report.ApprovalStatus;
import com.williamcallahan.pftreport.domain.report.QualityAssessment;
import com.williamcallahan.pftreport.domain.report.ReportNarrative;
import com.williamcallahan.pftreport.service.pipeline.PipelineContext;
import com.williamcallahan.pftreport.service.reasoning.ReasoningClient;
import com.williamcallahan.pftreport.service.reasoning.ReasoningResponseParser;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Reviews the generated report before it is released.
 *
 * <p>Without a reasoning model the review cannot judge clinical content, so every report is
 * marked {@link ApprovalStatus#REQUIRES_REVIEW}; a missing narrative section downgrades it to
 * {@link ApprovalStatus#NEEDS_REVISION}.</p>
 */
@Component
public class QualityValidationStageProcessor extends ReasoningStageProcessor<QualityAssessment> {

    static final int BASELINE_SCORE = 7;

    private static final String PROMPT_TEMPLATE = """
            Assess the quality and completeness of the following medical report.
            Evaluate completeness, clarity, medical accuracy, actionable recommendations and
            patient safety considerations.

            REPORT:
            __NARRATIVE__

            TRIAGE ASSESSMENT:
            __TRIAGE__

            Reply with JSON only:
            {
              "overall_quality": <1-10>,
              "completeness": <1-10>,
              "clarity": <1-10>,
              "strengths": [<strings>],
              "areas_for_improvement": [<strings>],
              "critical_issues": [<strings>],
              "approval_status": "<approved|needs_revision|requires_review>"
            }
            """;

    public QualityValidationStageProcessor(ReasoningClient reasoningClient, ReasoningResponseParser responseParser) {
        super(reasoningClient, responseParser, QualityAssessment.class);
    }

    @Override
    public ProcessingStage stage() {
        return ProcessingStage.VALIDATING;
    }

    @Override
    protected String buildPrompt(PipelineContext context) {
        return PROMPT_TEMPLATE
                .replace("__NARRATIVE__", responseParser.toJson(context.narrative()))
                .replace("__TRIAGE__", responseParser.toJson(context.triage()));
    }

    @Override
    protected QualityAssessment analyzeWithRules(PipelineContext context) {
        ReportNarrative narrative = context.narrative();
        List<String> criticalIssues = new ArrayList<>();
        requireSection(narrative.clinicalSummary(), "clinical summary", criticalIssues);
        requireSection(narrative.detailedInterpretation(), "detailed interpretation", criticalIssues);
        requireSection(narrative.recommendationsText(), "recommendations", criticalIssues);

        int completeness = Math.max(1, BASELINE_SCORE - 2 * criticalIssues.size());
        return new QualityAssessment(
                completeness,
                completeness,
                BASELINE_SCORE,
                List.of("Report generated successfully"),
                List.of("Unable to assess"),
                criticalIssues,
                criticalIssues.isEmpty() ? ApprovalStatus.REQUIRES_REVIEW : ApprovalStatus.NEEDS_REVISION);
    }

    private static void requireSection(String section, String name, List<String> criticalIssues) {
        if (section == null || section.isBlank()) {
            criticalIssues.add("Report section missing: " + name);
        }
    }
}
