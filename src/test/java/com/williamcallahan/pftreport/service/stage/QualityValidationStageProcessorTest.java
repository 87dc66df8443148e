package com.williamcallahan.pftreport.service.stage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;

import com.williamcallahan.pftreport.TestFixtures;
import com.williamcallahan.pftreport.domain.pipeline.ProcessingStage;
import com.williamcallahan.pftreport.domain.report.ApprovalStatus;
import com.williamcallahan.pftreport.domain.report.QualityAssessment;
import com.williamcallahan.pftreport.domain.report.ReportNarrative;
import com.williamcallahan.pftreport.service.pipeline.PipelineContext;
import com.williamcallahan.pftreport.service.pipeline.StageOutcome;
import com.williamcallahan.pftreport.service.reasoning.ReasoningClient;
import com.williamcallahan.pftreport.service.reasoning.ReasoningResponseParser;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

/**
 * Verifies the quality review applied to generated reports.
 */
class QualityValidationStageProcessorTest {

    private ReasoningClient reasoningClient;
    private QualityValidationStageProcessor processor;

    @BeforeEach
    void setUp() {
        reasoningClient = mock(ReasoningClient.class);
        processor = new QualityValidationStageProcessor(reasoningClient, new ReasoningResponseParser());
    }

    @Test
    void completeReportRequiresHumanReview() {
        QualityAssessment assessment = review(TestFixtures.narrative());

        assertEquals(ApprovalStatus.REQUIRES_REVIEW, assessment.approvalStatus());
        assertEquals(QualityValidationStageProcessor.BASELINE_SCORE, assessment.overallQuality());
        assertEquals(QualityValidationStageProcessor.BASELINE_SCORE, assessment.completeness());
        assertEquals(QualityValidationStageProcessor.BASELINE_SCORE, assessment.clarity());
        assertTrue(assessment.criticalIssues().isEmpty());
    }

    @Test
    void missingSectionsNeedRevision() {
        QualityAssessment assessment = review(new ReportNarrative("Summary", "", null));

        assertEquals(ApprovalStatus.NEEDS_REVISION, assessment.approvalStatus());
        assertEquals(3, assessment.completeness());
        assertEquals(List.of(
                "Report section missing: detailed interpretation",
                "Report section missing: recommendations"), assessment.criticalIssues());
    }

    @Test
    void fencedModelReplyIsParsed() {
        given(reasoningClient.isAvailable()).willReturn(true);
        given(reasoningClient.complete(anyString())).willReturn(Mono.just("""
                ```json
                {"overall_quality": 9, "completeness": 8, "clarity": 9,
                 "strengths": ["Clear summary"], "approval_status": "approved"}
                ```
                """));

        QualityAssessment assessment = review(TestFixtures.narrative());

        assertEquals(ApprovalStatus.APPROVED, assessment.approvalStatus());
        assertEquals(9, assessment.overallQuality());
        assertEquals(List.of("Clear summary"), assessment.strengths());
    }

    private QualityAssessment review(ReportNarrative narrative) {
        PipelineContext context = TestFixtures.contextBefore(ProcessingStage.REPORTING, TestFixtures.textInput("unused"))
                .with(ProcessingStage.REPORTING, narrative);
        StageOutcome outcome = processor.process(context).block(Duration.ofSeconds(5));
        StageOutcome.Success success = assertInstanceOf(StageOutcome.Success.class, outcome);
        return assertInstanceOf(QualityAssessment.class, success.output());
    }
}
