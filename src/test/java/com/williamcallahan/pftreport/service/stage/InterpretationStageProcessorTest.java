package com.williamcallahan.pftreport.service.stage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import com.williamcallahan.pftreport.TestFixtures;
import com.williamcallahan.pftreport.domain.pipeline.ProcessingStage;
import com.williamcallahan.pftreport.domain.report.ExtractedPftData;
import com.williamcallahan.pftreport.domain.report.InterpretationPattern;
import com.williamcallahan.pftreport.domain.report.PftInterpretation;
import com.williamcallahan.pftreport.domain.report.Severity;
import com.williamcallahan.pftreport.service.pipeline.PipelineContext;
import com.williamcallahan.pftreport.service.pipeline.StageOutcome;
import com.williamcallahan.pftreport.service.reasoning.ReasoningClient;
import com.williamcallahan.pftreport.service.reasoning.ReasoningResponseParser;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Mono;

/**
 * Verifies the ATS/ERS pattern rules and the model path of the interpretation stage.
 */
class InterpretationStageProcessorTest {

    private ReasoningClient reasoningClient;
    private InterpretationStageProcessor processor;

    @BeforeEach
    void setUp() {
        reasoningClient = mock(ReasoningClient.class);
        processor = new InterpretationStageProcessor(reasoningClient, new ReasoningResponseParser());
    }

    @Test
    void lowRatioIsObstructive() {
        PftInterpretation interpretation = interpret(TestFixtures.obstructiveData());

        assertEquals(InterpretationPattern.OBSTRUCTIVE, interpretation.pattern());
        assertEquals(Severity.MODERATE, interpretation.severity());
        assertTrue(interpretation.airwayObstruction());
        assertFalse(interpretation.restriction());
        assertNull(interpretation.reversibility());
        assertTrue(interpretation.keyFindings().contains("FEV1/FVC ratio 60% indicates airway obstruction"));
    }

    @Test
    void lowFvcWithPreservedRatioIsRestrictive() {
        PftInterpretation interpretation = interpret(data(
                Map.of("fvc", 2.4, "fev1", 2.0, "fev1_fvc_ratio", 83.0),
                Map.of("fvc_percent", 62.0, "fev1_percent", 66.0)));

        assertEquals(InterpretationPattern.RESTRICTIVE, interpretation.pattern());
        assertEquals(Severity.MODERATE, interpretation.severity());
        assertTrue(interpretation.keyFindings().contains("FVC 62% predicted suggests restriction"));
    }

    @Test
    void obstructionWithRestrictionIsMixed() {
        PftInterpretation interpretation = interpret(data(
                Map.of("fvc", 2.2, "fev1", 1.2, "fev1_fvc_ratio", 55.0),
                Map.of("fvc_percent", 58.0, "fev1_percent", 41.0)));

        assertEquals(InterpretationPattern.MIXED, interpretation.pattern());
        assertEquals(Severity.SEVERE, interpretation.severity());
    }

    @Test
    void measurementsWithinLimitsAreNormal() {
        PftInterpretation interpretation = interpret(data(
                Map.of("fvc", 4.5, "fev1", 3.6, "fev1_fvc_ratio", 80.0),
                Map.of("fvc_percent", 98.0, "fev1_percent", 95.0, "dlco_percent", 90.0)));

        assertEquals(InterpretationPattern.NORMAL, interpretation.pattern());
        assertEquals(Severity.NORMAL, interpretation.severity());
        assertTrue(interpretation.keyFindings().isEmpty());
    }

    @Test
    void isolatedDiffusionImpairmentIsInconclusive() {
        PftInterpretation interpretation = interpret(data(
                Map.of("fvc", 4.5, "fev1", 3.6, "fev1_fvc_ratio", 80.0),
                Map.of("fvc_percent", 98.0, "fev1_percent", 95.0, "dlco_percent", 60.0)));

        assertEquals(InterpretationPattern.INCONCLUSIVE, interpretation.pattern());
        assertTrue(interpretation.diffusionImpairment());
    }

    @Test
    void fvcResponseCountsWhenFev1ResponseFallsShort() {
        ExtractedPftData data = data(
                Map.of("fvc", 3.0, "post_bd_fvc", 3.5, "fev1", 2.0, "post_bd_fev1", 2.1),
                Map.of());

        InterpretationStageProcessor.Reversibility reversibility = InterpretationStageProcessor.assessReversibility(data);

        assertEquals(Boolean.TRUE, reversibility.reversible());
        assertEquals(16.67, reversibility.improvementPercent(), 0.01);
    }

    @Test
    void smallResponseIsNotReversible() {
        ExtractedPftData data = data(Map.of("fev1", 2.1, "post_bd_fev1", 2.2), Map.of());

        InterpretationStageProcessor.Reversibility reversibility = InterpretationStageProcessor.assessReversibility(data);

        assertEquals(Boolean.FALSE, reversibility.reversible());
        assertEquals(4.76, reversibility.improvementPercent(), 0.01);
    }

    @Test
    void modelReplyIsUsedWhenReasoningIsAvailable() {
        given(reasoningClient.isAvailable()).willReturn(true);
        given(reasoningClient.complete(anyString())).willReturn(Mono.just("""
                {"pattern": "restrictive", "severity": "very_severe", "reversibility": null,
                 "restriction": true, "key_findings": ["Reduced lung volumes"],
                 "interpretation_rationale": "Low TLC"}
                """));

        PftInterpretation interpretation = interpret(TestFixtures.obstructiveData());

        assertEquals(InterpretationPattern.RESTRICTIVE, interpretation.pattern());
        assertEquals(Severity.VERY_SEVERE, interpretation.severity());
        assertEquals("Low TLC", interpretation.interpretationRationale());

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(reasoningClient).complete(prompt.capture());
        assertTrue(prompt.getValue().contains("\"subject_id\" : \"P-1001\""), prompt.getValue());
        assertTrue(prompt.getValue().contains("\"fev1_fvc_ratio\" : 60.0"), prompt.getValue());
    }

    private PftInterpretation interpret(ExtractedPftData data) {
        PipelineContext context = PipelineContext.start("req-1", TestFixtures.textInput("unused"))
                .with(ProcessingStage.EXTRACTING, data);
        StageOutcome outcome = processor.process(context).block(Duration.ofSeconds(5));
        StageOutcome.Success success = assertInstanceOf(StageOutcome.Success.class, outcome);
        return assertInstanceOf(PftInterpretation.class, success.output());
    }

    private static ExtractedPftData data(Map<String, Double> raw, Map<String, Double> percent) {
        return new ExtractedPftData(raw, Map.of(), percent, null);
    }
}
