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
import com.williamcallahan.pftreport.domain.pipeline.TriagePriority;
import com.williamcallahan.pftreport.domain.report.ExtractedPftData;
import com.williamcallahan.pftreport.domain.report.InterpretationPattern;
import com.williamcallahan.pftreport.domain.report.PftInterpretation;
import com.williamcallahan.pftreport.domain.report.Severity;
import com.williamcallahan.pftreport.domain.report.TriageAssessment;
import com.williamcallahan.pftreport.service.pipeline.PipelineContext;
import com.williamcallahan.pftreport.service.pipeline.StageOutcome;
import com.williamcallahan.pftreport.service.reasoning.ReasoningClient;
import com.williamcallahan.pftreport.service.reasoning.ReasoningResponseParser;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Mono;

/**
 * Verifies triage levels, urgency scores and follow-up plans assigned to interpreted results.
 */
class TriageStageProcessorTest {

    private ReasoningClient reasoningClient;
    private TriageStageProcessor processor;

    @BeforeEach
    void setUp() {
        reasoningClient = mock(ReasoningClient.class);
        processor = new TriageStageProcessor(reasoningClient, new ReasoningResponseParser());
    }

    @Test
    void verySevereImpairmentIsCritical() {
        TriageAssessment triage = triage(
                percents(Map.of("fev1_percent", 25.0)),
                interpretation(InterpretationPattern.OBSTRUCTIVE, Severity.VERY_SEVERE, null));

        assertEquals(TriagePriority.CRITICAL, triage.level());
        assertEquals(9, triage.urgencyScore());
        assertEquals("Immediate (same day)", triage.recommendedFollowup());
        assertTrue(triage.redFlags().contains("Severe respiratory impairment"));
        assertTrue(triage.immediateActions().contains("Immediate pulmonologist consultation"));
    }

    @Test
    void moderateObstructionIsUrgent() {
        TriageAssessment triage = triage(TestFixtures.obstructiveData(), TestFixtures.obstructiveInterpretation());

        assertEquals(TriagePriority.URGENT, triage.level());
        assertEquals(5, triage.urgencyScore());
        assertEquals("Within 1-2 weeks", triage.recommendedFollowup());
        assertTrue(triage.specialistReferral());
        assertEquals(TriageStageProcessor.SPECIALIST_TYPE, triage.specialistType());
        assertTrue(triage.reasons().contains("Moderate impairment (FEV1 62% predicted)"));
        assertTrue(triage.monitoringRequirements().contains("Peak flow monitoring"));
        assertTrue(triage.followUpInstructions().contains("Ensure proper inhaler technique"));
        assertEquals(List.of("Airway obstruction"), triage.riskFactors());
    }

    @Test
    void moderateRestrictionStaysRoutine() {
        TriageAssessment triage = triage(
                percents(Map.of("fev1_percent", 62.0, "fvc_percent", 60.0)),
                interpretation(InterpretationPattern.RESTRICTIVE, Severity.MODERATE, null));

        assertEquals(TriagePriority.ROUTINE, triage.level());
        assertEquals(5, triage.urgencyScore());
        assertFalse(triage.specialistReferral());
        assertNull(triage.specialistType());
        assertFalse(triage.monitoringRequirements().contains("Peak flow monitoring"));
    }

    @Test
    void severeDiffusionImpairmentRaisesRoutineToUrgent() {
        TriageAssessment triage = triage(
                percents(Map.of("fev1_percent", 85.0, "dlco_percent", 35.0)),
                interpretation(InterpretationPattern.INCONCLUSIVE, Severity.NORMAL, null));

        assertEquals(TriagePriority.URGENT, triage.level());
        assertEquals(6, triage.urgencyScore());
        assertTrue(triage.reasons().contains("Severe diffusion impairment (DLCO 35% predicted)"));
        assertEquals(List.of("Severe gas exchange impairment"), triage.redFlags());
    }

    @Test
    void normalResultsGetStandardFollowUp() {
        TriageAssessment triage = triage(
                percents(Map.of("fev1_percent", 95.0, "dlco_percent", 90.0)),
                interpretation(InterpretationPattern.NORMAL, Severity.NORMAL, null));

        assertEquals(TriagePriority.ROUTINE, triage.level());
        assertEquals(3, triage.urgencyScore());
        assertEquals("Within 4-6 weeks", triage.recommendedFollowup());
        assertEquals(List.of("Standard follow-up"), triage.immediateActions());
        assertEquals(1, triage.reasons().size());
        assertTrue(triage.redFlags().isEmpty());
    }

    @Test
    void reversibleObstructionIsUpgraded() {
        TriageAssessment triage = triage(
                percents(Map.of("fev1_percent", 82.0)),
                interpretation(InterpretationPattern.OBSTRUCTIVE, Severity.NORMAL, true));

        assertEquals(TriagePriority.URGENT, triage.level());
        assertEquals(5, triage.urgencyScore());
        assertTrue(triage.reasons().contains("Significant bronchodilator reversibility - possible uncontrolled asthma"));
    }

    @Test
    void promptCarriesRequestedPriority() {
        given(reasoningClient.isAvailable()).willReturn(true);
        given(reasoningClient.complete(anyString())).willReturn(Mono.just(
                "{\"level\": \"critical\", \"urgency_score\": 8, \"red_flags\": [\"Hypoxaemia\"]}"));

        TriageAssessment triage = triage(TestFixtures.obstructiveData(), TestFixtures.obstructiveInterpretation());

        assertEquals(TriagePriority.CRITICAL, triage.level());
        assertEquals(8, triage.urgencyScore());
        assertEquals(List.of("Hypoxaemia"), triage.redFlags());
        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(reasoningClient).complete(prompt.capture());
        assertTrue(prompt.getValue().contains("REQUESTED PRIORITY: routine"), prompt.getValue());
        assertTrue(prompt.getValue().contains("\"pattern\" : \"obstructive\""), prompt.getValue());
    }

    private TriageAssessment triage(ExtractedPftData data, PftInterpretation interpretation) {
        PipelineContext context = PipelineContext.start("req-1", TestFixtures.textInput("unused"))
                .with(ProcessingStage.EXTRACTING, data)
                .with(ProcessingStage.INTERPRETING, interpretation);
        StageOutcome outcome = processor.process(context).block(Duration.ofSeconds(5));
        StageOutcome.Success success = assertInstanceOf(StageOutcome.Success.class, outcome);
        return assertInstanceOf(TriageAssessment.class, success.output());
    }

    private static ExtractedPftData percents(Map<String, Double> percentPredicted) {
        return new ExtractedPftData(Map.of("fvc", 3.0, "fev1", 2.0), Map.of(), percentPredicted, null);
    }

    private static PftInterpretation interpretation(
            InterpretationPattern pattern, Severity severity, Boolean reversibility) {
        return new PftInterpretation(
                pattern,
                severity,
                reversibility,
                null,
                pattern == InterpretationPattern.OBSTRUCTIVE || pattern == InterpretationPattern.MIXED,
                pattern == InterpretationPattern.RESTRICTIVE || pattern == InterpretationPattern.MIXED,
                false,
                List.of(),
                List.of(),
                List.of(),
                "test");
    }
}
