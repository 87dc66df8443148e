package com.williamcallahan.pftreport.service.stage;

import com.williamcallahan.pftreport.domain.pipeline.ProcessingStage;
import com.williamcallahan.pftreport.domain.pipeline.TriagePriority;
import com.williamcallahan.pftreport.domain.report.ExtractedPftData;
import com.williamcallahan.pftreport.domain.report.InterpretationPattern;
import com.williamcallahan.pftreport.domain.report.PftInterpretation;
import com.williamcallahan.pftreport.domain.report.TriageAssessment;
import com.williamcallahan.pftreport.service.pipeline.PipelineContext;
import com.williamcallahan.pftreport.service.reasoning.ReasoningClient;
import com.williamcallahan.pftreport.service.reasoning.ReasoningResponseParser;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Assigns a clinical priority to the interpreted results.
 */
@Component
public class TriageStageProcessor extends ReasoningStageProcessor<TriageAssessment> {

    static final String SPECIALIST_TYPE = "Pulmonologist";

    private static final Map<TriagePriority, String> FOLLOW_UP_TIMELINES = Map.of(
            TriagePriority.CRITICAL, "Immediate (same day)",
            TriagePriority.URGENT, "Within 1-2 weeks",
            TriagePriority.ROUTINE, "Within 4-6 weeks");

    private static final String PROMPT_TEMPLATE = """
            Assign a clinical triage level to these PFT results. Prioritize patient safety.

            PATIENT DEMOGRAPHICS:
            __DEMOGRAPHICS__

            MEASUREMENTS:
            __MEASUREMENTS__

            INTERPRETATION:
            __INTERPRETATION__

            REQUESTED PRIORITY: __PRIORITY__

            Reply with JSON only:
            {
              "level": "<routine|urgent|critical>",
              "reasons": [<strings>],
              "recommended_followup": "<timeline>",
              "specialist_referral": <true|false>,
              "specialist_type": "<specialist or null>",
              "urgency_score": <0-10>,
              "risk_factors": [<strings>],
              "immediate_actions": [<strings>],
              "monitoring_requirements": [<strings>],
              "follow_up_instructions": [<strings>],
              "red_flags": [<strings>]
            }
            """;

    public TriageStageProcessor(ReasoningClient reasoningClient, ReasoningResponseParser responseParser) {
        super(reasoningClient, responseParser, TriageAssessment.class);
    }

    @Override
    public ProcessingStage stage() {
        return ProcessingStage.TRIAGING;
    }

    @Override
    protected String buildPrompt(PipelineContext context) {
        return PROMPT_TEMPLATE
                .replace("__DEMOGRAPHICS__", responseParser.toJson(context.submission().demographics()))
                .replace("__MEASUREMENTS__", responseParser.toJson(context.extractedData()))
                .replace("__INTERPRETATION__", responseParser.toJson(context.interpretation()))
                .replace("__PRIORITY__", context.submission().priority().wireValue());
    }

    @Override
    protected TriageAssessment analyzeWithRules(PipelineContext context) {
        ExtractedPftData data = context.extractedData();
        PftInterpretation interpretation = context.interpretation();
        InterpretationPattern pattern = interpretation.pattern();
        Double fev1Percent = data.percent("fev1");
        Double dlcoPercent = data.percent("dlco");

        TriagePriority level = TriagePriority.ROUTINE;
        int urgencyScore = 3;
        List<String> reasons = new ArrayList<>();
        List<String> immediateActions = new ArrayList<>();
        List<String> redFlags = new ArrayList<>();

        if (fev1Percent != null) {
            String fev1 = ReportFormatting.number(fev1Percent);
            if (fev1Percent < 30) {
                level = TriagePriority.CRITICAL;
                urgencyScore = 9;
                reasons.add("Very severe impairment (FEV1 " + fev1 + "% predicted)");
                immediateActions.add("Immediate pulmonologist consultation");
                redFlags.add("Severe respiratory impairment");
            } else if (fev1Percent < 50) {
                level = TriagePriority.URGENT;
                urgencyScore = 7;
                reasons.add("Severe impairment (FEV1 " + fev1 + "% predicted)");
                immediateActions.add("Expedited pulmonologist referral");
            } else if (fev1Percent < 70) {
                level = pattern == InterpretationPattern.OBSTRUCTIVE ? TriagePriority.URGENT : TriagePriority.ROUTINE;
                urgencyScore = 5;
                reasons.add("Moderate impairment (FEV1 " + fev1 + "% predicted)");
            }
        }

        if (dlcoPercent != null && dlcoPercent < 40) {
            if (level == TriagePriority.ROUTINE) {
                level = TriagePriority.URGENT;
                urgencyScore = Math.max(urgencyScore, 6);
            }
            reasons.add("Severe diffusion impairment (DLCO " + ReportFormatting.number(dlcoPercent) + "% predicted)");
            redFlags.add("Severe gas exchange impairment");
        }

        if (Boolean.TRUE.equals(interpretation.reversibility()) && pattern == InterpretationPattern.OBSTRUCTIVE) {
            if (level == TriagePriority.ROUTINE) {
                level = TriagePriority.URGENT;
                urgencyScore = Math.max(urgencyScore, 5);
            }
            reasons.add("Significant bronchodilator reversibility - possible uncontrolled asthma");
        }

        boolean specialistReferral = level != TriagePriority.ROUTINE || interpretation.severity().isAtLeastSevere();
        if (reasons.isEmpty()) {
            reasons.add(ReportFormatting.words(interpretation.severity().wireValue()) + " "
                    + pattern.wireValue() + " pattern");
        }
        if (immediateActions.isEmpty()) {
            immediateActions.add("Standard follow-up");
        }

        return new TriageAssessment(
                level,
                reasons,
                FOLLOW_UP_TIMELINES.get(level),
                specialistReferral,
                specialistReferral ? SPECIALIST_TYPE : null,
                urgencyScore,
                riskFactorsOf(interpretation),
                immediateActions,
                monitoringRequirements(level, pattern),
                followUpInstructions(level, pattern),
                redFlags);
    }

    private static List<String> riskFactorsOf(PftInterpretation interpretation) {
        List<String> riskFactors = new ArrayList<>();
        if (interpretation.airwayObstruction()) {
            riskFactors.add("Airway obstruction");
        }
        if (interpretation.restriction()) {
            riskFactors.add("Restrictive lung disease");
        }
        if (interpretation.diffusionImpairment()) {
            riskFactors.add("Impaired gas exchange");
        }
        return riskFactors;
    }

    private static List<String> monitoringRequirements(TriagePriority level, InterpretationPattern pattern) {
        List<String> monitoring = new ArrayList<>();
        switch (level) {
            case CRITICAL -> monitoring.addAll(List.of(
                    "Continuous monitoring if hospitalized",
                    "Serial PFTs every 3-6 months",
                    "Symptom monitoring"));
            case URGENT -> monitoring.addAll(List.of(
                    "PFT follow-up in 6-12 months",
                    "Symptom tracking",
                    "Response to treatment monitoring"));
            default -> monitoring.addAll(List.of(
                    "Annual PFT follow-up",
                    "Symptom monitoring as needed"));
        }
        if (pattern == InterpretationPattern.OBSTRUCTIVE) {
            monitoring.add("Peak flow monitoring");
        }
        return monitoring;
    }

    private static List<String> followUpInstructions(TriagePriority level, InterpretationPattern pattern) {
        List<String> instructions = new ArrayList<>();
        switch (level) {
            case CRITICAL -> instructions.addAll(List.of(
                    "Immediate medical evaluation required",
                    "Consider emergency department if symptomatic",
                    "Urgent pulmonologist consultation"));
            case URGENT -> instructions.addAll(List.of(
                    "Schedule appointment within 1-2 weeks",
                    "Contact provider if symptoms worsen",
                    "Consider pulmonologist referral"));
            default -> instructions.addAll(List.of(
                    "Routine follow-up as scheduled",
                    "Contact provider if new symptoms develop"));
        }
        if (pattern == InterpretationPattern.OBSTRUCTIVE) {
            instructions.add("Ensure proper inhaler technique");
            instructions.add("Consider bronchodilator therapy optimization");
        }
        return instructions;
    }
}
