package com.williamcallahan.pftreport.service.stage;

import com.williamcallahan.pftreport.domain.pipeline.ProcessingStage;
import com.williamcallahan.pftreport.domain.report.ExtractedPftData;
import com.williamcallahan.pftreport.domain.report.InterpretationPattern;
import com.williamcallahan.pftreport.domain.report.PftInterpretation;
import com.williamcallahan.pftreport.domain.report.Severity;
import com.williamcallahan.pftreport.service.pipeline.PipelineContext;
import com.williamcallahan.pftreport.service.reasoning.ReasoningClient;
import com.williamcallahan.pftreport.service.reasoning.ReasoningResponseParser;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Classifies the physiological pattern and severity of the extracted measurements.
 *
 * <p>The rule-based path applies the ATS/ERS thresholds: FEV1/FVC below 70% is obstruction, FVC
 * below 80% predicted is restriction, DLCO below 75% predicted is diffusion impairment, and
 * severity is graded on FEV1 percent predicted. Bronchodilator response counts as reversible
 * when FEV1 or FVC improves by more than 12% and more than 200 mL.</p>
 */
@Component
public class InterpretationStageProcessor extends ReasoningStageProcessor<PftInterpretation> {

    static final double OBSTRUCTION_RATIO_THRESHOLD = 70;
    static final double RESTRICTION_FVC_PERCENT_THRESHOLD = 80;
    static final double DIFFUSION_DLCO_PERCENT_THRESHOLD = 75;
    static final double REVERSIBILITY_PERCENT_THRESHOLD = 12;
    static final double REVERSIBILITY_ML_THRESHOLD = 200;

    private static final String PROMPT_TEMPLATE = """
            Interpret the following PFT results using ATS/ERS guidelines, GOLD criteria and the
            patient's demographics and history.

            PATIENT DEMOGRAPHICS:
            __DEMOGRAPHICS__

            MEASUREMENTS:
            __MEASUREMENTS__

            HISTORICAL DATA:
            __HISTORY__

            Severity is graded on FEV1 percent predicted: normal >=80, mild 70-79, moderate 50-69,
            severe 30-49, very_severe <30. Reversibility requires >12% AND >200 mL improvement in
            FEV1 or FVC after bronchodilator.

            Reply with JSON only:
            {
              "pattern": "<normal|obstructive|restrictive|mixed|inconclusive>",
              "severity": "<normal|mild|moderate|severe|very_severe>",
              "reversibility": <true|false|null>,
              "reversibility_percent": <number or null>,
              "airway_obstruction": <true|false>,
              "restriction": <true|false>,
              "diffusion_impairment": <true|false>,
              "key_findings": [<strings>],
              "likely_diagnoses": [<strings>],
              "recommendations": [<strings>],
              "interpretation_rationale": "<explanation>"
            }
            """;

    public InterpretationStageProcessor(ReasoningClient reasoningClient, ReasoningResponseParser responseParser) {
        super(reasoningClient, responseParser, PftInterpretation.class);
    }

    @Override
    public ProcessingStage stage() {
        return ProcessingStage.INTERPRETING;
    }

    @Override
    protected String buildPrompt(PipelineContext context) {
        return PROMPT_TEMPLATE
                .replace("__DEMOGRAPHICS__", responseParser.toJson(context.submission().demographics()))
                .replace("__MEASUREMENTS__", responseParser.toJson(context.extractedData()))
                .replace("__HISTORY__", responseParser.toJson(context.submission().historicalData()));
    }

    @Override
    protected PftInterpretation analyzeWithRules(PipelineContext context) {
        ExtractedPftData data = context.extractedData();
        Double ratio = data.raw("fev1_fvc_ratio");
        Double fvcPercent = data.percent("fvc");
        Double fev1Percent = data.percent("fev1");
        Double dlcoPercent = data.percent("dlco");

        List<String> keyFindings = new ArrayList<>();
        InterpretationPattern pattern = InterpretationPattern.INCONCLUSIVE;

        boolean obstruction = ratio != null && ratio < OBSTRUCTION_RATIO_THRESHOLD;
        if (obstruction) {
            pattern = InterpretationPattern.OBSTRUCTIVE;
            keyFindings.add("FEV1/FVC ratio " + ReportFormatting.number(ratio) + "% indicates airway obstruction");
        }

        boolean restriction = fvcPercent != null && fvcPercent < RESTRICTION_FVC_PERCENT_THRESHOLD;
        if (restriction) {
            pattern = obstruction ? InterpretationPattern.MIXED : InterpretationPattern.RESTRICTIVE;
            keyFindings.add("FVC " + ReportFormatting.number(fvcPercent) + "% predicted suggests restriction");
        }

        boolean diffusionImpairment = dlcoPercent != null && dlcoPercent < DIFFUSION_DLCO_PERCENT_THRESHOLD;
        if (diffusionImpairment) {
            keyFindings.add("DLCO " + ReportFormatting.number(dlcoPercent)
                    + "% predicted indicates diffusion impairment");
        }

        if (!obstruction && !restriction && !diffusionImpairment) {
            pattern = InterpretationPattern.NORMAL;
        }

        Reversibility reversibility = assessReversibility(data);
        if (Boolean.TRUE.equals(reversibility.reversible())) {
            keyFindings.add("Significant bronchodilator reversibility demonstrated ("
                    + ReportFormatting.number(reversibility.improvementPercent()) + "% improvement)");
        }

        return new PftInterpretation(
                pattern,
                Severity.fromFev1Percent(fev1Percent),
                reversibility.reversible(),
                reversibility.improvementPercent(),
                obstruction,
                restriction,
                diffusionImpairment,
                keyFindings,
                List.of(),
                List.of("Manual review recommended"),
                "Automated rule-based interpretation");
    }

    /**
     * Compares post-bronchodilator values against baseline. FEV1 response is reported in preference
     * to FVC; reversibility is null when no post-bronchodilator pair is available.
     */
    static Reversibility assessReversibility(ExtractedPftData data) {
        Response fev1 = Response.of(data.raw("fev1"), data.raw("post_bd_fev1"));
        Response fvc = Response.of(data.raw("fvc"), data.raw("post_bd_fvc"));
        if (fev1 == null && fvc == null) {
            return new Reversibility(null, null);
        }
        boolean reversible = (fev1 != null && fev1.meetsCriteria()) || (fvc != null && fvc.meetsCriteria());
        Response reported = fev1 != null ? fev1 : fvc;
        if (reversible && (fev1 == null || !fev1.meetsCriteria())) {
            reported = fvc;
        }
        return new Reversibility(reversible, reported.changePercent());
    }

    record Reversibility(Boolean reversible, Double improvementPercent) {}

    private record Response(double changeMl, double changePercent) {
        static Response of(Double baselineLitres, Double postLitres) {
            if (baselineLitres == null || postLitres == null || baselineLitres <= 0) {
                return null;
            }
            double changeMl = (postLitres - baselineLitres) * 1000;
            return new Response(changeMl, changeMl / (baselineLitres * 1000) * 100);
        }

        boolean meetsCriteria() {
            return changePercent > REVERSIBILITY_PERCENT_THRESHOLD && changeMl > REVERSIBILITY_ML_THRESHOLD;
        }
    }
}
