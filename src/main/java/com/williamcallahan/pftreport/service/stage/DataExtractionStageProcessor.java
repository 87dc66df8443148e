package com.williamcallahan.pftreport.service.stage;

import com.williamcallahan.pftreport.domain.pipeline.ProcessingStage;
import com.williamcallahan.pftreport.domain.pipeline.SubmissionInput;
import com.williamcallahan.pftreport.domain.report.DataQualityMetrics;
import com.williamcallahan.pftreport.domain.report.ExtractedPftData;
import com.williamcallahan.pftreport.service.pipeline.PipelineContext;
import com.williamcallahan.pftreport.service.pipeline.StageOutcome;
import com.williamcallahan.pftreport.service.reasoning.ReasoningClient;
import com.williamcallahan.pftreport.service.reasoning.ReasoningResponseParser;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns the uploaded artifact into standardized measurements.
 *
 * <p>PDFs are read with PDFBox; every other type is decoded as UTF-8 text. The text is then
 * handed to the reasoning model, or parsed by {@link MeasurementTextParser} when none is
 * configured. An upload yielding no measurement at all fails the stage.</p>
 */
@Component
public class DataExtractionStageProcessor extends ReasoningStageProcessor<ExtractedPftData> {
    private static final Logger log = LoggerFactory.getLogger(DataExtractionStageProcessor.class);

    /** Upper bound on upload text embedded in a prompt. */
    static final int MAX_PROMPT_CONTENT_CHARS = 20_000;

    private static final String PROMPT_TEMPLATE = """
            You extract and standardize Pulmonary Function Test (PFT) data.
            Extract every available measurement from the file below.

            FILE TYPE: __FILE_TYPE__
            FILE CONTENT:
            __CONTENT__

            Reply with JSON only, in this shape (use null for anything not present):
            {
              "raw_data": {"fvc": <L>, "fev1": <L>, "fev1_fvc_ratio": <percent>, "pef": <L/s>,
                           "fef25_75": <L/s>, "tlc": <L>, "rv": <L>, "dlco": <mL/min/mmHg>,
                           "post_bd_fvc": <L>, "post_bd_fev1": <L>},
              "predicted_values": {"fvc": <L>, "fev1": <L>, "tlc": <L>, "dlco": <mL/min/mmHg>},
              "percent_predicted": {"fvc_percent": <n>, "fev1_percent": <n>, "tlc_percent": <n>, "dlco_percent": <n>},
              "quality_metrics": {"data_completeness": <0-100>, "measurement_quality": "<excellent|good|fair|poor>",
                                  "missing_parameters": [<names>], "data_quality_issues": [<concerns>]}
            }
            """;

    private final PdfTextExtractor pdfTextExtractor;

    public DataExtractionStageProcessor(
            ReasoningClient reasoningClient,
            ReasoningResponseParser responseParser,
            PdfTextExtractor pdfTextExtractor) {
        super(reasoningClient, responseParser, ExtractedPftData.class);
        this.pdfTextExtractor = pdfTextExtractor;
    }

    @Override
    public ProcessingStage stage() {
        return ProcessingStage.EXTRACTING;
    }

    @Override
    protected String buildPrompt(PipelineContext context) {
        SubmissionInput submission = context.submission();
        String content = decode(submission);
        if (content.length() > MAX_PROMPT_CONTENT_CHARS) {
            log.debug("Truncating {} characters of upload text for request {}",
                    content.length() - MAX_PROMPT_CONTENT_CHARS, context.requestId());
            content = content.substring(0, MAX_PROMPT_CONTENT_CHARS);
        }
        return PROMPT_TEMPLATE
                .replace("__FILE_TYPE__", submission.fileType())
                .replace("__CONTENT__", content);
    }

    @Override
    protected ExtractedPftData analyzeWithRules(PipelineContext context) {
        return MeasurementTextParser.parse(decode(context.submission()));
    }

    @Override
    protected StageOutcome toOutcome(ExtractedPftData extracted, PipelineContext context) {
        if (extracted.rawData().isEmpty()) {
            return StageOutcome.failure("no PFT measurements found in " + context.submission().fileName());
        }
        if (extracted.qualityMetrics() != null) {
            return StageOutcome.success(extracted);
        }
        return StageOutcome.success(new ExtractedPftData(
                extracted.rawData(),
                extracted.predictedValues(),
                extracted.percentPredicted(),
                completenessOf(extracted)));
    }

    static DataQualityMetrics completenessOf(ExtractedPftData extracted) {
        List<String> missing = new ArrayList<>();
        for (String parameter : MeasurementTextParser.CORE_PARAMETERS) {
            if (extracted.raw(parameter) == null) {
                missing.add(parameter);
            }
        }
        int total = MeasurementTextParser.CORE_PARAMETERS.size();
        return DataQualityMetrics.fromCompleteness((total - missing.size()) * 100.0 / total, missing);
    }

    private String decode(SubmissionInput submission) {
        if (!"pdf".equals(submission.fileType())) {
            return new String(submission.content(), StandardCharsets.UTF_8);
        }
        try {
            return pdfTextExtractor.extractText(submission.content());
        } catch (IOException unreadable) {
            throw new UncheckedIOException("unreadable PDF " + submission.fileName() + ": " + unreadable.getMessage(),
                    unreadable);
        }
    }
}
