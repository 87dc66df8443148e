package com.williamcallahan.pftreport.service.pipeline;

import com.williamcallahan.pftreport.domain.pipeline.ProcessingStage;
import com.williamcallahan.pftreport.domain.pipeline.SubmissionInput;
import com.williamcallahan.pftreport.domain.report.ExtractedPftData;
import com.williamcallahan.pftreport.domain.report.PftInterpretation;
import com.williamcallahan.pftreport.domain.report.QualityAssessment;
import com.williamcallahan.pftreport.domain.report.ReportNarrative;
import com.williamcallahan.pftreport.domain.report.TriageAssessment;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable accumulator handed from stage to stage within one run.
 *
 * <p>Holds the submission and every completed stage output keyed by stage. {@link #with} returns a
 * new context, so a stage can never observe or alter another run's data.</p>
 */
public final class PipelineContext {

    private final String requestId;
    private final SubmissionInput submission;
    private final Map<ProcessingStage, Object> outputs;

    private PipelineContext(String requestId, SubmissionInput submission, Map<ProcessingStage, Object> outputs) {
        this.requestId = requestId;
        this.submission = submission;
        this.outputs = outputs;
    }

    public static PipelineContext start(String requestId, SubmissionInput submission) {
        Objects.requireNonNull(requestId, "Request id is required");
        Objects.requireNonNull(submission, "Submission is required");
        return new PipelineContext(requestId, submission, Collections.emptyMap());
    }

    /**
     * Returns a context that also carries {@code output} for {@code stage}.
     *
     * @throws IllegalStateException when the stage already produced output
     */
    public PipelineContext with(ProcessingStage stage, Object output) {
        Objects.requireNonNull(stage, "Stage is required");
        Objects.requireNonNull(output, "Stage output is required");
        if (outputs.containsKey(stage)) {
            throw new IllegalStateException("Stage " + stage + " already produced output for " + requestId);
        }
        Map<ProcessingStage, Object> next = new EnumMap<>(ProcessingStage.class);
        next.putAll(outputs);
        next.put(stage, output);
        return new PipelineContext(requestId, submission, Collections.unmodifiableMap(next));
    }

    public String requestId() {
        return requestId;
    }

    public SubmissionInput submission() {
        return submission;
    }

    public boolean hasOutput(ProcessingStage stage) {
        return outputs.containsKey(stage);
    }

    /**
     * Reads a prior stage's output with its expected type.
     *
     * @throws IllegalStateException when the stage has not run or produced a different type
     */
    public <T> T output(ProcessingStage stage, Class<T> type) {
        Object value = outputs.get(stage);
        if (value == null) {
            throw new IllegalStateException("No output from stage " + stage + " for " + requestId);
        }
        if (!type.isInstance(value)) {
            throw new IllegalStateException("Stage " + stage + " produced " + value.getClass().getSimpleName()
                    + ", expected " + type.getSimpleName());
        }
        return type.cast(value);
    }

    public ExtractedPftData extractedData() {
        return output(ProcessingStage.EXTRACTING, ExtractedPftData.class);
    }

    public PftInterpretation interpretation() {
        return output(ProcessingStage.INTERPRETING, PftInterpretation.class);
    }

    public TriageAssessment triage() {
        return output(ProcessingStage.TRIAGING, TriageAssessment.class);
    }

    public ReportNarrative narrative() {
        return output(ProcessingStage.REPORTING, ReportNarrative.class);
    }

    public QualityAssessment qualityAssessment() {
        return output(ProcessingStage.VALIDATING, QualityAssessment.class);
    }
}
