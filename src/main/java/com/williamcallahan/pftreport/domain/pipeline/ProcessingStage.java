package com.williamcallahan.pftreport.domain.pipeline;

import java.util.Arrays;
import java.util.List;

/**
 * Ordered lifecycle of a processing request.
 *
 * <p>Non-terminal stages form a fixed total order; {@link #COMPLETED} and {@link #FAILED} are the two
 * alternative terminal states. Each non-terminal stage carries the progress value assigned when a run
 * enters it, so progress is strictly increasing across stage boundaries and reaches 100 only at
 * {@link #COMPLETED}. {@link #FAILED} has no progress of its own: a failed entry keeps the value it
 * had when the failure happened.</p>
 */
public enum ProcessingStage {
    QUEUED(0, "Queued for processing"),
    EXTRACTING(20, "Extracting and standardizing PFT data"),
    INTERPRETING(40, "Analyzing PFT results"),
    TRIAGING(60, "Assessing clinical priority"),
    REPORTING(80, "Generating professional report"),
    VALIDATING(95, "Validating report quality"),
    COMPLETED(100, "Processing completed successfully"),
    FAILED(-1, "Processing failed");

    private static final List<ProcessingStage> PIPELINE_STAGES = Arrays.stream(values())
            .filter(ProcessingStage::isPipelineStage)
            .toList();

    private final int entryProgress;
    private final String label;

    ProcessingStage(int entryProgress, String label) {
        this.entryProgress = entryProgress;
        this.label = label;
    }

    /**
     * Progress value written to the registry when a run enters this stage.
     *
     * @return progress percentage, or -1 for {@link #FAILED}
     */
    public int entryProgress() {
        return entryProgress;
    }

    /**
     * Human-readable description surfaced to clients as the current step.
     */
    public String label() {
        return label;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Whether a stage processor executes while the request sits in this stage.
     */
    public boolean isPipelineStage() {
        return this != QUEUED && !isTerminal();
    }

    /**
     * Checks whether moving from this stage to {@code next} respects the fixed forward order.
     *
     * <p>Any non-terminal stage may fail. Otherwise a move must go to the immediately following
     * stage, so the observed history is always a prefix of the order. Terminal stages never
     * transition.</p>
     *
     * @param next candidate next stage
     * @return true if the transition is permitted
     */
    public boolean canTransitionTo(ProcessingStage next) {
        if (isTerminal() || next == null || next == QUEUED) {
            return false;
        }
        if (next == FAILED) {
            return true;
        }
        return next.ordinal() == ordinal() + 1;
    }

    /**
     * Stages that have a stage processor, in execution order.
     */
    public static List<ProcessingStage> pipelineStages() {
        return PIPELINE_STAGES;
    }
}
