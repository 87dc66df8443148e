package com.williamcallahan.pftreport.service.admission;

import com.williamcallahan.pftreport.config.AppProperties;
import com.williamcallahan.pftreport.domain.pipeline.Submission;
import com.williamcallahan.pftreport.domain.pipeline.SubmissionInput;
import com.williamcallahan.pftreport.service.pipeline.PipelineOrchestrator;
import com.williamcallahan.pftreport.service.registry.RequestRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Admits submissions and dispatches their pipeline runs within a fixed concurrency bound.
 *
 * <p>A submission is validated, given a slot (or a place in the wait queue), assigned a fresh id and
 * registered as QUEUED before its run is started in the background. Capacity is reserved in the same
 * critical section that creates the status entry, so a rejected submission never leaves an entry
 * behind and a failed entry creation never holds a slot. When a run finishes its slot passes directly
 * to the oldest waiting submission.</p>
 */
@Service
public class AdmissionScheduler {
    private static final Logger log = LoggerFactory.getLogger(AdmissionScheduler.class);

    private static final Counter ACCEPTED_COUNTER = Metrics.counter("pftreport.admission.submissions", "result", "accepted");
    private static final Counter REJECTED_CAPACITY_COUNTER =
            Metrics.counter("pftreport.admission.submissions", "result", "rejected_capacity");
    private static final Counter REJECTED_INVALID_COUNTER =
            Metrics.counter("pftreport.admission.submissions", "result", "rejected_invalid");

    private final SubmissionValidator validator;
    private final RequestRegistry registry;
    private final PipelineOrchestrator orchestrator;
    private final AppProperties.Admission admissionSettings;
    private final Scheduler runScheduler;

    private final Object slotLock = new Object();
    private final Deque<PendingRun> pendingRuns = new ArrayDeque<>();
    private int activeRuns;

    @Autowired
    public AdmissionScheduler(
            SubmissionValidator validator,
            RequestRegistry registry,
            PipelineOrchestrator orchestrator,
            AppProperties appProperties) {
        this(validator, registry, orchestrator, appProperties, Schedulers.boundedElastic());
    }

    public AdmissionScheduler(
            SubmissionValidator validator,
            RequestRegistry registry,
            PipelineOrchestrator orchestrator,
            AppProperties appProperties,
            Scheduler runScheduler) {
        this.validator = validator;
        this.registry = registry;
        this.orchestrator = orchestrator;
        this.admissionSettings = appProperties.getAdmission();
        this.runScheduler = runScheduler;
        Metrics.gauge("pftreport.admission.active_runs", this, AdmissionScheduler::activeRuns);
        Metrics.gauge("pftreport.admission.queued_runs", this, AdmissionScheduler::queuedRuns);
    }

    /**
     * Admits a submission and starts (or queues) its run.
     *
     * @param input uploaded artifact and metadata
     * @return acknowledgement carrying the new request id in stage QUEUED
     * @throws SubmissionValidationException when the input is structurally invalid
     * @throws CapacityExceededException when no slot or queue place is available
     * @throws com.williamcallahan.pftreport.service.registry.RegistryUnavailableException when the
     *     status store cannot be written
     */
    public Submission submit(SubmissionInput input) {
        try {
            validator.validate(input);
        } catch (SubmissionValidationException invalid) {
            REJECTED_INVALID_COUNTER.increment();
            throw invalid;
        }

        String requestId;
        boolean startNow;
        synchronized (slotLock) {
            startNow = activeRuns < admissionSettings.getMaxConcurrentRuns();
            if (!startNow) {
                rejectIfFull();
            }
            requestId = UUID.randomUUID().toString();
            registry.create(requestId);
            if (startNow) {
                activeRuns++;
            } else {
                pendingRuns.addLast(new PendingRun(requestId, input));
            }
        }
        ACCEPTED_COUNTER.increment();

        if (startNow) {
            log.info("Admitted request {} ({}), starting run", requestId, input);
            dispatch(requestId, input);
        } else {
            log.info("Admitted request {} ({}), waiting for a run slot", requestId, input);
        }
        return Submission.queued(requestId);
    }

    private void rejectIfFull() {
        AppProperties.OverflowPolicy policy = admissionSettings.getOverflowPolicy();
        if (policy == AppProperties.OverflowPolicy.REJECT) {
            REJECTED_CAPACITY_COUNTER.increment();
            throw new CapacityExceededException("All " + admissionSettings.getMaxConcurrentRuns()
                    + " processing slots are busy; try again later");
        }
        if (pendingRuns.size() >= admissionSettings.getQueueCapacity()) {
            REJECTED_CAPACITY_COUNTER.increment();
            throw new CapacityExceededException("Processing queue is full ("
                    + admissionSettings.getQueueCapacity() + " waiting); try again later");
        }
    }

    private void dispatch(String requestId, SubmissionInput input) {
        orchestrator.run(requestId, input)
                .subscribeOn(runScheduler)
                .doFinally(signal -> releaseSlot())
                .subscribe(
                        terminal -> log.debug("Run for request {} ended in {}", requestId, terminal.stage()),
                        error -> log.error("Run for request {} ended without a recorded outcome", requestId, error));
    }

    private void releaseSlot() {
        PendingRun next;
        synchronized (slotLock) {
            next = pendingRuns.pollFirst();
            if (next == null) {
                activeRuns--;
                return;
            }
        }
        log.debug("Slot handed to waiting request {}", next.requestId());
        dispatch(next.requestId(), next.input());
    }

    public int activeRuns() {
        synchronized (slotLock) {
            return activeRuns;
        }
    }

    public int queuedRuns() {
        synchronized (slotLock) {
            return pendingRuns.size();
        }
    }

    public int maxConcurrentRuns() {
        return admissionSettings.getMaxConcurrentRuns();
    }

    private record PendingRun(String requestId, SubmissionInput input) {}
}
