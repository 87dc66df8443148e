package com.williamcallahan.pftreport.web;

import com.williamcallahan.pftreport.domain.errors.ApiResponse;
import com.williamcallahan.pftreport.domain.errors.ReportNotReadyResponse;
import com.williamcallahan.pftreport.domain.pipeline.ProcessingStage;
import com.williamcallahan.pftreport.domain.pipeline.SubjectDemographics;
import com.williamcallahan.pftreport.domain.pipeline.Submission;
import com.williamcallahan.pftreport.domain.pipeline.SubmissionInput;
import com.williamcallahan.pftreport.domain.pipeline.TriagePriority;
import com.williamcallahan.pftreport.domain.report.DirectInterpretation;
import com.williamcallahan.pftreport.service.admission.AdmissionScheduler;
import com.williamcallahan.pftreport.service.admission.CapacityExceededException;
import com.williamcallahan.pftreport.service.progress.ProgressPublisher;
import com.williamcallahan.pftreport.service.query.ResultLookup;
import com.williamcallahan.pftreport.service.query.StatusQueryService;
import com.williamcallahan.pftreport.service.reasoning.ReasoningClient;
import com.williamcallahan.pftreport.service.registry.RegistryUnavailableException;
import com.williamcallahan.pftreport.service.registry.RequestNotFoundException;
import com.williamcallahan.pftreport.service.stage.DirectInterpretationException;
import com.williamcallahan.pftreport.service.stage.DirectInterpretationService;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * HTTP surface of the report pipeline: upload, status, live progress and report retrieval.
 *
 * <p>{@code /interpret} bypasses the pipeline for callers that already hold structured measurements.</p>
 */
@RestController
@RequestMapping("/api/pft")
public class PipelineController extends BaseController {
    private static final Logger log = LoggerFactory.getLogger(PipelineController.class);

    private final AdmissionScheduler admissionScheduler;
    private final StatusQueryService statusQueryService;
    private final ProgressPublisher progressPublisher;
    private final ReasoningClient reasoningClient;
    private final DirectInterpretationService directInterpretationService;
    private final SseSupport sseSupport;

    public PipelineController(
            AdmissionScheduler admissionScheduler,
            StatusQueryService statusQueryService,
            ProgressPublisher progressPublisher,
            ReasoningClient reasoningClient,
            DirectInterpretationService directInterpretationService,
            SseSupport sseSupport,
            ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.admissionScheduler = admissionScheduler;
        this.statusQueryService = statusQueryService;
        this.progressPublisher = progressPublisher;
        this.reasoningClient = reasoningClient;
        this.directInterpretationService = directInterpretationService;
        this.sseSupport = sseSupport;
    }

    /**
     * Accepts an artifact and its subject metadata; the report is produced asynchronously.
     */
    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<SubmissionResponse> upload(
            @RequestParam("file") MultipartFile file,
            @RequestParam("patientId") String patientId,
            @RequestParam("age") int age,
            @RequestParam("gender") String gender,
            @RequestParam("height") double height,
            @RequestParam("weight") double weight,
            @RequestParam(name = "ethnicity", required = false) String ethnicity,
            @RequestParam(name = "smokingStatus", required = false) String smokingStatus,
            @RequestParam(name = "priority", required = false) String priority,
            @RequestParam(name = "requestingPhysician", required = false) String requestingPhysician)
            throws IOException {
        SubmissionInput input = new SubmissionInput(
                file.getOriginalFilename(),
                file.getBytes(),
                new SubjectDemographics(patientId, age, gender, height, weight, ethnicity, smokingStatus),
                List.of(),
                TriagePriority.parse(priority),
                requestingPhysician);
        Submission submission = admissionScheduler.submit(input);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(SubmissionResponse.accepted(submission));
    }

    /**
     * Interprets and triages structured measurements in one call. No request id is issued and nothing
     * is stored.
     */
    @PostMapping(value = "/interpret", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<DirectInterpretation> interpret(@RequestBody DirectInterpretationRequest request) {
        return directInterpretationService.interpret(
                request.measurements(), request.patientDemographics(), request.history());
    }

    @GetMapping("/status/{requestId}")
    public StatusResponse status(@PathVariable("requestId") String requestId) {
        return StatusResponse.from(statusQueryService.status(requestId));
    }

    /**
     * Streams status changes for one request until it reaches a terminal stage.
     *
     * <p>The id is checked before the stream opens so an unknown id gets a plain 404 rather than an
     * event stream.</p>
     */
    @GetMapping(value = "/progress/{requestId}", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<Flux<ServerSentEvent<String>>> progress(
            @PathVariable("requestId") String requestId, HttpServletResponse response) {
        try {
            statusQueryService.status(requestId);
        } catch (RequestNotFoundException unknown) {
            return ResponseEntity.notFound().build();
        } catch (RegistryUnavailableException unavailable) {
            log.warn("Progress stream refused for {}: status store unavailable", requestId);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
        sseSupport.configureStreamingHeaders(response);
        Flux<ServerSentEvent<String>> events = progressPublisher.subscribe(requestId)
                .map(sseSupport::progressEvent)
                .onErrorResume(error -> streamError(requestId, error));
        return ResponseEntity.ok().contentType(MediaType.TEXT_EVENT_STREAM).body(events);
    }

    /**
     * Returns the finished report, or a not-ready payload while the request has not completed.
     */
    @GetMapping("/report/{requestId}")
    public ResponseEntity<?> report(@PathVariable("requestId") String requestId) {
        ResultLookup lookup = statusQueryService.result(requestId);
        if (lookup instanceof ResultLookup.Ready ready) {
            return ResponseEntity.ok(ready.report());
        }
        if (lookup instanceof ResultLookup.NotReady notReady) {
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(ReportNotReadyResponse.from(notReady.snapshot()));
        }
        return exceptionBuilder.buildErrorResponse(HttpStatus.NOT_FOUND, "Report not found: " + requestId);
    }

    @GetMapping("/health")
    public PipelineHealthResponse health() {
        long trackedRequests;
        String status = "healthy";
        try {
            trackedRequests = statusQueryService.trackedRequests();
        } catch (RegistryUnavailableException unavailable) {
            trackedRequests = -1;
            status = "degraded";
        }
        return new PipelineHealthResponse(
                status,
                Instant.now(),
                admissionScheduler.activeRuns(),
                admissionScheduler.queuedRuns(),
                admissionScheduler.maxConcurrentRuns(),
                trackedRequests,
                reasoningClient.isAvailable(),
                ProcessingStage.pipelineStages());
    }

    private Flux<ServerSentEvent<String>> streamError(String requestId, Throwable error) {
        String code;
        if (error instanceof RequestNotFoundException) {
            code = SseConstants.ERROR_CODE_REQUEST_NOT_FOUND;
        } else if (error instanceof RegistryUnavailableException) {
            code = SseConstants.ERROR_CODE_STORE_UNAVAILABLE;
        } else {
            code = SseConstants.ERROR_CODE_STREAM_FAILURE;
        }
        log.warn("Progress stream for {} ended with {}", requestId, error.getClass().getSimpleName());
        return sseSupport.sseError(SseSupport.SseEventPayload.builder("Progress stream interrupted")
                .details(error.getMessage())
                .code(code)
                .retryable(!(error instanceof RequestNotFoundException))
                .build());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse> handleInvalidSubmission(IllegalArgumentException invalid) {
        log.info("Rejected submission: {}", invalid.getMessage());
        return handleValidationException(invalid);
    }

    @ExceptionHandler(CapacityExceededException.class)
    public ResponseEntity<ApiResponse> handleCapacityExceeded(CapacityExceededException busy) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.TOO_MANY_REQUESTS, busy.getMessage());
    }

    @ExceptionHandler(RequestNotFoundException.class)
    public ResponseEntity<ApiResponse> handleNotFound(RequestNotFoundException notFound) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.NOT_FOUND, "Request not found: " + notFound.getRequestId());
    }

    @ExceptionHandler(RegistryUnavailableException.class)
    public ResponseEntity<ApiResponse> handleStoreUnavailable(RegistryUnavailableException unavailable) {
        log.error("Status store unavailable", unavailable);
        return exceptionBuilder.buildErrorResponse(
                HttpStatus.SERVICE_UNAVAILABLE, "Status store unavailable; try again later", unavailable);
    }

    @ExceptionHandler(DirectInterpretationException.class)
    public ResponseEntity<ApiResponse> handleInterpretationFailure(DirectInterpretationException failure) {
        log.error("Direct interpretation failed: {}", describeException(failure));
        return handleServiceException(failure, "interpret measurements");
    }

    @ExceptionHandler(IOException.class)
    public ResponseEntity<ApiResponse> handleUploadReadFailure(IOException unreadable) {
        log.error("Failed to read uploaded file", unreadable);
        return handleServiceException(unreadable, "read uploaded file");
    }
}
